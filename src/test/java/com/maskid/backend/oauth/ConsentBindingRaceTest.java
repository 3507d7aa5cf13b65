package com.maskid.backend.oauth;

import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.ClientUser;
import com.maskid.backend.oauth.model.DisclosureChannel;
import com.maskid.backend.oauth.repo.ClientUserRepo;
import com.maskid.backend.oauth.service.ClientService;
import com.maskid.backend.oauth.service.ConsentBindingService;
import com.maskid.backend.testsupport.BaseSpringTest;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/** H2 上的第一次授權併發：大家拿到同一筆 binding，只留下一個 alias */
@SpringBootTest
class ConsentBindingRaceTest extends BaseSpringTest {

    private static final int THREADS = 6;

    @Autowired UserRepo users;
    @Autowired AliasRepo aliases;
    @Autowired ClientUserRepo bindings;
    @Autowired ClientService clientService;
    @Autowired ConsentBindingService consent;

    private User newUser() {
        User u = new User();
        u.setEmail("race-" + UUID.randomUUID() + "@example.com");
        u.setName("Racer");
        u.setPassword("{bcrypt}unused");
        u.setActivated(true);
        return users.save(u);
    }

    @Test
    void concurrent_first_consents_share_one_binding_and_one_alias() throws Exception {
        User dev = newUser();
        User user = newUser();
        Client client = clientService.create(dev.getId(), "Race Shop", null);

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> ids = new ArrayList<>();
        try {
            List<Future<ClientUser>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return consent.getOrCreateBinding(client, user, Instant.now());
                }));
            }
            start.countDown();
            for (var f : futures) ids.add(f.get(30, TimeUnit.SECONDS).getId());
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(THREADS);
        assertThat(ids.stream().distinct().toList()).hasSize(1);
        assertThat(bindings.findAll().stream()
                .filter(cu -> cu.getClientId().equals(client.getId()) && cu.getUserId().equals(user.getId()))
                .count()).isEqualTo(1);
        assertThat(bindings.findByClientIdAndUserId(client.getId(), user.getId()))
                .get()
                .satisfies(cu -> assertThat(cu.getChannel()).isInstanceOf(DisclosureChannel.Alias.class));
        // 輸家的 alias 跟著 rollback
        assertThat(aliases.countByUserId(user.getId())).isEqualTo(1);
    }
}
