package com.maskid.backend.oauth;

import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.ClientUser;
import com.maskid.backend.oauth.model.DisclosureChannel;
import com.maskid.backend.oauth.repo.ClientUserRepo;
import com.maskid.backend.oauth.repo.OauthTokenRepo;
import com.maskid.backend.oauth.service.AuthorizationService;
import com.maskid.backend.oauth.service.ClientService;
import com.maskid.backend.oauth.service.ConsentBindingService;
import com.maskid.backend.oauth.web.InvalidGrantException;
import com.maskid.backend.testsupport.MySqlContainerBaseTest;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/** 真的 MySQL 上跑的併發測試：code 只能換一次、binding 只會有一筆 */
@SpringBootTest
class ConcurrencyMySqlTest extends MySqlContainerBaseTest {

    private static final String REDIRECT = "https://shop.example/callback";
    private static final int THREADS = 6;

    @Autowired UserRepo users;
    @Autowired AliasRepo aliases;
    @Autowired ClientUserRepo bindings;
    @Autowired OauthTokenRepo tokens;
    @Autowired ClientService clientService;
    @Autowired ConsentBindingService consent;
    @Autowired AuthorizationService authorization;

    private User newUser() {
        User u = new User();
        u.setEmail("race-" + UUID.randomUUID() + "@example.com");
        u.setName("Racer");
        u.setPassword("{bcrypt}unused");
        u.setActivated(true);
        return users.save(u);
    }

    @Test
    void concurrent_exchanges_of_one_code_yield_exactly_one_token() throws Exception {
        User dev = newUser();
        User user = newUser();
        Client client = clientService.create(dev.getId(), "Race Shop", null);
        clientService.addRedirectUri(dev.getId(), client.getId(), REDIRECT);
        String code = authorization.authorize(user.getId(), client.getOauthClientId(), REDIRECT, "email", Instant.now()).code();

        List<Object> outcomes = race(() -> {
            try {
                return authorization.exchange("authorization_code", code, REDIRECT,
                        client.getOauthClientId(), client.getOauthClientSecret(), Instant.now());
            } catch (InvalidGrantException e) {
                return e;
            }
        });

        long ok = outcomes.stream().filter(o -> o instanceof AuthorizationService.TokenResult).count();
        long rejected = outcomes.stream().filter(o -> o instanceof InvalidGrantException).count();
        assertThat(ok).isEqualTo(1);
        assertThat(rejected).isEqualTo(THREADS - 1);
        assertThat(tokens.findAll().stream().filter(t -> t.getUserId().equals(user.getId())).count()).isEqualTo(1);
    }

    @Test
    void concurrent_first_consents_produce_one_binding_and_one_alias() throws Exception {
        User dev = newUser();
        User user = newUser();
        Client client = clientService.create(dev.getId(), "Consent Shop", null);

        List<Object> outcomes = race(() ->
                consent.getOrCreateBinding(client, user, Instant.now()));

        List<Long> ids = outcomes.stream().map(o -> ((ClientUser) o).getId()).distinct().toList();
        assertThat(ids).hasSize(1);
        assertThat(bindings.findByClientIdAndUserId(client.getId(), user.getId()))
                .get()
                .satisfies(cu -> assertThat(cu.getChannel()).isInstanceOf(DisclosureChannel.Alias.class));
        // 輸家的 alias 跟著 rollback
        assertThat(aliases.countByUserId(user.getId())).isEqualTo(1);
    }

    private static List<Object> race(Callable<Object> task) throws InterruptedException, ExecutionException {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<Object> out = new ArrayList<>();
            for (var f : futures) out.add(f.get(30, TimeUnit.SECONDS));
            return out;
        } catch (TimeoutException e) {
            throw new AssertionError("race did not finish", e);
        } finally {
            pool.shutdownNow();
        }
    }
}
