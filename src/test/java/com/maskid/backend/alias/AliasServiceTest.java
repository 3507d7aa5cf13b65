package com.maskid.backend.alias;

import com.maskid.backend.alias.entity.Alias;
import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.alias.service.AliasService;
import com.maskid.backend.alias.web.QuotaExceededException;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierGenerator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.plan.PlanEvaluator;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class AliasServiceTest {

    private final AliasRepo aliases = Mockito.mock(AliasRepo.class);
    private final UserRepo users = Mockito.mock(UserRepo.class);
    private final IdentifierGenerator generator = Mockito.mock(IdentifierGenerator.class);

    private AliasService service() {
        PlatformTransactionManager tx = Mockito.mock(PlatformTransactionManager.class);
        Mockito.when(tx.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        Mockito.when(generator.maxAttempts()).thenReturn(10);
        return new AliasService(aliases, users, new PlanEvaluator(3, 7), new IdentifierAllocator(generator, tx));
    }

    private User freeUser() {
        User u = new User();
        u.setId(1L);
        Mockito.when(users.findById(1L)).thenReturn(Optional.of(u));
        return u;
    }

    @Test
    void should_create_alias_under_quota() {
        freeUser();
        Mockito.when(aliases.countByUserId(1L)).thenReturn(2L);
        Mockito.when(generator.generate(IdentifierKind.ALIAS, "shop")).thenReturn("shop_042@maskid.io");
        Mockito.when(aliases.saveAndFlush(any(Alias.class))).thenAnswer(inv -> inv.getArgument(0));

        Alias a = service().create(1L, "shop", Instant.now());

        assertEquals("shop_042@maskid.io", a.getEmail());
        assertEquals(1L, a.getUserId());
        assertTrue(a.isEnabled());
    }

    @Test
    void should_throw_quota_exceeded_with_upgrade_action() {
        freeUser();
        Mockito.when(aliases.countByUserId(1L)).thenReturn(3L);

        var ex = assertThrows(QuotaExceededException.class, () -> service().create(1L, null, Instant.now()));

        assertEquals("QUOTA_EXCEEDED", ex.getMessage());
        assertEquals("UPGRADE", ex.clientAction());
        assertEquals(3, ex.limit());
        Mockito.verify(aliases, Mockito.never()).saveAndFlush(any());
    }

    @Test
    void should_not_toggle_alias_of_another_user() {
        Mockito.when(aliases.findByIdAndUserId(5L, 1L)).thenReturn(Optional.empty());

        var ex = assertThrows(IllegalArgumentException.class, () -> service().setEnabled(1L, 5L, false));
        assertEquals("ALIAS_NOT_FOUND", ex.getMessage());
    }
}
