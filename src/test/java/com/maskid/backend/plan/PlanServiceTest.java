package com.maskid.backend.plan;

import com.maskid.backend.users.entity.PlanType;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class PlanServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private static UserRepo repoWith(User u) {
        UserRepo repo = Mockito.mock(UserRepo.class);
        Mockito.when(repo.findById(u.getId())).thenReturn(Optional.of(u));
        Mockito.when(repo.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        return repo;
    }

    private static User freeUser() {
        User u = new User();
        u.setId(7L);
        return u;
    }

    @Test
    void trial_sets_expiration_and_upgrade_clears_it() {
        User u = freeUser();
        var service = new PlanService(repoWith(u));

        service.startTrial(7L, 14, NOW);
        assertEquals(PlanType.TRIAL, u.getPlan());
        assertEquals(NOW.plusSeconds(14 * 86400L), u.getPlanExpiration());

        service.upgrade(7L, PlanType.YEARLY, "sub_123");
        assertEquals(PlanType.YEARLY, u.getPlan());
        assertNull(u.getPlanExpiration());
        assertEquals("sub_123", u.getStripeSubscriptionId());

        service.downgradeToFree(7L);
        assertEquals(PlanType.FREE, u.getPlan());
        assertNull(u.getPlanExpiration());
        assertNull(u.getStripeSubscriptionId());
    }

    @Test
    void cannot_upgrade_to_non_premium_plan() {
        var service = new PlanService(repoWith(freeUser()));
        var ex = assertThrows(IllegalArgumentException.class, () -> service.upgrade(7L, PlanType.TRIAL, null));
        assertEquals("INVALID_PLAN", ex.getMessage());
    }

    @Test
    void premium_user_cannot_start_trial() {
        User u = freeUser();
        u.changePlan(PlanType.MONTHLY, null);
        var service = new PlanService(repoWith(u));
        assertThrows(IllegalArgumentException.class, () -> service.startTrial(7L, 7, NOW));
    }
}
