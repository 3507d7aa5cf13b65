package com.maskid.backend.plan;

import com.maskid.backend.users.entity.PlanType;
import com.maskid.backend.users.entity.User;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PlanEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private final PlanEvaluator evaluator = new PlanEvaluator(3, 7);

    private static User user(PlanType plan, Instant trialExpiration) {
        User u = new User();
        u.setId(1L);
        u.changePlan(plan, trialExpiration);
        return u;
    }

    @Test
    void free_plan_quota_boundary() {
        User free = user(PlanType.FREE, null);
        assertTrue(evaluator.canCreateAlias(free, 2, NOW));
        assertFalse(evaluator.canCreateAlias(free, 3, NOW));
        assertFalse(evaluator.canCreateAlias(free, 10, NOW));
    }

    @Test
    void premium_plans_are_unlimited() {
        assertTrue(evaluator.canCreateAlias(user(PlanType.MONTHLY, null), 500, NOW));
        assertTrue(evaluator.canCreateAlias(user(PlanType.YEARLY, null), 500, NOW));
    }

    @Test
    void active_trial_is_unlimited_but_expired_trial_falls_back_to_free_limit() {
        User active = user(PlanType.TRIAL, NOW.plus(Duration.ofDays(1)));
        assertTrue(evaluator.canCreateAlias(active, 50, NOW));

        User expired = user(PlanType.TRIAL, NOW.minus(Duration.ofDays(1)));
        assertTrue(evaluator.canCreateAlias(expired, 2, NOW));
        assertFalse(evaluator.canCreateAlias(expired, 3, NOW));
        // plan 欄位不會被改寫
        assertEquals(PlanType.TRIAL, expired.getPlan());
    }

    @Test
    void upgrade_prompt_for_free_and_trial_ending_soon() {
        assertTrue(evaluator.shouldPromptUpgrade(user(PlanType.FREE, null), NOW));
        assertTrue(evaluator.shouldPromptUpgrade(user(PlanType.TRIAL, NOW.plus(Duration.ofDays(6))), NOW));
        assertFalse(evaluator.shouldPromptUpgrade(user(PlanType.TRIAL, NOW.plus(Duration.ofDays(8))), NOW));
        assertTrue(evaluator.shouldPromptUpgrade(user(PlanType.TRIAL, NOW.minus(Duration.ofDays(2))), NOW));
        assertFalse(evaluator.shouldPromptUpgrade(user(PlanType.MONTHLY, null), NOW));
        assertFalse(evaluator.shouldPromptUpgrade(user(PlanType.YEARLY, null), NOW));
    }

    @Test
    void premium_access_means_paid_or_trial_not_yet_expired() {
        assertTrue(evaluator.hasPremiumAccess(user(PlanType.MONTHLY, null), NOW));
        assertTrue(evaluator.hasPremiumAccess(user(PlanType.TRIAL, NOW.plusSeconds(60)), NOW));
        assertFalse(evaluator.hasPremiumAccess(user(PlanType.TRIAL, NOW), NOW));
        assertFalse(evaluator.hasPremiumAccess(user(PlanType.FREE, null), NOW));
    }
}
