package com.maskid.backend.plan;

import com.maskid.backend.users.entity.PlanType;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * 方案狀態變更。trial 過期不需要這裡處理（PlanEvaluator 每次重算）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanService {

    private final UserRepo users;

    @Transactional
    public User startTrial(Long userId, int days, Instant now) {
        if (days <= 0) throw new IllegalArgumentException("TRIAL_DAYS_INVALID");
        User u = load(userId);
        if (u.isPremium()) throw new IllegalArgumentException("ALREADY_PREMIUM");
        u.changePlan(PlanType.TRIAL, now.plus(Duration.ofDays(days)));
        log.info("user {} starts trial until {}", u.getId(), u.getPlanExpiration());
        return users.save(u);
    }

    @Transactional
    public User upgrade(Long userId, PlanType plan, String stripeSubscriptionId) {
        if (plan == null || !plan.isPremium()) throw new IllegalArgumentException("INVALID_PLAN");
        User u = load(userId);
        u.changePlan(plan, null);
        u.setStripeSubscriptionId(stripeSubscriptionId);
        log.info("user {} upgraded to {}", u.getId(), plan);
        return users.save(u);
    }

    @Transactional
    public User downgradeToFree(Long userId) {
        User u = load(userId);
        u.changePlan(PlanType.FREE, null);
        u.setStripeSubscriptionId(null);
        log.info("user {} downgraded to FREE", u.getId());
        return users.save(u);
    }

    private User load(Long userId) {
        return users.findById(userId).orElseThrow(() -> new IllegalArgumentException("USER_NOT_FOUND"));
    }
}
