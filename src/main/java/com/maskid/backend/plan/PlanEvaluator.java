package com.maskid.backend.plan;

import com.maskid.backend.users.entity.PlanType;
import com.maskid.backend.users.entity.User;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 方案 / 額度判斷。純函式：(plan, planExpiration, 目前 alias 數, now)。
 * 不快取也不寫回 plan：trial 過期就直接以免費額度計算，每次呼叫都重算。
 */
@Component
public class PlanEvaluator {

    private final int maxAliasesFreePlan;
    private final Duration upgradePromptWindow;

    public PlanEvaluator(
            @Value("${app.alias.max-free:3}") int maxAliasesFreePlan,
            @Value("${app.plan.upgrade-prompt-days:7}") int upgradePromptDays
    ) {
        this.maxAliasesFreePlan = maxAliasesFreePlan;
        this.upgradePromptWindow = Duration.ofDays(upgradePromptDays);
    }

    public boolean shouldPromptUpgrade(User user) {
        return shouldPromptUpgrade(user, Instant.now());
    }

    /** FREE，或 TRIAL 且在提示期間內到期（含已過期） */
    public boolean shouldPromptUpgrade(User user, Instant now) {
        PlanType plan = user.getPlan();
        if (plan == PlanType.FREE) return true;
        if (plan == PlanType.TRIAL) {
            Instant exp = user.getPlanExpiration();
            return exp == null || exp.isBefore(now.plus(upgradePromptWindow));
        }
        return false;
    }

    public boolean canCreateAlias(User user, long currentAliasCount) {
        return canCreateAlias(user, currentAliasCount, Instant.now());
    }

    public boolean canCreateAlias(User user, long currentAliasCount, Instant now) {
        if (user.isPremium()) return true;
        if (isTrialActive(user, now)) return true;
        // free 或 trial 已過期
        return currentAliasCount < maxAliasesFreePlan;
    }

    public boolean isTrialActive(User user, Instant now) {
        return user.getPlan() == PlanType.TRIAL
                && user.getPlanExpiration() != null
                && user.getPlanExpiration().isAfter(now);
    }

    /** premium 或 trial 未到期，alias-mode=PREMIUM_ONLY 用 */
    public boolean hasPremiumAccess(User user, Instant now) {
        return user.isPremium() || isTrialActive(user, now);
    }

    public int maxAliasesFreePlan() {
        return maxAliasesFreePlan;
    }
}
