package com.maskid.backend.users.entity;

public enum PlanType {
    FREE,
    TRIAL,
    MONTHLY,
    YEARLY;

    public boolean isPremium() {
        return this == MONTHLY || this == YEARLY;
    }
}
