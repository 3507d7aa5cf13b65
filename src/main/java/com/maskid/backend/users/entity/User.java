package com.maskid.backend.users.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Getter
@Setter
@ToString
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_users_email", columnNames = {"email"})
        }
)
public class User {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, length = 128)
    private String email;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    /** BCrypt hash（salt 內含在 hash 裡） */
    @ToString.Exclude
    @Column(name = "password", nullable = false, length = 128)
    private String password;

    @Column(name = "is_admin", nullable = false)
    private boolean admin = false;

    @Column(name = "activated", nullable = false)
    private boolean activated = false;

    @Enumerated(EnumType.STRING)
    @Setter(lombok.AccessLevel.NONE)
    @Column(name = "plan", nullable = false, length = 16)
    private PlanType plan = PlanType.FREE;

    /** 只有 TRIAL 才有值，見 {@link #changePlan} */
    @Setter(lombok.AccessLevel.NONE)
    @Column(name = "plan_expiration")
    private Instant planExpiration;

    @ToString.Exclude
    @Column(name = "stripe_customer_id", unique = true, length = 128)
    private String stripeCustomerId;

    @ToString.Exclude
    @Column(name = "stripe_subscription_id", unique = true, length = 128)
    private String stripeSubscriptionId;

    @Column(name = "profile_picture_id")
    private Long profilePictureId;

    @Column(name = "is_developer", nullable = false)
    private boolean developer = false;

    /** 用過的 promo code，以 "," 串接 */
    @Column(name = "promo_codes", columnDefinition = "TEXT")
    private String promoCodes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** 統一以小寫寫入，避免大小寫造成重複帳號 */
    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase();
    }

    /**
     * plan_expiration 有值 ⇔ plan = TRIAL。
     * TRIAL 必須帶到期時間；其他方案一律清掉。
     */
    public void changePlan(PlanType plan, Instant trialExpiration) {
        if (plan == null) throw new IllegalArgumentException("PLAN_REQUIRED");
        if (plan == PlanType.TRIAL) {
            if (trialExpiration == null) throw new IllegalArgumentException("TRIAL_EXPIRATION_REQUIRED");
            this.planExpiration = trialExpiration;
        } else {
            this.planExpiration = null;
        }
        this.plan = plan;
    }

    public boolean isPremium() {
        return plan != null && plan.isPremium();
    }

    public List<String> getPromoCodeList() {
        if (promoCodes == null || promoCodes.isBlank()) return List.of();
        return Arrays.stream(promoCodes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public void saveNewPromoCode(String promoCode) {
        if (promoCode == null || promoCode.isBlank()) throw new IllegalArgumentException("PROMO_CODE_REQUIRED");
        String code = promoCode.trim();
        if (code.contains(",")) throw new IllegalArgumentException("PROMO_CODE_INVALID");
        List<String> current = new ArrayList<>(getPromoCodeList());
        current.add(code);
        this.promoCodes = String.join(",", current);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
