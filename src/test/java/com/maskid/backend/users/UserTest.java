package com.maskid.backend.users;

import com.maskid.backend.users.entity.PlanType;
import com.maskid.backend.users.entity.User;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UserTest {

    @Test
    void email_is_stored_lower_case() {
        User u = new User();
        u.setEmail("  Son@Example.COM ");
        assertEquals("son@example.com", u.getEmail());
    }

    @Test
    void plan_expiration_only_for_trial() {
        User u = new User();
        assertEquals(PlanType.FREE, u.getPlan());
        assertNull(u.getPlanExpiration());

        assertThrows(IllegalArgumentException.class, () -> u.changePlan(PlanType.TRIAL, null));

        Instant exp = Instant.parse("2026-05-01T00:00:00Z");
        u.changePlan(PlanType.TRIAL, exp);
        assertEquals(exp, u.getPlanExpiration());

        // 非 trial 傳了到期時間也會被清掉
        u.changePlan(PlanType.MONTHLY, exp);
        assertNull(u.getPlanExpiration());
        assertTrue(u.isPremium());
    }

    @Test
    void promo_codes_append_in_order() {
        User u = new User();
        assertThat(u.getPromoCodeList()).isEmpty();

        u.saveNewPromoCode("WELCOME");
        u.saveNewPromoCode(" SPRING26 ");

        assertEquals(List.of("WELCOME", "SPRING26"), u.getPromoCodeList());
        assertEquals("WELCOME,SPRING26", u.getPromoCodes());
        assertThrows(IllegalArgumentException.class, () -> u.saveNewPromoCode("A,B"));
        assertThrows(IllegalArgumentException.class, () -> u.saveNewPromoCode(" "));
    }
}
