package com.maskid.backend.testsupport;

import com.maskid.backend.billing.BillingProvider;
import com.maskid.backend.billing.StripeBillingProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test") // ✅ 保險：不靠檔案也能強制 test
class ActiveProfileSmokeTest {

    @Autowired Environment env;
    @Autowired BillingProvider billing;

    @Test
    void should_use_test_profile_with_h2_and_no_outbound_calls() {
        assertThat(env.getActiveProfiles()).contains("test");
        assertThat(env.getProperty("spring.datasource.url")).startsWith("jdbc:h2:mem:");
        assertThat(env.getProperty("app.email.enabled")).isEqualTo("false");
        // stripe 關閉時只會有 noop provider
        assertThat(billing).isNotInstanceOf(StripeBillingProvider.class);
        assertThat(billing.fetchSubscriptionPeriodEnd("sub_any")).isEmpty();
    }
}
