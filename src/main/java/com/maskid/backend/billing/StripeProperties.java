package com.maskid.backend.billing;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.stripe")
public class StripeProperties {

    /** true 才會註冊 StripeBillingProvider */
    private boolean enabled = false;

    @ToString.Exclude
    private String apiKey;

    private String baseUrl = "https://api.stripe.com";

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(5);
}
