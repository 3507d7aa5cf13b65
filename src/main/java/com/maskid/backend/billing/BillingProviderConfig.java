package com.maskid.backend.billing;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.Optional;

@Configuration
@EnableConfigurationProperties(StripeProperties.class)
public class BillingProviderConfig {

    @Bean("stripeRestClient")
    @ConditionalOnProperty(prefix = "app.stripe", name = "enabled", havingValue = "true")
    public RestClient stripeRestClient(StripeProperties props) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new IllegalStateException("app.stripe.api-key is required when app.stripe.enabled=true");
        }
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.stripe", name = "enabled", havingValue = "true")
    public BillingProvider stripeBillingProvider(@Qualifier("stripeRestClient") RestClient http, ObjectMapper om) {
        return new StripeBillingProvider(http, om);
    }

    /** 沒開 stripe（dev / test）：一律查不到 */
    @Bean
    @ConditionalOnMissingBean(BillingProvider.class)
    public BillingProvider noopBillingProvider() {
        return subscriptionId -> Optional.empty();
    }
}
