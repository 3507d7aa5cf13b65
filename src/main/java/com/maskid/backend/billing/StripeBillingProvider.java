package com.maskid.backend.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

/** GET /v1/subscriptions/{id}，只取 current_period_end */
@Slf4j
public class StripeBillingProvider implements BillingProvider {

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    private final RestClient http;
    private final ObjectMapper om;

    public StripeBillingProvider(RestClient http, ObjectMapper om) {
        this.http = http;
        this.om = om;
    }

    @Override
    public Optional<Instant> fetchSubscriptionPeriodEnd(String subscriptionId) {
        String body;
        try {
            body = http.get()
                    .uri("/v1/subscriptions/{id}", subscriptionId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        throw new BillingHttpException(status, "STRIPE_HTTP_" + status,
                                readBodySnippetQuietly(res, MAX_ERROR_SNIPPET_BYTES));
                    })
                    .body(String.class);
        } catch (BillingHttpException e) {
            // 404：訂閱不存在（被刪或 id 錯）
            if (e.getStatus() == 404) {
                log.warn("stripe subscription not found: {}", subscriptionId);
                return Optional.empty();
            }
            throw e;
        }
        if (body == null || body.isBlank()) {
            throw new BillingHttpException(200, "STRIPE_EMPTY_BODY", null);
        }

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            String snippet = body.length() > 300 ? body.substring(0, 300) : body;
            throw new BillingHttpException(200, "STRIPE_JSON_PARSE_FAILED", snippet, e);
        }
        return periodEnd(root).map(Instant::ofEpochSecond);
    }

    /** 舊版 API 放在頂層；新版 API 移到 items.data[0] */
    static Optional<Long> periodEnd(JsonNode subscription) {
        JsonNode top = subscription.path("current_period_end");
        if (top.canConvertToLong()) return Optional.of(top.asLong());
        JsonNode item = subscription.path("items").path("data").path(0).path("current_period_end");
        if (item.canConvertToLong()) return Optional.of(item.asLong());
        return Optional.empty();
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res, int maxBytes) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(Math.max(0, maxBytes));
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.debug("read stripe error body failed: {}", e.toString());
            return null;
        }
    }
}
