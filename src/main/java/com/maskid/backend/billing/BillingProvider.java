package com.maskid.backend.billing;

import java.time.Instant;
import java.util.Optional;

public interface BillingProvider {

    /**
     * 只讀查詢：目前付費週期的結束時間（顯示用）。
     * 查不到回 empty；供應商連線 / HTTP 錯誤以 {@link BillingHttpException} 拋出。
     */
    Optional<Instant> fetchSubscriptionPeriodEnd(String subscriptionId);
}
