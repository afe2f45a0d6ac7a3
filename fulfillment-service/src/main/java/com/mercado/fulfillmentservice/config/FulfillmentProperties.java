package com.mercado.fulfillmentservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "fulfillment")
public class FulfillmentProperties {

    private Reservation reservation = new Reservation();
    private Webhook webhook = new Webhook();
    private Retry retry = new Retry();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Reservation {
        private Duration ttl = Duration.ofMinutes(15);
        // extra time a hold may gain over its lifetime, across all extend calls
        private Duration maxExtension = Duration.ofMinutes(15);
        private Duration expirySweepInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Webhook {
        private int maxRetries = 5;
        private Duration initialBackoff = Duration.ofMinutes(1);
        private Duration maxBackoff = Duration.ofMinutes(60);
        private int retryBatchSize = 10;
        private Duration retryInterval = Duration.ofSeconds(60);
        // a PENDING event untouched this long is treated as an interrupted attempt
        private Duration stalePendingAfter = Duration.ofMinutes(10);
        private String defaultSecret;
        // provider name -> HMAC secret
        private Map<String, String> secrets = new HashMap<>();
    }

    /**
     * Lock and serialization failures in checkout and reservation paths.
     */
    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 50;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
    }
}
