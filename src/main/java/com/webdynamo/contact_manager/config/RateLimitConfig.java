package com.webdynamo.contact_manager.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "rate-limit")
@Data
public class RateLimitConfig {

    /**
     * Callers with a valid session, limited per username
     */
    private Tier authenticated = new Tier(100, 100, Duration.ofMinutes(1));

    /**
     * Anonymous callers (register, login, rejected tokens), limited per client IP
     */
    private Tier unauthenticated = new Tier(20, 20, Duration.ofMinutes(1));

    /**
     * Remote addresses of reverse proxies whose X-Forwarded-For / X-Real-IP headers are believed.
     * Empty means no proxy is trusted and the socket address is always used.
     */
    private List<String> trustedProxies = new ArrayList<>();

    /**
     * Upper bound on buckets held in memory; least recently used callers are dropped first
     */
    private long maxTrackedCallers = 100_000;

    /**
     * A caller's bucket is forgotten after this long without requests
     */
    private Duration idleExpiry = Duration.ofMinutes(10);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {
        private long capacity;
        private long refillTokens;
        private Duration refillDuration;
    }
}
