package com.webdynamo.contact_manager.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters exposed through /actuator/metrics
 */
@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    /**
     * One count per request that went through the rate limiter
     *
     * @param tier    "user" or "ip"
     * @param allowed false when the request was answered with 429
     */
    public void recordRateLimit(String tier, boolean allowed) {
        meterRegistry.counter("contact_manager.rate_limit",
                "tier", tier,
                "outcome", allowed ? "allowed" : "rejected"
        ).increment();
    }

    // Unknown user and wrong password are both plain failures
    public void recordLogin(boolean success) {
        meterRegistry.counter("contact_manager.logins",
                "result", success ? "success" : "failure"
        ).increment();
    }

    public void recordContactCreated() {
        meterRegistry.counter("contact_manager.contacts.created").increment();
    }

    public void recordSessionsPurged(int count) {
        meterRegistry.counter("contact_manager.sessions.purged").increment(count);
    }
}
