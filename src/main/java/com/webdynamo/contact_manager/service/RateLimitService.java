package com.webdynamo.contact_manager.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.webdynamo.contact_manager.config.RateLimitConfig;
import com.webdynamo.contact_manager.util.RequestUtils;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * In-memory token buckets, one per username or per client IP.
 * The bucket cache is bounded and idle callers expire.
 */
@Service
@Slf4j
public class RateLimitService {

    public static final String TIER_USER = "user";
    public static final String TIER_IP = "ip";

    private final RateLimitConfig rateLimitConfig;

    private final Cache<String, Bucket> buckets;

    public RateLimitService(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(rateLimitConfig.getMaxTrackedCallers())
                .expireAfterAccess(rateLimitConfig.getIdleExpiry())
                .build();
    }

    /**
     * Outcome of one consumption attempt
     *
     * @param tier              {@link #TIER_USER} or {@link #TIER_IP}
     * @param allowed           whether the request may proceed
     * @param remaining         tokens left after this request
     * @param retryAfterSeconds whole seconds until a token is available again, 0 when allowed
     */
    public record Decision(String tier, boolean allowed, long remaining, long retryAfterSeconds) {
    }

    /**
     * Address that anonymous requests are limited by. Forwarding headers count only
     * when the connection comes from a configured trusted proxy.
     */
    public String resolveClientIp(HttpServletRequest request) {
        return RequestUtils.getClientIP(request, rateLimitConfig.getTrustedProxies());
    }

    /**
     * Take one token for the caller. Authenticated callers are keyed by username,
     * everyone else by client IP.
     *
     * @param username authenticated username, or null for anonymous requests
     * @param clientIp client address used when there is no username
     */
    public Decision consume(String username, String clientIp) {
        boolean authenticated = username != null;
        String tier = authenticated ? TIER_USER : TIER_IP;
        RateLimitConfig.Tier limits = authenticated
                ? rateLimitConfig.getAuthenticated()
                : rateLimitConfig.getUnauthenticated();

        String key = tier + ":" + (authenticated ? username : clientIp);
        Bucket bucket = buckets.get(key, k -> newBucket(limits));

        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            return new Decision(tier, true, consumption.getRemainingTokens(), 0);
        }

        long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(consumption.getNanosToWaitForRefill() + 999_999_999L));
        log.debug("Bucket {} is empty, retry after {}s", key, retryAfter);
        return new Decision(tier, false, 0, retryAfter);
    }

    long trackedBuckets() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private static Bucket newBucket(RateLimitConfig.Tier limits) {
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(limits.getCapacity())
                .refillIntervally(limits.getRefillTokens(), limits.getRefillDuration())
                .build();
        return Bucket.builder()
                .addLimit(bandwidth)
                .build();
    }
}
