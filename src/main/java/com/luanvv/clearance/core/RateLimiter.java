package com.luanvv.clearance.core;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Token bucket in front of every browser action that hits the merchant site
 * (start page load, "load more" and "next page" clicks).
 */
@Slf4j
public class RateLimiter {
    private final Bucket bucket;

    public RateLimiter(Config.RateLimit cfg) {
        long actionsPerSecond = Math.max(1, Math.round(Math.max(0.1, cfg.getPermitsPerSecond())));
        Bandwidth limit = Bandwidth.builder()
                .capacity(Math.max(cfg.getBurst(), 1))
                .refillGreedy(actionsPerSecond, Duration.ofSeconds(1))
                .build();
        bucket = Bucket.builder().addLimit(limit).build();
    }

    /**
     * Blocks until {@code action} may hit the site.
     *
     * @throws CrawlException when interrupted while waiting
     */
    public void acquire(String action) {
        if (bucket.tryConsume(1)) {
            return;
        }
        log.debug("Throttling {}", action);
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while throttling " + action, e);
        }
    }

    public long availableActions() {
        return bucket.getAvailableTokens();
    }
}
