package com.luanvv.clearance.core;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryerTest {

    private static Retryer retryer(int attempts) {
        Config.Retries cfg = new Config.Retries();
        cfg.setMaxAttempts(attempts);
        cfg.setBackoffMs(1);
        cfg.setMaxBackoffMs(1);
        return new Retryer(cfg);
    }

    @Test
    void returnsOnceCallSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String out = retryer(3).runWithRetry("op", () -> {
            if (calls.incrementAndGet() < 2) throw new IllegalStateException("flaky");
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void wrapsLastFailureAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryer(2).runWithRetry("navigate-start", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }))
            .isInstanceOf(CrawlException.class)
            .hasMessageContaining("navigate-start")
            .hasRootCauseMessage("boom");
        assertThat(calls.get()).isEqualTo(2);
    }
}
