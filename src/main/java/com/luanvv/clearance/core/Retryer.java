package com.luanvv.clearance.core;

import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;

    public <T> T runWithRetry(String opName, Callable<T> callable) {
        long delay = Math.max(100, cfg.getBackoffMs());
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        int attempts = 0;
        Exception last = null;
        while (attempts < maxAttempts) {
            attempts++;
            try {
                return callable.call();
            } catch (Exception e) {
                last = e;
                log.warn("{} failed on attempt {}/{}: {}", opName, attempts, maxAttempts, e.toString());
                if (attempts >= maxAttempts) break;
                sleep(delay);
                delay = Math.min(cfg.getMaxBackoffMs(), delay * 2);
            }
        }
        if (last instanceof CrawlException crawlException) {
            throw crawlException;
        }
        throw new CrawlException(opName + " failed after " + attempts + " attempts", last);
    }

    private static void sleep(long delay) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while backing off", e);
        }
    }
}
