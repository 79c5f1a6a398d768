package com.luanvv.clearance.core;

import com.luanvv.clearance.dom.DomPage;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the single browser page through the listing: initial load, interstitial dismissal,
 * then one transition per iteration ("load more" first, "next page" second, otherwise done).
 */
@Slf4j
public class NavigationController {
    private final DomPage page;
    private final Config config;
    private final RateLimiter limiter;
    private final Retryer retryer;
    @Getter private NavState state = NavState.LOADING_INITIAL;

    public NavigationController(DomPage page, Config config, RateLimiter limiter, Retryer retryer) {
        this.page = page;
        this.config = config;
        this.limiter = limiter;
        this.retryer = retryer;
    }

    /**
     * Loads the start page. Failure here is fatal for the session.
     *
     * @throws CrawlException when the page stays unreachable after retries
     */
    public void open(String startUrl) {
        state = NavState.LOADING_INITIAL;
        long timeoutMs = config.getTimeouts().getNavigationMs();
        log.info("Go to: {}", startUrl);
        retryer.runWithRetry("navigate-start", () -> {
            limiter.acquire("navigate " + startUrl);
            page.navigate(startUrl, timeoutMs);
            return true;
        });
        dismissInterstitial();
        state = NavState.READY;
    }

    /**
     * Clicks the first visible close/later button of a store-selection modal, if any.
     *
     * @return whether something was clicked
     */
    public boolean dismissInterstitial() {
        for (String selector : config.getSelectors().getInterstitial()) {
            if (!page.isVisible(selector)) {
                continue;
            }
            try {
                page.click(selector);
                log.info("Dismissed interstitial via {}", selector);
                return true;
            } catch (RuntimeException e) {
                log.debug("Interstitial click on {} failed: {}", selector, e.getMessage());
                return false;
            }
        }
        return false;
    }

    /**
     * Waits for the product list. A timeout is not an error: some templates never render the
     * list wrapper and the tiles are extracted as they are.
     */
    public boolean awaitReady() {
        List<String> candidates = config.getSelectors().getWaitForList();
        boolean found = candidates.isEmpty()
            || page.waitFor(String.join(", ", candidates), config.getTimeouts().getListWaitMs());
        if (!found) {
            log.warn("Product list not found on {}, extracting what is there", page.url());
        }
        state = NavState.READY;
        return found;
    }

    /**
     * Picks and performs the next transition.
     *
     * @return {@link NavState#EXPANDING}, {@link NavState#PAGINATING} or {@link NavState#DONE}
     */
    public NavState advance() {
        Optional<String> loadMore = firstVisible(config.getSelectors().getLoadMore(), false);
        if (loadMore.isPresent()) {
            state = clickAndSettle(loadMore.get(), NavState.EXPANDING);
            return state;
        }
        Optional<String> next = firstVisible(config.getSelectors().getNext(), true);
        if (next.isPresent()) {
            state = clickAndSettle(next.get(), NavState.PAGINATING);
            return state;
        }
        log.info("No pagination control left");
        state = NavState.DONE;
        return state;
    }

    private NavState clickAndSettle(String selector, NavState target) {
        try {
            limiter.acquire(target + " via " + selector);
            page.click(selector);
            page.waitForSettle(config.getTimeouts().getSettleMs());
            log.debug("{} via {}", target, selector);
            return target;
        } catch (RuntimeException e) {
            log.warn("Could not follow {} ({}): {}", selector, target, e.getMessage());
            return NavState.DONE;
        }
    }

    private Optional<String> firstVisible(List<String> selectors, boolean mustBeEnabled) {
        return selectors.stream()
            .filter(page::isVisible)
            .filter(s -> !mustBeEnabled || page.isEnabled(s))
            .findFirst();
    }
}
