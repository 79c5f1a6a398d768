package com.luanvv.clearance.core;

import com.luanvv.clearance.model.RawProduct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Mutable progress of one crawl, owned by {@link CrawlSession} and never shared.
 * Batches are appended as extracted; tiles seen again after a "load more" are kept again.
 */
@Getter
public class CrawlState {
    private final int pageBudget;
    private int pagesVisited;
    private final List<RawProduct> accumulated = new ArrayList<>();

    public CrawlState(int pageBudget) {
        if (pageBudget < 1) {
            throw new IllegalArgumentException("pageBudget must be at least 1, got " + pageBudget);
        }
        this.pageBudget = pageBudget;
    }

    public boolean budgetExhausted() {
        return pagesVisited >= pageBudget;
    }

    /** @return the 1-based number of the page being visited */
    public int startPage() {
        return ++pagesVisited;
    }

    public void append(List<RawProduct> batch) {
        accumulated.addAll(batch);
    }

    public List<RawProduct> getAccumulated() {
        return Collections.unmodifiableList(accumulated);
    }
}
