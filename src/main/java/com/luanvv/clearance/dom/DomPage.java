package com.luanvv.clearance.dom;

import java.util.List;

/**
 * The browser page as seen by the crawler: navigation, control probing and a DOM snapshot.
 * Calls are strictly sequential; implementations are not thread-safe.
 */
public interface DomPage {

    /**
     * Navigates to {@code url} and waits for the DOM content to be loaded.
     *
     * @throws com.luanvv.clearance.core.CrawlException when the page cannot be reached
     */
    void navigate(String url, long timeoutMs);

    /** Current document URL, used as the base for relative links. */
    String url();

    /** All elements matching {@code selector}, in document order. */
    List<DomNode> queryAll(String selector);

    boolean isVisible(String selector);

    boolean isEnabled(String selector);

    /** Clicks the first element matching {@code selector}. */
    void click(String selector);

    /**
     * Waits until an element matching {@code selector} is attached.
     *
     * @return {@code false} on timeout
     */
    boolean waitFor(String selector, long timeoutMs);

    /** Waits for the document to settle after a click that may or may not navigate. */
    void waitForSettle(long settleMs);
}
