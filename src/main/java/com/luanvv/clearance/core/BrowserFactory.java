package com.luanvv.clearance.core;

@FunctionalInterface
public interface BrowserFactory {

    /**
     * @throws CrawlException when the browser cannot be launched
     */
    BrowserHandle launch(boolean headless);
}
