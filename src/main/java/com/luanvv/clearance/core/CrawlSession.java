package com.luanvv.clearance.core;

import com.luanvv.clearance.dom.DomPage;
import com.luanvv.clearance.extract.ProductExtractor;
import com.luanvv.clearance.model.Product;
import com.luanvv.clearance.model.RawProduct;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * One full crawl: walk the listing with a single browser page, then download images, then write
 * the outputs. The browser is closed before the download phase starts.
 */
@Slf4j
public class CrawlSession {
    private final Config config;
    private final BrowserFactory browserFactory;
    private final ProductExtractor extractor;
    private final ImageDownloader downloader;
    private final OutputWriters writers;

    public CrawlSession(Config config) {
        this(config,
            BrowserSession.factory(config.getLocale()),
            new ImageDownloader(config.getDownload(), config.imageDir()),
            new OutputWriters(config.getOutput()));
    }

    public CrawlSession(Config config, BrowserFactory browserFactory, ImageDownloader downloader,
                        OutputWriters writers) {
        this.config = config;
        this.browserFactory = browserFactory;
        this.extractor = new ProductExtractor(config.getSelectors());
        this.downloader = downloader;
        this.writers = writers;
    }

    /**
     * @throws CrawlException when the browser cannot start or the start page is unreachable;
     *     nothing is written in that case
     */
    public CrawlResult run(String startUrl, int pageBudget, boolean headless) {
        CrawlState state = new CrawlState(pageBudget);

        try (BrowserHandle browser = browserFactory.launch(headless)) {
            DomPage page = browser.page();
            NavigationController nav = new NavigationController(page, config,
                new RateLimiter(config.getRateLimit()), new Retryer(config.getRetries()));
            nav.open(startUrl);
            walk(nav, page, state);
        }

        List<Product> products = downloader.downloadAll(state.getAccumulated());
        OutputReport report = writers.write(products);
        logSummary(products, state);
        return new CrawlResult(products, state.getPagesVisited(), report);
    }

    private void walk(NavigationController nav, DomPage page, CrawlState state) {
        while (!state.budgetExhausted()) {
            nav.awaitReady();
            int pageNo = state.startPage();
            long startTime = System.currentTimeMillis();
            List<RawProduct> batch = extractSafely(page, pageNo);
            state.append(batch);
            log.info("Page {}: {} products ({} ms)", pageNo, batch.size(), System.currentTimeMillis() - startTime);

            if (state.budgetExhausted()) {
                log.info("Page budget of {} reached", state.getPageBudget());
                break;
            }
            if (nav.advance() == NavState.DONE) {
                break;
            }
        }
    }

    private List<RawProduct> extractSafely(DomPage page, int pageNo) {
        try {
            return extractor.extract(page);
        } catch (RuntimeException e) {
            log.warn("Extraction failed on page {}: {}", pageNo, e.getMessage());
            return Collections.emptyList();
        }
    }

    private void logSummary(List<Product> products, CrawlState state) {
        long liquidation = products.stream().filter(Product::isLiquidation).count();
        long images = products.stream().filter(p -> p.getImagePath() != null).count();
        log.info("Crawl finished: {} products over {} pages, {} flagged liquidation, {} images saved",
            products.size(), state.getPagesVisited(), liquidation, images);
    }
}
