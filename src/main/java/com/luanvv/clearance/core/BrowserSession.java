package com.luanvv.clearance.core;

import com.luanvv.clearance.dom.DomPage;
import com.luanvv.clearance.dom.PlaywrightPage;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class BrowserSession implements BrowserHandle {
    private final boolean headless;
    private final String locale;
    @Getter private Playwright playwright;
    @Getter private Browser browser;
    @Getter private BrowserContext context;
    private DomPage page;

    /** Factory for {@link CrawlSession} that launches Chromium with the configured locale. */
    public static BrowserFactory factory(String locale) {
        return headless -> {
            BrowserSession session = new BrowserSession(headless, locale);
            session.start();
            return session;
        };
    }

    public void start() {
        try {
            playwright = Playwright.create();
            BrowserType chromium = playwright.chromium();
            browser = chromium.launch(new BrowserType.LaunchOptions().setHeadless(headless));
            Browser.NewContextOptions options = new Browser.NewContextOptions();
            if (locale != null && !locale.isBlank()) {
                options.setLocale(locale);
            }
            context = browser.newContext(options);
            Page raw = context.newPage();
            page = new PlaywrightPage(raw);
        } catch (PlaywrightException e) {
            close();
            throw new CrawlException("Cannot launch browser", e);
        }
    }

    @Override
    public DomPage page() {
        if (page == null) {
            throw new IllegalStateException("Browser session not started");
        }
        return page;
    }

    @Override
    public void close() {
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser cleanly: {}", e.getMessage());
        } finally {
            if (playwright != null) playwright.close();
        }
    }
}
