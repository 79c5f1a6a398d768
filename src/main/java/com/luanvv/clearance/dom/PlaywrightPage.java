package com.luanvv.clearance.dom;

import com.luanvv.clearance.core.CrawlException;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class PlaywrightPage implements DomPage {
    private final Page page;

    @Override
    public void navigate(String url, long timeoutMs) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setTimeout(timeoutMs)
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw new CrawlException("Cannot load " + url, e);
        }
    }

    @Override
    public String url() {
        return page.url();
    }

    @Override
    public List<DomNode> queryAll(String selector) {
        return page.querySelectorAll(selector).stream()
            .map(PlaywrightNode::new)
            .collect(Collectors.toList());
    }

    @Override
    public boolean isVisible(String selector) {
        try {
            return page.locator(selector).first().isVisible();
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public boolean isEnabled(String selector) {
        try {
            return page.locator(selector).first().isEnabled(new Locator.IsEnabledOptions().setTimeout(2000));
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public void click(String selector) {
        page.locator(selector).first().click();
    }

    @Override
    public boolean waitFor(String selector, long timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeoutMs));
            return true;
        } catch (PlaywrightException e) {
            log.debug("Selector {} not attached after {} ms: {}", selector, timeoutMs, e.getMessage());
            return false;
        }
    }

    @Override
    public void waitForSettle(long settleMs) {
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        if (settleMs > 0) {
            page.waitForTimeout(settleMs);
        }
    }
}
