package com.leadradar.crawl.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class PlaywrightBrowserPage implements BrowserPage {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserPage.class);
    static final int CLICK_TIMEOUT_MS = 5000;

    private final Page page;

    PlaywrightBrowserPage(Page page) {
        this.page = page;
    }

    @Override
    public void navigate(String url, NavigationWait wait, int timeoutMs) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(toWaitUntil(wait))
                .setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            throw new BrowserTimeoutException("Navigation to " + url + " timed out waiting for " + wait, e);
        }
    }

    @Override
    public String content() {
        return page.content();
    }

    @Override
    public void evaluate(String script) {
        page.evaluate(script);
    }

    @Override
    public boolean waitForSelector(String selector, int timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeoutMs));
            return true;
        } catch (TimeoutError e) {
            return false;
        }
    }

    @Override
    public boolean clickIfPresent(String selector) {
        Locator locator = page.locator(selector);
        if (locator.count() == 0) {
            return false;
        }
        try {
            locator.first().click(new Locator.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
            return true;
        } catch (PlaywrightException e) {
            log.debug("Could not click {}: {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!page.isClosed()) {
            page.close();
        }
    }

    private static WaitUntilState toWaitUntil(NavigationWait wait) {
        return switch (wait) {
            case DOM_CONTENT_LOADED -> WaitUntilState.DOMCONTENTLOADED;
            case LOAD -> WaitUntilState.LOAD;
            case COMMIT -> WaitUntilState.COMMIT;
        };
    }
}
