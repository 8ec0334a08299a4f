package com.leadradar.crawl.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Playwright;

class PlaywrightBrowserSession implements BrowserSession {
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
    }

    @Override
    public BrowserPage newPage() {
        return new PlaywrightBrowserPage(context.newPage());
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }
}
