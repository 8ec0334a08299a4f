package com.leadradar.crawl.browser;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.http.ReviewHttpClient;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);

    private final CrawlerProperties properties;

    public PlaywrightBrowserSessionFactory(CrawlerProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open() {
        if (!properties.getBrowser().isEnabled()) {
            throw new ScriptedFetchUnavailableException("Scripted browser disabled by configuration");
        }
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new ScriptedFetchUnavailableException("Playwright driver not available: " + e.getMessage(), e);
        }
        try {
            Browser browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions()
                    .setHeadless(properties.getBrowser().isHeadless())
                    .setArgs(List.of("--disable-blink-features=AutomationControlled"))
            );
            BrowserContext context = browser.newContext(
                new Browser.NewContextOptions()
                    .setUserAgent(properties.getUserAgent())
                    .setViewportSize(1920, 1080)
                    .setLocale("en-US")
                    .setTimezoneId("America/New_York")
                    .setExtraHTTPHeaders(Map.of(
                        "Accept", ReviewHttpClient.ACCEPT_HTML,
                        "Accept-Language", ReviewHttpClient.ACCEPT_LANGUAGE
                    ))
            );
            log.info("Launched chromium session (headless={})", properties.getBrowser().isHeadless());
            return new PlaywrightBrowserSession(playwright, browser, context);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new ScriptedFetchUnavailableException("Chromium could not be launched: " + e.getMessage(), e);
        }
    }
}
