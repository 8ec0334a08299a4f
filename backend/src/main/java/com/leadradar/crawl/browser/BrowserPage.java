package com.leadradar.crawl.browser;

/**
 * One open tab. Navigation timeouts surface as {@link BrowserTimeoutException}.
 */
public interface BrowserPage {

    void navigate(String url, NavigationWait wait, int timeoutMs);

    String content();

    void evaluate(String script);

    boolean waitForSelector(String selector, int timeoutMs);

    boolean clickIfPresent(String selector);

    void close();
}
