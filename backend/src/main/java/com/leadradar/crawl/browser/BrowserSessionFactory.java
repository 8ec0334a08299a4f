package com.leadradar.crawl.browser;

public interface BrowserSessionFactory {

    /**
     * Launches a new browser session.
     *
     * @throws ScriptedFetchUnavailableException when no browser can be started
     */
    BrowserSession open();
}
