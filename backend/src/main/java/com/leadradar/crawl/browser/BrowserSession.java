package com.leadradar.crawl.browser;

public interface BrowserSession {

    BrowserPage newPage();

    void close();
}
