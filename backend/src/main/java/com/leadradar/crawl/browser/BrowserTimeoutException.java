package com.leadradar.crawl.browser;

public class BrowserTimeoutException extends RuntimeException {
    public BrowserTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
