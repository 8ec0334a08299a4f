package com.leadradar.crawl.browser;

/**
 * The scripted browser engine cannot be started on this worker (disabled, not installed, failed to launch).
 */
public class ScriptedFetchUnavailableException extends RuntimeException {
    public ScriptedFetchUnavailableException(String message) {
        super(message);
    }

    public ScriptedFetchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
