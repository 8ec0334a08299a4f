package com.leadradar.crawl.model;

public enum FetchErrorKind {
    BLOCKED,
    TIMEOUT,
    UNAVAILABLE,
    HTTP_ERROR,
    IO_ERROR,
    INVALID_URL,
    INTERRUPTED
}
