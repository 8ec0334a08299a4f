package com.leadradar.crawl.browser;

public enum NavigationWait {
    DOM_CONTENT_LOADED,
    LOAD,
    COMMIT
}
