package com.leadradar.crawl.model;

public enum FetchMethod {
    HTTP,
    SCRIPTED
}
