package com.leadradar.crawl.model;

public record SaveResult(int saved, int duplicates, int failed) {
    public static SaveResult empty() {
        return new SaveResult(0, 0, 0);
    }
}
