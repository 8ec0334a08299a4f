package com.leadradar.crawl.service;

public class LeadNotFoundException extends RuntimeException {
    public LeadNotFoundException(long id) {
        super("Lead " + id + " not found");
    }
}
