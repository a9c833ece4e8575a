package com.propertymarket.scraper.crawl.model;

public enum RunState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
