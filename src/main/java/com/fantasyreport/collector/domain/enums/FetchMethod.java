package com.fantasyreport.collector.domain.enums;

public enum FetchMethod {
    FEED,
    SCRAPE,
    ADAPTER
}
