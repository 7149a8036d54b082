package com.fantasyreport.collector.domain.enums;

import java.util.Arrays;

/**
 * Fixed reason vocabulary for ingest log entries. The codes are what the health dashboard groups on.
 */
public enum IngestReason {
    FETCH_ERROR("fetch_error"),
    PARSE_ERROR("parse_error"),
    SCRAPE_NO_MATCHES("scrape_no_matches"),
    INVALID_ITEM("invalid_item"),
    BLOCKED_BY_FILTER("blocked_by_filter"),
    NON_NFL_LEAGUE("non_nfl_league"),
    FILTERED_OUT("filtered_out"),
    UPSERT_INSERTED("upsert_inserted"),
    UPSERT_UPDATED("upsert_updated"),
    UPSERT_SKIPPED("upsert_skipped");

    private final String code;

    IngestReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static IngestReason fromCode(String code) {
        return Arrays.stream(values())
                .filter(r -> r.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ingest reason: " + code));
    }
}
