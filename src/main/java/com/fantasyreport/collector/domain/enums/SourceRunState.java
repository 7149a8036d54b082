package com.fantasyreport.collector.domain.enums;

/**
 * Lifecycle of one source within a batch:
 * PENDING -> FETCHING -> (PARSED | FETCH_FAILED) -> FILTERING -> DONE.
 */
public enum SourceRunState {
    PENDING,
    FETCHING,
    PARSED,
    FETCH_FAILED,
    FILTERING,
    DONE
}
