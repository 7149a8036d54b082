package com.fantasyreport.collector.domain.enums;

public enum UpsertOutcome {
    INSERTED,
    SKIPPED_DUPLICATE
}
