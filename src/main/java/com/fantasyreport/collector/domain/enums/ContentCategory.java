package com.fantasyreport.collector.domain.enums;

public enum ContentCategory {
    NEWS,
    FANTASY,
    INJURY,
    RUMOR,
    DEPTH_CHART,
    SCOREBOARD,
    OTHER,
    UNKNOWN
}
