package com.fantasyreport.collector.domain.enums;

public enum League {
    NFL,
    OTHER,
    UNKNOWN
}
