package com.fantasyreport.collector.domain.dto;

import java.util.List;

/**
 * @param primary null when no bucket cleared the primary threshold (general news)
 */
public record Classification(
        String primary,
        String secondary,
        List<String> topics,
        double confidence,
        Integer week
) {}
