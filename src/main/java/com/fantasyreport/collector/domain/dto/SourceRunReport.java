package com.fantasyreport.collector.domain.dto;

import com.fantasyreport.collector.domain.enums.SourceRunState;

import java.util.List;

public record SourceRunReport(
        Long sourceId,
        String sourceName,
        SourceRunState state,
        int seen,
        int added,
        int skipped,
        int rejected,
        int errors,
        String resolvedUrl,
        List<String> candidatesTried,
        String error,
        long tookMs
) {
    public static SourceRunReport failed(Long sourceId, String sourceName, List<String> tried, String error, long tookMs) {
        return new SourceRunReport(sourceId, sourceName, SourceRunState.FETCH_FAILED,
                0, 0, 0, 0, 1, null, tried, error, tookMs);
    }
}
