package com.fantasyreport.collector.domain.dto;

import com.fantasyreport.collector.domain.enums.IngestReason;

import java.util.List;

/**
 * Candidates listed for one source, plus what the fetch learned along the way.
 *
 * @param warningReason non-fatal problem worth a log entry (parse_error when the scrape fallback kicked in,
 *                      scrape_no_matches when nothing was found)
 */
public record FetchBatch(
        List<FeedItem> items,
        String resolvedUrl,
        String discoveredUrl,
        List<String> candidatesTried,
        IngestReason warningReason,
        String warningDetail
) {
    public static FetchBatch of(List<FeedItem> items, String resolvedUrl) {
        return new FetchBatch(items, resolvedUrl, null, List.of(resolvedUrl), null, null);
    }

    public FetchBatch withWarning(IngestReason reason, String detail) {
        return new FetchBatch(items, resolvedUrl, discoveredUrl, candidatesTried, reason, detail);
    }
}
