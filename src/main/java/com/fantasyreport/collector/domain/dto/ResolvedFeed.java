package com.fantasyreport.collector.domain.dto;

import java.util.List;

/**
 * @param discoveredUrl set only when the feed was found through homepage discovery and differs from the stored URL
 */
public record ResolvedFeed(
        String body,
        String finalUrl,
        String discoveredUrl,
        List<String> candidatesTried
) {}
