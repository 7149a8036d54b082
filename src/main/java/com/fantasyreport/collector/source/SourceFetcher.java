package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;

/**
 * One way of pulling candidate items from a source.
 * <p>
 * {@link #listCandidates} throws {@link com.fantasyreport.collector.exception.FetchException} or
 * {@link com.fantasyreport.collector.exception.ResolveException} when the source cannot be read at all.
 */
public interface SourceFetcher {

    FetchMethod method();

    FetchBatch listCandidates(Source source, int limit);

    /** Completes a listed candidate. Most strategies already have everything from the listing. */
    default FeedItem loadItem(FeedItem candidate) {
        return candidate;
    }
}
