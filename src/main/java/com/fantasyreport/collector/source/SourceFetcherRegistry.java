package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SourceFetcherRegistry {

    private final FeedSourceFetcher feedFetcher;
    private final ScrapeSourceFetcher scrapeFetcher;
    private final SitemapSourceFetcher sitemapFetcher;

    public SourceFetcher forSource(Source source) {
        FetchMethod method = source.getFetchMethod() != null ? source.getFetchMethod() : FetchMethod.FEED;
        return switch (method) {
            case FEED -> feedFetcher;
            case SCRAPE -> scrapeFetcher;
            case ADAPTER -> sitemapFetcher;
        };
    }
}
