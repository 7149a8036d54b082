package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.dto.ResolvedFeed;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.exception.UnrecognizedFeedFormatException;
import com.fantasyreport.collector.parser.FeedParser;
import com.fantasyreport.collector.parser.HtmlLinkScraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeedSourceFetcher implements SourceFetcher {

    private final FeedResolver feedResolver;
    private final FeedParser feedParser;
    private final HtmlLinkScraper linkScraper;

    @Value("${ingest.scrape-cap:100}")
    private int scrapeCap = 100;

    @Override
    public FetchMethod method() {
        return FetchMethod.FEED;
    }

    @Override
    public FetchBatch listCandidates(Source source, int limit) {
        ResolvedFeed resolved = feedResolver.resolveFeed(source);

        try {
            List<FeedItem> items = feedParser.parse(resolved.body());
            return new FetchBatch(cap(items, limit), resolved.finalUrl(), resolved.discoveredUrl(),
                    resolved.candidatesTried(), null, null);
        } catch (UnrecognizedFeedFormatException e) {
            List<FeedItem> scraped = linkScraper.scrapeLinks(resolved.body(), resolved.finalUrl(), Math.min(scrapeCap, limit));
            log.info("Feed: unrecognized format, scraped links instead sourceId={} url={} root={} links={}",
                    source.getId(), resolved.finalUrl(), e.getRootElement(), scraped.size());
            return new FetchBatch(scraped, resolved.finalUrl(), resolved.discoveredUrl(), resolved.candidatesTried(),
                    IngestReason.PARSE_ERROR, e.getMessage() + " fallback=html_scrape links=" + scraped.size());
        }
    }

    private static List<FeedItem> cap(List<FeedItem> items, int limit) {
        return items.size() <= limit ? items : items.subList(0, limit);
    }
}
