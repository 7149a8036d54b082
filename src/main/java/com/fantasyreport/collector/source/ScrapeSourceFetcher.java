package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.integration.fetcher.FetchResponse;
import com.fantasyreport.collector.integration.fetcher.ResilientFetcher;
import com.fantasyreport.collector.parser.HtmlLinkScraper;
import com.fantasyreport.collector.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lists article links straight from a page, using the source's selector or the default selector list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeSourceFetcher implements SourceFetcher {

    private final ResilientFetcher fetcher;
    private final HtmlLinkScraper linkScraper;

    @Value("${ingest.scrape-cap:100}")
    private int scrapeCap = 100;

    @Override
    public FetchMethod method() {
        return FetchMethod.SCRAPE;
    }

    @Override
    public FetchBatch listCandidates(Source source, int limit) {
        String pageUrl = !TextUtils.isBlank(source.getHomepageUrl()) ? source.getHomepageUrl() : source.getFeedUrl();
        if (TextUtils.isBlank(pageUrl)) {
            throw new ResolveException("Scrape source has no page URL sourceId=" + source.getId(), List.of(), null);
        }

        FetchResponse page = fetcher.fetch(pageUrl);

        List<String> selectors = TextUtils.isBlank(source.getScrapeSelector())
                ? HtmlLinkScraper.DEFAULT_SELECTORS
                : List.of(source.getScrapeSelector().trim());

        List<FeedItem> items = linkScraper.scrapeWithSelectors(page.body(), pageUrl, selectors, Math.min(scrapeCap, limit));
        FetchBatch batch = FetchBatch.of(items, pageUrl);

        if (items.isEmpty()) {
            log.info("Scrape: no matches sourceId={} url={} selector='{}'", source.getId(), pageUrl, selectors.get(0));
            return batch.withWarning(IngestReason.SCRAPE_NO_MATCHES, "selector=" + selectors.get(0));
        }
        return batch;
    }
}
