package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.dto.ResolvedFeed;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.parser.FeedParser;
import com.fantasyreport.collector.parser.FeedSanitizer;
import com.fantasyreport.collector.parser.HtmlLinkScraper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedSourceFetcherTest {

    @Mock FeedResolver feedResolver;

    FeedSourceFetcher fetcher;

    private final Source source = Source.builder().id(7L).name("S").feedUrl("https://s.com/feed").build();

    @BeforeEach
    void setUp() {
        fetcher = new FeedSourceFetcher(feedResolver, new FeedParser(new FeedSanitizer()), new HtmlLinkScraper());
    }

    @Test
    void listCandidates_parsesFeedAndCarriesHeal() {
        String rss = """
                <rss version="2.0"><channel><title>t</title>
                  <item><title>One</title><link>https://s.com/1</link></item>
                  <item><title>Two</title><link>https://s.com/2</link></item>
                  <item><title>Three</title><link>https://s.com/3</link></item>
                </channel></rss>
                """;
        when(feedResolver.resolveFeed(source))
                .thenReturn(new ResolvedFeed(rss, "https://s.com/feed2", "https://s.com/feed2", List.of("a", "b")));

        FetchBatch batch = fetcher.listCandidates(source, 2);

        assertThat(batch.items()).extracting(FeedItem::title).containsExactly("One", "Two");
        assertEquals("https://s.com/feed2", batch.discoveredUrl());
        assertEquals(List.of("a", "b"), batch.candidatesTried());
        assertNull(batch.warningReason());
    }

    @Test
    void listCandidates_unrecognizedFormatFallsBackToScrape() {
        String html = """
                <html><body>
                  <h2><a href="https://s.com/nfl/week-3-rankings">Week 3 Rankings Update</a></h2>
                </body></html>
                """;
        when(feedResolver.resolveFeed(source))
                .thenReturn(new ResolvedFeed(html, "https://s.com/feed", null, List.of("https://s.com/feed")));

        FetchBatch batch = fetcher.listCandidates(source, 50);

        assertEquals(IngestReason.PARSE_ERROR, batch.warningReason());
        assertThat(batch.warningDetail()).contains("fallback=html_scrape");
        assertEquals(1, batch.items().size());
        assertEquals("https://s.com/nfl/week-3-rankings", batch.items().get(0).link());
    }
}
