package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.integration.fetcher.FetchResponse;
import com.fantasyreport.collector.integration.fetcher.ResilientFetcher;
import com.fantasyreport.collector.parser.HtmlLinkScraper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScrapeSourceFetcherTest {

    private static final String PAGE = """
            <html><body>
              <div class="story"><a href="/nfl/injury-report-week-4">Injury report: Week 4</a></div>
              <h2><a href="/nfl/other">Other headline text</a></h2>
            </body></html>
            """;

    @Mock ResilientFetcher fetcher;

    ScrapeSourceFetcher scrapeFetcher;

    @BeforeEach
    void setUp() {
        scrapeFetcher = new ScrapeSourceFetcher(fetcher, new HtmlLinkScraper());
    }

    @Test
    void listCandidates_usesSourceSelector() {
        Source src = Source.builder().id(1L).name("S").fetchMethod(FetchMethod.SCRAPE)
                .homepageUrl("https://s.com/").scrapeSelector("div.story a").build();
        when(fetcher.fetch("https://s.com/")).thenReturn(new FetchResponse("https://s.com/", 200, "text/html", PAGE, 1));

        FetchBatch batch = scrapeFetcher.listCandidates(src, 10);

        assertEquals(1, batch.items().size());
        assertEquals("https://s.com/nfl/injury-report-week-4", batch.items().get(0).link());
        assertNull(batch.warningReason());
    }

    @Test
    void listCandidates_defaultSelectorsWhenNoneConfigured() {
        Source src = Source.builder().id(2L).name("S").fetchMethod(FetchMethod.SCRAPE).homepageUrl("https://s.com/").build();
        when(fetcher.fetch("https://s.com/")).thenReturn(new FetchResponse("https://s.com/", 200, "text/html", PAGE, 1));

        FetchBatch batch = scrapeFetcher.listCandidates(src, 10);

        assertEquals("https://s.com/nfl/other", batch.items().get(0).link());
    }

    @Test
    void listCandidates_noMatchesIsWarningNotFailure() {
        Source src = Source.builder().id(3L).name("S").fetchMethod(FetchMethod.SCRAPE)
                .homepageUrl("https://s.com/").scrapeSelector("ul.none a").build();
        when(fetcher.fetch("https://s.com/")).thenReturn(new FetchResponse("https://s.com/", 200, "text/html", PAGE, 1));

        FetchBatch batch = scrapeFetcher.listCandidates(src, 10);

        assertTrue(batch.items().isEmpty());
        assertEquals(IngestReason.SCRAPE_NO_MATCHES, batch.warningReason());
    }

    @Test
    void listCandidates_withoutAnyUrlFails() {
        Source src = Source.builder().id(4L).name("S").fetchMethod(FetchMethod.SCRAPE).build();

        assertThrows(ResolveException.class, () -> scrapeFetcher.listCandidates(src, 10));
        verifyNoInteractions(fetcher);
    }
}
