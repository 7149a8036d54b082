package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.ResolvedFeed;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.exception.FetchException;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.integration.fetcher.FetchResponse;
import com.fantasyreport.collector.integration.fetcher.ResilientFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedResolverTest {

    private static final String RSS = "<?xml version=\"1.0\"?><rss version=\"2.0\"><channel><title>t</title></channel></rss>";

    @Mock ResilientFetcher fetcher;

    FeedResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new FeedResolver(fetcher);
    }

    private static FetchResponse ok(String url, String body) {
        return new FetchResponse(url, 200, "text/xml", body, 1);
    }

    @Test
    void buildCandidates_variantsInOrder() {
        assertEquals(List.of(
                "http://s.com/news/",
                "http://s.com/news",
                "https://s.com/news",
                "https://s.com/news/feed",
                "https://s.com/news/rss"
        ), FeedResolver.buildCandidates("http://s.com/news/"));
    }

    @Test
    void buildCandidates_feedPathGetsNoSuffixes() {
        assertEquals(List.of("https://s.com/feed"), FeedResolver.buildCandidates("https://s.com/feed"));
        assertEquals(List.of("https://s.com/sitemap.xml"), FeedResolver.buildCandidates("https://s.com/sitemap.xml"));
    }

    @Test
    void resolveFeed_storedUrlWorks_noHeal() {
        Source src = Source.builder().id(1L).name("S").feedUrl("https://s.com/feed").homepageUrl("https://s.com").build();
        when(fetcher.fetch("https://s.com/feed")).thenReturn(ok("https://s.com/feed", RSS));

        ResolvedFeed resolved = resolver.resolveFeed(src);

        assertEquals("https://s.com/feed", resolved.finalUrl());
        assertNull(resolved.discoveredUrl());
        assertEquals(RSS, resolved.body());
        verify(fetcher, never()).fetch("https://s.com");
    }

    @Test
    void resolveFeed_fallsBackToHomepageDiscovery() {
        Source src = Source.builder().id(2L).name("S").feedUrl("https://s.com/feed").homepageUrl("https://s.com").build();
        when(fetcher.fetch("https://s.com/feed")).thenThrow(new FetchException("Non-2xx status=404", 404, false, null));
        when(fetcher.fetch("https://s.com")).thenReturn(ok("https://s.com", """
                <!DOCTYPE html>
                <html><head>
                  <link rel="stylesheet" href="/site.css" type="text/css">
                  <link rel="alternate" type="application/rss+xml" title="Latest" href="/feed2">
                </head><body>hi</body></html>
                """));
        when(fetcher.fetch("https://s.com/feed2")).thenReturn(ok("https://s.com/feed2", RSS));

        ResolvedFeed resolved = resolver.resolveFeed(src);

        assertEquals("https://s.com/feed2", resolved.finalUrl());
        assertEquals("https://s.com/feed2", resolved.discoveredUrl());
        assertEquals(List.of("https://s.com/feed", "https://s.com", "https://s.com/feed2"), resolved.candidatesTried());
    }

    @Test
    void resolveFeed_nonMarkupCandidateIsNotAFeed() {
        Source src = Source.builder().id(3L).name("S").feedUrl("https://s.com/news").build();
        when(fetcher.fetch(anyString())).thenReturn(ok("x", "{\"error\":\"not found\"}"));

        ResolveException ex = assertThrows(ResolveException.class, () -> resolver.resolveFeed(src));

        assertThat(ex.getAttemptedUrls()).containsExactly(
                "https://s.com/news", "https://s.com/news/feed", "https://s.com/news/rss");
    }

    @Test
    void resolveFeed_homepageWithoutFeedLinkFails() {
        Source src = Source.builder().id(4L).name("S").feedUrl("https://s.com/rss").homepageUrl("https://s.com/").build();
        when(fetcher.fetch("https://s.com/rss")).thenThrow(new FetchException("Gave up", 503, true, null));
        when(fetcher.fetch("https://s.com/")).thenReturn(ok("https://s.com/", "<html><head></head></html>"));

        ResolveException ex = assertThrows(ResolveException.class, () -> resolver.resolveFeed(src));

        assertThat(ex.getMessage()).contains("exposes no feed link");
        assertThat(ex.getAttemptedUrls()).containsExactly("https://s.com/rss", "https://s.com/");
    }

    @Test
    void discoverFeedLink_acceptsAtomAndIgnoresNonAlternate() {
        String html = """
                <html><head>
                  <link rel="preload" type="application/rss+xml" href="/nope">
                  <link rel="alternate" type="application/atom+xml" href="https://cdn.s.com/atom.xml">
                </head></html>
                """;
        assertEquals(Optional.of("https://cdn.s.com/atom.xml"), FeedResolver.discoverFeedLink(html, "https://s.com"));
        assertEquals(Optional.empty(), FeedResolver.discoverFeedLink("", "https://s.com"));
    }

    @Test
    void looksLikeXml_onlySniffsLeadingMarkup() {
        assertTrue(FeedResolver.looksLikeXml("  <?xml version=\"1.0\"?><rss/>"));
        assertTrue(FeedResolver.looksLikeXml("<rss version=\"2.0\"/>"));
        assertTrue(FeedResolver.looksLikeXml("<!DOCTYPE html><html></html>"));
        assertFalse(FeedResolver.looksLikeXml("{\"json\":true}"));
        assertFalse(FeedResolver.looksLikeXml(null));
        assertTrue(FeedResolver.looksLikeXml("\uFEFF<?xml version=\"1.0\"?><rss/>"));
        assertTrue(FeedResolver.looksLikeXml("\uFEFF\n  <rss/>"));
    }

    @Test
    void resolveFeed_acceptsByteOrderMarkedFeed() {
        Source src = Source.builder().id(5L).name("S").feedUrl("https://s.com/feed").build();
        String body = "\uFEFF" + RSS;
        when(fetcher.fetch("https://s.com/feed")).thenReturn(ok("https://s.com/feed", body));

        ResolvedFeed resolved = resolver.resolveFeed(src);

        assertEquals("https://s.com/feed", resolved.finalUrl());
        assertEquals(body, resolved.body());
        assertNull(resolved.discoveredUrl());
    }
}
