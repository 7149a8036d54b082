package com.fantasyreport.collector.filter;

import com.fantasyreport.collector.config.RuleSetConfig;
import com.fantasyreport.collector.domain.dto.AdmissionDecision;
import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.enums.ContentCategory;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.domain.enums.League;
import com.fantasyreport.collector.filter.AdmissionRuleConfig.RuleOverride;
import com.fantasyreport.collector.filter.AdmissionRuleConfig.RuleSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AdmissionFilterTest {

    private final LeagueCategoryClassifier leagueCategoryClassifier = new LeagueCategoryClassifier(new TradeRouter());

    private AdmissionFilter filter;

    @BeforeEach
    void setUp() {
        AdmissionRuleConfig config = RuleSetConfig.read(new ObjectMapper(),
                new ClassPathResource("admission-rules.json"), AdmissionRuleConfig.class);
        filter = new AdmissionFilter(config, leagueCategoryClassifier);
    }

    private static FeedItem item(String title, String link) {
        return new FeedItem(title, link, null, null);
    }

    @Test
    void genericFantasyItemIsAdmitted() {
        AdmissionDecision d = filter.evaluate(item("Week 5 Waiver Wire Pickups at RB", "https://s.com/a1"), 1L);

        assertTrue(d.admitted());
        assertEquals(League.UNKNOWN, d.league());
        assertNull(d.reason());
    }

    @Test
    void deniedDomainIsBlocked() {
        AdmissionDecision d = filter.evaluate(item("Trade deadline preview", "https://www.mlb.com/news/x"), 1L);

        assertFalse(d.admitted());
        assertEquals(IngestReason.BLOCKED_BY_FILTER, d.reason());
        assertEquals("deny_domain:mlb.com", d.detail());
    }

    @Test
    void premiumPathIsDenied() {
        AdmissionDecision d = filter.evaluate(item("NFL Week 5 rankings", "https://s.com/premium/week-5-rankings"), 1L);

        assertFalse(d.admitted());
        assertThat(d.detail()).startsWith("path_deny:");
    }

    @Test
    void otherLeagueIsRejectedWithLeagueReason() {
        AdmissionDecision d = filter.evaluate(item("NBA power rankings: Celtics stay on top", "https://s.com/hoops/1"), 1L);

        assertFalse(d.admitted());
        assertEquals(IngestReason.NON_NFL_LEAGUE, d.reason());
        assertEquals(League.OTHER, d.league());
    }

    @Test
    void domainOverrideDenyBeatsAllow() {
        // fantasypros allows /nfl/ but the shared deny list still drops scoreboard paths
        AdmissionDecision denied = filter.evaluate(
                item("NFL fantasy scoreboard", "https://www.fantasypros.com/nfl/scoreboard"), null);
        AdmissionDecision allowed = filter.evaluate(
                item("NFL fantasy Week 5 waiver wire", "https://www.fantasypros.com/nfl/week-5-waivers"), null);
        AdmissionDecision outsideAllow = filter.evaluate(
                item("NFL fantasy mock draft", "https://www.fantasypros.com/mock-draft"), null);

        assertFalse(denied.admitted());
        assertThat(denied.detail()).startsWith("path_deny:");
        assertTrue(allowed.admitted());
        assertFalse(outsideAllow.admitted());
        assertEquals("path_not_allowed", outsideAllow.detail());
    }

    @Test
    void sourceIdOverrideWinsOverDomainOverride() {
        // source 3135 only requires a keyword; the fantasypros path allow list no longer applies
        AdmissionDecision d = filter.evaluate(item("NFL mock draft 3.0", "https://www.fantasypros.com/mock-draft"), 3135L);

        assertTrue(d.admitted());
    }

    @Test
    void sourceIdOverrideRequiresKeyword() {
        AdmissionDecision d = filter.evaluate(item("Mock draft 3.0", "https://example.com/mock-draft"), 3138L);

        assertFalse(d.admitted());
        assertEquals("required_keyword_missing", d.detail());
    }

    @Test
    void forbiddenPatternMatchesPath() {
        AdmissionDecision d = filter.evaluate(item("Subscribe today", "https://s.com/subscribe"), 1L);

        assertFalse(d.admitted());
        assertThat(d.detail()).startsWith("forbidden:");
    }

    @Test
    void categoryAllowListIsEnforced() {
        AdmissionRuleConfig config = new AdmissionRuleConfig(
                new RuleSpec(null, null, null, null, null, null, null),
                List.of(new RuleOverride("scores.example.com", null,
                        new RuleSpec(null, null, null, null, null, null, List.of(ContentCategory.FANTASY)))));
        AdmissionFilter strict = new AdmissionFilter(config, leagueCategoryClassifier);

        AdmissionDecision d = strict.evaluate(item("NFL Week 5 results", "https://scores.example.com/recap"), 9L);

        assertFalse(d.admitted());
        assertEquals("category=SCOREBOARD", d.detail());
        assertTrue(strict.admit(item("NFL Week 5 rankings", "https://scores.example.com/r"), 9L));
    }

    @Test
    void invalidPatternFailsAtConstruction() {
        AdmissionRuleConfig bad = new AdmissionRuleConfig(
                new RuleSpec(List.of("(unclosed"), null, null, null, null, null, null), List.of());

        assertThrows(java.util.regex.PatternSyntaxException.class, () -> new AdmissionFilter(bad, leagueCategoryClassifier));
    }
}
