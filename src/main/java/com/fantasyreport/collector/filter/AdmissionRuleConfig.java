package com.fantasyreport.collector.filter;

import com.fantasyreport.collector.domain.enums.ContentCategory;
import com.fantasyreport.collector.domain.enums.League;

import java.util.List;

/**
 * Admission rules as stored in {@code admission-rules.json}.
 * <p>
 * Pattern lists of an override are appended to the defaults; {@code requiredAny}, {@code leagueAllow} and
 * {@code categoryAllow} replace the defaults when the override sets them. A null list means "inherit".
 */
public record AdmissionRuleConfig(
        RuleSpec defaults,
        List<RuleOverride> overrides
) {

    public record RuleSpec(
            List<String> forbidden,
            List<String> pathDeny,
            List<String> pathAllow,
            List<String> requiredAny,
            List<String> domainDeny,
            List<League> leagueAllow,
            List<ContentCategory> categoryAllow
    ) {}

    /** Exactly one of {@code domain} or {@code sourceId} identifies what the rule applies to. */
    public record RuleOverride(
            String domain,
            Long sourceId,
            RuleSpec rule
    ) {}
}
