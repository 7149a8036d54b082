package com.fantasyreport.collector.filter;

import com.fantasyreport.collector.domain.dto.AdmissionDecision;
import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.enums.ContentCategory;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.domain.enums.League;
import com.fantasyreport.collector.filter.AdmissionRuleConfig.RuleOverride;
import com.fantasyreport.collector.filter.AdmissionRuleConfig.RuleSpec;
import com.fantasyreport.collector.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a listed item may become an article candidate.
 * <p>
 * Checks run in a fixed order and the first failing one rejects:
 * forbidden, denied domain, path deny, path allow, required keywords, league/category gate.
 * A source-id override wins over a domain override; either is merged onto the defaults.
 */
@Slf4j
@Component
public class AdmissionFilter {

    record CompiledRule(
            List<Pattern> forbidden,
            List<Pattern> pathDeny,
            List<Pattern> pathAllow,
            List<Pattern> requiredAny,
            Set<String> domainDeny,
            Set<League> leagueAllow,
            Set<ContentCategory> categoryAllow
    ) {}

    private final LeagueCategoryClassifier leagueCategoryClassifier;
    private final RuleSpec defaults;
    private final Map<String, RuleSpec> byDomain = new HashMap<>();
    private final Map<Long, RuleSpec> bySourceId = new HashMap<>();
    private final Map<String, List<Pattern>> patternCache = new HashMap<>();

    public AdmissionFilter(AdmissionRuleConfig config, LeagueCategoryClassifier leagueCategoryClassifier) {
        this.leagueCategoryClassifier = leagueCategoryClassifier;
        this.defaults = config.defaults() != null ? config.defaults() : emptySpec();

        List<RuleOverride> overrides = config.overrides() != null ? config.overrides() : List.of();
        for (RuleOverride o : overrides) {
            if (o.rule() == null) continue;
            if (o.sourceId() != null) bySourceId.put(o.sourceId(), o.rule());
            if (!TextUtils.isBlank(o.domain())) byDomain.put(o.domain().toLowerCase(Locale.ROOT), o.rule());
        }

        // validate every pattern eagerly so a bad rules file fails at startup
        compile(defaults, null);
        overrides.stream().filter(o -> o.rule() != null).forEach(o -> compile(o.rule(), null));

        log.info("Admission: rules loaded domainOverrides={} sourceOverrides={}", byDomain.size(), bySourceId.size());
    }

    public boolean admit(FeedItem item, Long sourceId) {
        return evaluate(item, sourceId).admitted();
    }

    public AdmissionDecision evaluate(FeedItem item, Long sourceId) {
        String link = item.link();
        String host = TextUtils.hostOf(link);
        String path = TextUtils.pathOf(link);
        CompiledRule rule = resolve(host, sourceId);

        String blob = (item.title() == null ? "" : item.title()) + "\n"
                + (item.description() == null ? "" : item.description()) + "\n"
                + (link == null ? "" : link);

        for (Pattern p : rule.forbidden()) {
            if (p.matcher(blob).find() || p.matcher(path).find()) {
                return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "forbidden:" + p.pattern());
            }
        }

        if (host != null) {
            for (String denied : rule.domainDeny()) {
                if (host.equals(denied) || host.endsWith("." + denied)) {
                    return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "deny_domain:" + denied);
                }
            }
        }

        for (Pattern p : rule.pathDeny()) {
            if (p.matcher(path).find()) {
                return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "path_deny:" + p.pattern());
            }
        }

        if (!rule.pathAllow().isEmpty() && rule.pathAllow().stream().noneMatch(p -> p.matcher(path).find())) {
            return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "path_not_allowed");
        }

        if (!rule.requiredAny().isEmpty() && rule.requiredAny().stream().noneMatch(p -> p.matcher(blob).find())) {
            return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "required_keyword_missing");
        }

        LeagueCategoryClassifier.LeagueCategory lc =
                leagueCategoryClassifier.classify(item.title(), item.description(), link);

        if (!rule.leagueAllow().isEmpty() && !rule.leagueAllow().contains(lc.league())) {
            return AdmissionDecision.reject(IngestReason.NON_NFL_LEAGUE, "league=" + lc.league(), lc.league(), lc.category());
        }
        if (!rule.categoryAllow().isEmpty() && !rule.categoryAllow().contains(lc.category())) {
            return AdmissionDecision.reject(IngestReason.BLOCKED_BY_FILTER, "category=" + lc.category(), lc.league(), lc.category());
        }

        return AdmissionDecision.admit(lc.league(), lc.category());
    }

    CompiledRule resolve(String host, Long sourceId) {
        RuleSpec picked = sourceId != null ? bySourceId.get(sourceId) : null;
        if (picked == null && host != null) picked = byDomain.get(host);
        return compile(defaults, picked);
    }

    private CompiledRule compile(RuleSpec base, RuleSpec override) {
        RuleSpec o = override != null ? override : emptySpec();

        Set<String> domainDeny = new LinkedHashSet<>();
        addLower(domainDeny, base.domainDeny());
        addLower(domainDeny, o.domainDeny());

        Set<League> leagues = EnumSet.noneOf(League.class);
        List<League> leagueList = o.leagueAllow() != null ? o.leagueAllow() : base.leagueAllow();
        if (leagueList != null) leagues.addAll(leagueList);

        Set<ContentCategory> categories = EnumSet.noneOf(ContentCategory.class);
        List<ContentCategory> categoryList = o.categoryAllow() != null ? o.categoryAllow() : base.categoryAllow();
        if (categoryList != null) categories.addAll(categoryList);

        return new CompiledRule(
                concat(patterns(base.forbidden()), patterns(o.forbidden())),
                concat(patterns(base.pathDeny()), patterns(o.pathDeny())),
                concat(patterns(base.pathAllow()), patterns(o.pathAllow())),
                patterns(o.requiredAny() != null ? o.requiredAny() : base.requiredAny()),
                domainDeny,
                leagues,
                categories
        );
    }

    private List<Pattern> patterns(List<String> sources) {
        if (sources == null || sources.isEmpty()) return List.of();
        String key = String.join("\u0000", sources);
        synchronized (patternCache) {
            return patternCache.computeIfAbsent(key, k -> sources.stream()
                    .map(s -> Pattern.compile(s, Pattern.CASE_INSENSITIVE))
                    .toList());
        }
    }

    private static List<Pattern> concat(List<Pattern> a, List<Pattern> b) {
        if (b.isEmpty()) return a;
        if (a.isEmpty()) return b;
        List<Pattern> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }

    private static void addLower(Set<String> into, List<String> values) {
        if (values == null) return;
        for (String v : values) {
            if (!TextUtils.isBlank(v)) into.add(v.trim().toLowerCase(Locale.ROOT));
        }
    }

    private static RuleSpec emptySpec() {
        return new RuleSpec(null, null, null, null, null, null, null);
    }
}
