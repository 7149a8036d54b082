package com.fantasyreport.collector.classifier;

import com.fantasyreport.collector.classifier.ClassifierRuleConfig.RuleKind;
import com.fantasyreport.collector.classifier.ClassifierRuleConfig.ScoringRule;
import com.fantasyreport.collector.classifier.ClassifierRuleConfig.Thresholds;
import com.fantasyreport.collector.domain.dto.Classification;
import com.fantasyreport.collector.util.WeekParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Weighted multi-label topic scorer driven entirely by {@link ClassifierRuleConfig}.
 * <p>
 * Pure: the same input always produces the same {@link Classification}. Ties between buckets go to the
 * bucket listed first in the configuration.
 */
@Slf4j
@Component
public class TopicClassifier {

    private record CompiledRule(String bucket, RuleKind kind, double weight, Pattern pattern) {}

    private record CompiledSecondary(Pattern pattern, String topic) {}

    private record Scored(String bucket, double score, int order) {}

    private final Thresholds thresholds;
    private final List<String> buckets;
    private final List<CompiledRule> rules;
    private final Map<String, Map<String, Double>> sourceBonuses;
    private final List<CompiledSecondary> explicitSecondary;
    private final String leagueTag;

    public TopicClassifier(ClassifierRuleConfig config) {
        this.thresholds = config.thresholds();
        this.buckets = List.copyOf(config.buckets());
        this.sourceBonuses = config.sourceBonuses() != null ? Map.copyOf(config.sourceBonuses()) : Map.of();
        this.leagueTag = config.leagueTag() != null ? config.leagueTag() : "nfl";

        List<CompiledRule> compiled = new ArrayList<>();
        for (ScoringRule r : config.rules()) {
            if (!buckets.contains(r.bucket())) {
                throw new IllegalArgumentException("Classifier rule references unknown bucket: " + r.bucket());
            }
            compiled.add(new CompiledRule(r.bucket(), r.kind(), r.weight(), Pattern.compile(r.pattern(), Pattern.CASE_INSENSITIVE)));
        }
        this.rules = List.copyOf(compiled);

        List<CompiledSecondary> secondary = new ArrayList<>();
        if (config.explicitSecondary() != null) {
            for (ClassifierRuleConfig.SecondaryRule s : config.explicitSecondary()) {
                secondary.add(new CompiledSecondary(Pattern.compile(s.pattern(), Pattern.CASE_INSENSITIVE), s.topic()));
            }
        }
        this.explicitSecondary = List.copyOf(secondary);

        log.info("Classifier: rules loaded buckets={} rules={} sourceBonuses={}", buckets.size(), rules.size(), sourceBonuses.size());
    }

    public Classification classify(String title, String summary, String sourceName, Integer knownWeek) {
        return classify(title, summary, sourceName, knownWeek, null);
    }

    public Classification classify(String title, String summary, String sourceName, Integer knownWeek, String url) {
        String t = title == null ? "" : title;
        String s = summary == null ? "" : summary;
        String text = t + "\n" + s;

        Map<String, Double> scores = new LinkedHashMap<>();
        buckets.forEach(b -> scores.put(b, 0.0));
        Set<String> matched = new LinkedHashSet<>();

        for (CompiledRule r : rules) {
            if (r.kind() == RuleKind.SIGNAL && r.pattern().matcher(text).find()) {
                scores.merge(r.bucket(), r.weight(), Double::sum);
                matched.add(r.bucket());
            }
        }

        Map<String, Double> bonus = sourceName != null ? sourceBonuses.get(sourceName) : null;
        if (bonus != null) {
            bonus.forEach((bucket, w) -> {
                if (scores.containsKey(bucket)) scores.merge(bucket, w, Double::sum);
            });
        }

        for (CompiledRule r : rules) {
            if (r.kind() == RuleKind.SIGNAL || !r.pattern().matcher(text).find()) continue;
            double current = scores.get(r.bucket());
            if (r.kind() == RuleKind.DAMPENER && current > 0) {
                scores.put(r.bucket(), Math.max(0.0, current - r.weight()));
            } else if (r.kind() == RuleKind.CAP) {
                scores.put(r.bucket(), Math.min(current, r.weight()));
            }
        }

        List<Scored> ranked = rank(scores);
        Scored top = ranked.get(0);
        String primary = top.score() >= thresholds.primaryMin() ? top.bucket() : null;
        String secondary = primary == null ? null : pickSecondary(primary, t, url, ranked);

        Set<String> topics = new LinkedHashSet<>();
        if (primary != null) topics.add(primary);
        if (secondary != null) topics.add(secondary);
        for (String b : matched) {
            if (scores.get(b) > 0) topics.add(b);
        }
        topics.add(leagueTag);

        Integer week = knownWeek != null ? knownWeek : WeekParser.extract(text);
        if (week != null) topics.add("week:" + week);

        double confidence = round2(clamp(top.score() / thresholds.confidenceScale(), 0.1, 0.99));
        return new Classification(primary, secondary, List.copyOf(topics), confidence, week);
    }

    private String pickSecondary(String primary, String title, String url, List<Scored> ranked) {
        String haystack = title + " " + (url == null ? "" : url);
        for (CompiledSecondary rule : explicitSecondary) {
            if (!rule.topic().equals(primary) && rule.pattern().matcher(haystack).find()) {
                return rule.topic();
            }
        }

        if (ranked.size() < 2) return null;
        Scored first = ranked.get(0);
        Scored second = ranked.get(1);
        if (second.score() >= thresholds.secondaryMin()
                && second.score() >= thresholds.closenessRatio() * first.score()) {
            return second.bucket();
        }
        return null;
    }

    private List<Scored> rank(Map<String, Double> scores) {
        List<Scored> out = new ArrayList<>();
        int order = 0;
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            out.add(new Scored(e.getKey(), e.getValue(), order++));
        }
        out.sort(Comparator.comparingDouble(Scored::score).reversed().thenComparingInt(Scored::order));
        return out;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
