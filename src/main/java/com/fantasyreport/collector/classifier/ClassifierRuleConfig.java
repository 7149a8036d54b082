package com.fantasyreport.collector.classifier;

import java.util.List;
import java.util.Map;

/**
 * Classifier tables as stored in {@code classifier-rules.json}. Bucket order is the tie-break order.
 */
public record ClassifierRuleConfig(
        Thresholds thresholds,
        List<String> buckets,
        List<ScoringRule> rules,
        Map<String, Map<String, Double>> sourceBonuses,
        List<SecondaryRule> explicitSecondary,
        String leagueTag
) {

    public record Thresholds(
            double primaryMin,
            double secondaryMin,
            double closenessRatio,
            double confidenceScale
    ) {}

    /**
     * SIGNAL adds {@code weight}; DAMPENER subtracts it from a bucket that already scored;
     * CAP limits the bucket to at most {@code weight}.
     */
    public record ScoringRule(
            String bucket,
            RuleKind kind,
            double weight,
            String pattern
    ) {}

    public enum RuleKind {
        SIGNAL,
        DAMPENER,
        CAP
    }

    public record SecondaryRule(
            String pattern,
            String topic
    ) {}
}
