package com.fantasyreport.collector.filter;

import com.fantasyreport.collector.domain.enums.ContentCategory;
import com.fantasyreport.collector.domain.enums.League;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword heuristic for league and coarse category. Used only to gate admission; topic tagging is the
 * {@link com.fantasyreport.collector.classifier.TopicClassifier}'s job.
 */
@Component
@RequiredArgsConstructor
public class LeagueCategoryClassifier {

    public record LeagueCategory(League league, ContentCategory category) {}

    private static final Pattern NFL = Pattern.compile("\\bnfl\\b|fantasy[ -]?football", Pattern.CASE_INSENSITIVE);

    private static final Pattern OTHER_SPORTS = Pattern.compile(
            "\\b(mlb|nba|nhl|wnba|mls|premier league|la liga|ufc|mma|nascar|baseball|basketball|hockey|soccer|"
                    + "cricket|rugby|tennis|golf|boxing|wrestling)\\b",
            Pattern.CASE_INSENSITIVE);

    // evaluated in order, first hit wins
    private static final List<Map.Entry<Pattern, ContentCategory>> CATEGORY_RULES = List.of(
            Map.entry(Pattern.compile("waiver", Pattern.CASE_INSENSITIVE), ContentCategory.DEPTH_CHART),
            Map.entry(Pattern.compile("start[\\s/-]?(?:and\\s+)?sit", Pattern.CASE_INSENSITIVE), ContentCategory.FANTASY),
            Map.entry(Pattern.compile("\\branking|\\btiers?\\b", Pattern.CASE_INSENSITIVE), ContentCategory.FANTASY),
            Map.entry(Pattern.compile("\\binjur(?:y|ies)|\\binactives?\\b|\\bquestionable\\b|\\bdoubtful\\b|\\bprobable\\b",
                    Pattern.CASE_INSENSITIVE), ContentCategory.INJURY),
            Map.entry(Pattern.compile("\\bdfs\\b|draftkings|fanduel|daily[- ]fantasy", Pattern.CASE_INSENSITIVE),
                    ContentCategory.FANTASY),
            Map.entry(Pattern.compile("scoreboard|\\bscores?\\b|\\bschedule\\b|\\bfixtures?\\b|\\bresults?\\b",
                    Pattern.CASE_INSENSITIVE), ContentCategory.SCOREBOARD),
            Map.entry(Pattern.compile("rumou?r", Pattern.CASE_INSENSITIVE), ContentCategory.RUMOR),
            Map.entry(Pattern.compile("advice|analysis|strategy|cheat[- ]?sheet|values|sleepers", Pattern.CASE_INSENSITIVE),
                    ContentCategory.FANTASY)
    );

    private final TradeRouter tradeRouter;

    public LeagueCategory classify(String title, String description, String link) {
        String blob = (title == null ? "" : title) + " " + (description == null ? "" : description) + " "
                + (link == null ? "" : link);

        League league = NFL.matcher(blob).find() ? League.NFL
                : OTHER_SPORTS.matcher(blob).find() ? League.OTHER
                : League.UNKNOWN;

        ContentCategory category = tradeRouter.route(blob).orElseGet(() -> genericCategory(blob));
        return new LeagueCategory(league, category);
    }

    private static ContentCategory genericCategory(String blob) {
        for (Map.Entry<Pattern, ContentCategory> rule : CATEGORY_RULES) {
            if (rule.getKey().matcher(blob).find()) return rule.getValue();
        }
        return ContentCategory.NEWS;
    }
}
