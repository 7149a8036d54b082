package com.fantasyreport.collector.filter;

import com.fantasyreport.collector.domain.enums.ContentCategory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tells a real NFL trade apart from fantasy trade talk.
 * <p>
 * Two or more distinct teams plus a transaction verb is a transaction (NEWS), whatever advice phrasing
 * is also present. Otherwise fantasy phrasing makes it FANTASY. Anything else is left to the generic heuristic.
 */
@Component
public class TradeRouter {

    private record Team(String name, String abbreviation, Pattern namePattern, Pattern abbreviationPattern) {
        static Team of(String name, String abbreviation) {
            return new Team(name, abbreviation,
                    Pattern.compile("\\b" + name + "\\b", Pattern.CASE_INSENSITIVE),
                    // uppercase only, so "no", "ten" and "was" in prose never count
                    Pattern.compile("\\b" + abbreviation + "\\b"));
        }
    }

    private static final List<Team> TEAMS = List.of(
            Team.of("49ers", "SF"), Team.of("Bears", "CHI"), Team.of("Bengals", "CIN"), Team.of("Bills", "BUF"),
            Team.of("Broncos", "DEN"), Team.of("Browns", "CLE"), Team.of("Buccaneers", "TB"), Team.of("Cardinals", "ARI"),
            Team.of("Chargers", "LAC"), Team.of("Chiefs", "KC"), Team.of("Colts", "IND"), Team.of("Commanders", "WAS"),
            Team.of("Cowboys", "DAL"), Team.of("Dolphins", "MIA"), Team.of("Eagles", "PHI"), Team.of("Falcons", "ATL"),
            Team.of("Giants", "NYG"), Team.of("Jaguars", "JAX"), Team.of("Jets", "NYJ"), Team.of("Lions", "DET"),
            Team.of("Packers", "GB"), Team.of("Panthers", "CAR"), Team.of("Patriots", "NE"), Team.of("Raiders", "LV"),
            Team.of("Rams", "LAR"), Team.of("Ravens", "BAL"), Team.of("Saints", "NO"), Team.of("Seahawks", "SEA"),
            Team.of("Steelers", "PIT"), Team.of("Texans", "HOU"), Team.of("Titans", "TEN"), Team.of("Vikings", "MIN")
    );

    private static final Pattern TRADE_MENTION = Pattern.compile("\\btrad(?:e|es|ed|ing)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRANSACTION_VERB = Pattern.compile(
            "\\b(trade[sd]?|acquire[sd]?|sends?|sent|deals?|dealt|swap(?:s|ped)?|lands?|landed|ships?|shipped|in exchange for)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern FANTASY_PHRASING = Pattern.compile(
            "\\b(fantasy|dynasty|redraft|keeper|buy[\\s-]+low|sell[\\s-]+high|buy\\s*/\\s*sell|trade\\s+targets?|"
                    + "trade\\s+values?|trade\\s+advice|start\\s*/\\s*sit|rankings?|advice|waiver)\\b",
            Pattern.CASE_INSENSITIVE);

    public Optional<ContentCategory> route(String text) {
        if (text == null || !TRADE_MENTION.matcher(text).find()) return Optional.empty();

        if (countDistinctTeams(text) >= 2 && TRANSACTION_VERB.matcher(text).find()) {
            return Optional.of(ContentCategory.NEWS);
        }
        if (FANTASY_PHRASING.matcher(text).find()) {
            return Optional.of(ContentCategory.FANTASY);
        }
        return Optional.empty();
    }

    int countDistinctTeams(String text) {
        Set<String> seen = new HashSet<>();
        for (Team team : TEAMS) {
            if (team.namePattern().matcher(text).find() || team.abbreviationPattern().matcher(text).find()) {
                seen.add(team.name());
            }
        }
        return seen.size();
    }
}
