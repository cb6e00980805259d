package com.cornerleague.collector.util;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@UtilityClass
public class SportsTaxonomy {

    private static final Map<String, List<String>> SPORT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CONTENT_TYPE_PATTERNS = new LinkedHashMap<>();
    private static final Map<String, Pattern> KEYWORD_PATTERNS = new LinkedHashMap<>();

    static {
        SPORT_KEYWORDS.put("basketball", List.of("basketball", "nba", "wnba", "ncaa basketball", "march madness"));
        SPORT_KEYWORDS.put("football", List.of("nfl", "ncaa football", "college football", "super bowl", "touchdown"));
        SPORT_KEYWORDS.put("baseball", List.of("baseball", "mlb", "world series", "spring training", "home run"));
        SPORT_KEYWORDS.put("soccer", List.of("soccer", "mls", "fifa", "world cup", "premier league", "champions league"));
        SPORT_KEYWORDS.put("hockey", List.of("hockey", "nhl", "stanley cup"));
        SPORT_KEYWORDS.put("tennis", List.of("tennis", "wimbledon", "french open", "australian open", "atp", "wta"));
        SPORT_KEYWORDS.put("golf", List.of("golf", "pga", "masters tournament", "british open", "ryder cup"));
        SPORT_KEYWORDS.put("olympics", List.of("olympics", "olympic games", "winter olympics", "summer olympics"));

        CONTENT_TYPE_PATTERNS.put("game_recap", List.of("final score", "game recap", "box score", "highlights", "final:"));
        CONTENT_TYPE_PATTERNS.put("breaking_news", List.of("breaking:", "just in:", "report:", "sources:", "exclusive:"));
        CONTENT_TYPE_PATTERNS.put("analysis", List.of("analysis", "breakdown", "preview", "prediction", "outlook"));
        CONTENT_TYPE_PATTERNS.put("trade", List.of("traded", "trade", "acquired", "signs", "contract"));
        CONTENT_TYPE_PATTERNS.put("injury", List.of("injury", "injured", "out for", "sidelined", "questionable"));
        CONTENT_TYPE_PATTERNS.put("roster", List.of("roster", "lineup", "depth chart"));
        CONTENT_TYPE_PATTERNS.put("interview", List.of("interview", "speaks", "comments"));

        for (List<String> keywords : SPORT_KEYWORDS.values()) {
            for (String k : keywords) {
                KEYWORD_PATTERNS.put(k, Pattern.compile("\\b" + Pattern.quote(k) + "\\b"));
            }
        }
    }

    public Set<String> sports() {
        return SPORT_KEYWORDS.keySet();
    }

    /**
     * Keywords from the sports map that occur in the text as whole words, in map order.
     */
    public Set<String> matchedKeywords(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return out;
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> e : KEYWORD_PATTERNS.entrySet()) {
            if (e.getValue().matcher(lower).find()) out.add(e.getKey());
        }
        return out;
    }

    public Set<String> detectSports(Set<String> matchedKeywords) {
        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> e : SPORT_KEYWORDS.entrySet()) {
            for (String k : e.getValue()) {
                if (matchedKeywords.contains(k)) {
                    out.add(e.getKey());
                    break;
                }
            }
        }
        return out;
    }

    public String classifyContentType(String title, String text) {
        String combined = ((title == null ? "" : title) + " " + (text == null ? "" : text)).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : CONTENT_TYPE_PATTERNS.entrySet()) {
            for (String k : e.getValue()) {
                if (combined.contains(k)) return e.getKey();
            }
        }
        return "general";
    }
}
