package com.cornerleague.collector.service.quality;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Weighted combination of per-item quality signals, clamped to [0,1]. The result depends only on the
 * item, its source and the configured weights, so re-scoring unchanged input gives the same value.
 */
@Slf4j
@Service
public class QualityScorer {

    private static final List<Pattern> CLICKBAIT = List.of(
            Pattern.compile("(?i)you won'?t believe"),
            Pattern.compile("(?i)\\bshocking\\b"),
            Pattern.compile("(?i)\\bthis one trick\\b"),
            Pattern.compile("(?i)what happens next"),
            Pattern.compile("(?i)\\bgone wrong\\b"),
            Pattern.compile("(?i)^\\d+\\s+(reasons|things|ways)\\b"),
            Pattern.compile("!{2,}")
    );

    private static final List<String> BOILERPLATE_HINTS = List.of(
            "subscribe", "sign up", "newsletter", "cookie", "all rights reserved", "click here",
            "advertisement", "follow us", "share this", "read more", "terms of use", "privacy policy"
    );

    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final double spamCutoff;
    private final double degradedDefault;

    public QualityScorer(
            @Value("${quality.weights.reputation:0.30}") double reputation,
            @Value("${quality.weights.extraction:0.15}") double extraction,
            @Value("${quality.weights.length:0.20}") double length,
            @Value("${quality.weights.title:0.10}") double title,
            @Value("${quality.weights.relevance:0.10}") double relevance,
            @Value("${quality.weights.stuffing:0.075}") double stuffing,
            @Value("${quality.weights.boilerplate:0.075}") double boilerplate,
            @Value("${quality.spam-cutoff:0.3}") double spamCutoff,
            @Value("${quality.degraded-default-score:0.3}") double degradedDefault
    ) {
        weights.put("reputation", reputation);
        weights.put("extraction", extraction);
        weights.put("length", length);
        weights.put("title", title);
        weights.put("relevance", relevance);
        weights.put("stuffing", stuffing);
        weights.put("boilerplate", boilerplate);
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            if (w.getValue() < 0) throw new IllegalArgumentException("quality weight must be >= 0: " + w.getKey());
        }
        if (weights.values().stream().mapToDouble(Double::doubleValue).sum() <= 0) {
            throw new IllegalArgumentException("quality weights must not all be zero");
        }
        this.spamCutoff = spamCutoff;
        this.degradedDefault = clamp(degradedDefault);
    }

    public QualityAssessment score(ContentItem item, Source source) {
        String text = item.getText();
        if (source == null || text == null || text.isBlank() || item.getExtractionConfidence() == null) {
            log.debug("Scoring degraded canonicalUrl={} hasSource={} hasText={}",
                    item.getCanonicalUrl(), source != null, text != null && !text.isBlank());
            return new QualityAssessment(degradedDefault, degradedDefault < spamCutoff, true, Map.of());
        }

        Map<String, Double> signals = new HashMap<>();
        signals.put("reputation", reputation(source));
        signals.put("extraction", clamp(item.getExtractionConfidence()));
        signals.put("length", lengthAdequacy(text));
        signals.put("title", titleQuality(item.getTitle()));
        signals.put("relevance", sportsRelevance(item.getSportsKeywords()));
        signals.put("stuffing", keywordStuffing(text));
        signals.put("boilerplate", 1.0 - boilerplateRatio(text));

        double weighted = 0.0;
        double total = 0.0;
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            weighted += w.getValue() * signals.get(w.getKey());
            total += w.getValue();
        }

        double score = clamp(weighted / total);
        return new QualityAssessment(score, score < spamCutoff, false, signals);
    }

    static double reputation(Source source) {
        double tier = switch (source.getQualityTier()) {
            case 1 -> 0.9;
            case 2 -> 0.7;
            default -> 0.5;
        };
        return clamp(source.getReputationScore() * 0.6 + tier * 0.3 + source.getSuccessRate() * 0.1);
    }

    static double lengthAdequacy(String text) {
        int len = text.length();
        double band;
        if (len < 100) band = 0.1;
        else if (len < 300) band = 0.4;
        else if (len < 2000) band = 0.8;
        else band = 1.0;
        return clamp(band * (1.0 - boilerplateRatio(text)));
    }

    static double titleQuality(String title) {
        if (title == null || title.isBlank()) return 0.3;

        double score = 1.0;
        for (Pattern p : CLICKBAIT) {
            if (p.matcher(title).find()) score -= 0.3;
        }

        int letters = 0;
        int upper = 0;
        for (char c : title.toCharArray()) {
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            }
        }
        if (letters >= 10 && upper > letters * 0.5) score -= 0.3;

        int len = title.length();
        if (len < 10 || len > 200) score -= 0.2;
        return clamp(score);
    }

    static double sportsRelevance(String sportsKeywords) {
        int n = TextNormalizer.splitCsv(sportsKeywords).size();
        return n == 0 ? 0.2 : clamp(0.4 + 0.2 * n);
    }

    /**
     * 1.0 for natural text; drops as the most frequent token's share grows past 5%.
     */
    static double keywordStuffing(String text) {
        List<String> tokens = TextNormalizer.tokenize(text);
        if (tokens.size() < 20) return 1.0;

        Map<String, Integer> counts = new HashMap<>();
        int max = 0;
        for (String t : tokens) {
            int c = counts.merge(t, 1, Integer::sum);
            if (c > max) max = c;
        }
        double share = (double) max / tokens.size();
        double excess = Math.max(0.0, share - 0.05) / 0.25;
        return clamp(1.0 - excess);
    }

    static double boilerplateRatio(String text) {
        String[] lines = text.split("\\R+");
        int total = 0;
        int boiler = 0;
        Map<String, Integer> seen = new HashMap<>();
        for (String line : lines) {
            String l = line.trim().toLowerCase(Locale.ROOT);
            if (l.isEmpty()) continue;
            total++;
            boolean repeated = seen.merge(l, 1, Integer::sum) > 1;
            boolean hinted = l.length() < 200 && BOILERPLATE_HINTS.stream().anyMatch(l::contains);
            if (repeated || hinted) boiler++;
        }
        return total == 0 ? 1.0 : (double) boiler / total;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
