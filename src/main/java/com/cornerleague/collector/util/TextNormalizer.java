package com.cornerleague.collector.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@UtilityClass
public class TextNormalizer {

    private static final Pattern MULTI_WS = Pattern.compile("\\s+");
    private static final Pattern PUNCT = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    public static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "can", "had", "her", "was",
            "one", "our", "out", "has", "have", "his", "him", "its", "this", "that", "with",
            "from", "they", "will", "would", "there", "their", "what", "when", "which", "who",
            "been", "were", "said", "says", "into", "than", "then", "them", "these", "those",
            "a", "an", "as", "at", "be", "by", "in", "is", "it", "of", "on", "or", "to", "he",
            "she", "we", "do", "if", "so", "up", "no", "my", "me", "us", "about", "after",
            "over", "more", "also", "just", "some", "could", "should", "may", "new"
    );

    /**
     * Normalization for hashing and shingling: lower-case, punctuation to spaces,
     * stopwords and tokens of two chars or fewer removed, single spaces.
     */
    public String normalizeForHash(String text) {
        if (text == null || text.isBlank()) return "";
        String x = PUNCT.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        StringBuilder sb = new StringBuilder(x.length());
        for (String word : MULTI_WS.split(x.trim())) {
            if (word.length() <= 2 || STOPWORDS.contains(word)) continue;
            if (!sb.isEmpty()) sb.append(' ');
            sb.append(word);
        }
        return sb.toString();
    }

    /**
     * Tokens used for indexing, querying and term counting.
     */
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : NON_ALNUM.split(text.toLowerCase(Locale.ROOT))) {
            if (t.length() < 2 || STOPWORDS.contains(t)) continue;
            out.add(t);
        }
        return out;
    }

    public String collapseWhitespace(String s) {
        if (s == null) return null;
        String x = MULTI_WS.matcher(s).replaceAll(" ").trim();
        return x.isEmpty() ? null : x;
    }

    public List<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String p : csv.split(",")) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public String joinCsv(Collection<String> values) {
        if (values == null || values.isEmpty()) return null;
        Set<String> distinct = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) distinct.add(v.trim());
        }
        return distinct.isEmpty() ? null : String.join(",", distinct);
    }
}
