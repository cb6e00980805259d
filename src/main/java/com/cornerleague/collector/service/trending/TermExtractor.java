package com.cornerleague.collector.service.trending;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Candidate trending terms of one item. Each term counts at most once per item.
 */
@Component
public class TermExtractor {

    public Set<String> terms(ContentItem item) {
        Set<String> out = new LinkedHashSet<>();

        List<String> tokens = TextNormalizer.tokenize(item.getTitle());
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (t.length() >= 3) out.add(t);
            if (i + 1 < tokens.size()) out.add(t + " " + tokens.get(i + 1));
        }

        for (String keyword : TextNormalizer.splitCsv(item.getSportsKeywords())) {
            out.add(keyword.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
