package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dispatches a raw document to the strategy registered for its {@link DocumentType}
 * and applies the checks every strategy's output must pass.
 */
@Slf4j
@Service
public class ContentExtractionService {

    private static final Pattern MULTI_WS = Pattern.compile("[ \\t\\x0B\\f\\r]+");

    private final Map<DocumentType, ExtractionStrategy> strategies = new EnumMap<>(DocumentType.class);

    @Value("${extractor.min-text-length:100}")
    private int minTextLength;

    public ContentExtractionService(List<ExtractionStrategy> strategies) {
        for (ExtractionStrategy s : strategies) {
            ExtractionStrategy previous = this.strategies.put(s.type(), s);
            if (previous != null) {
                throw new IllegalStateException("Two extraction strategies for " + s.type());
            }
        }
    }

    public ExtractedContent extract(RawDocument document) {
        ExtractionStrategy strategy = strategies.get(document.type());
        if (strategy == null) {
            throw new ExtractionException("No extraction strategy for type=" + document.type());
        }

        ExtractedContent raw = strategy.extract(document);
        String text = normalize(raw.text());
        if (text == null || text.length() < minTextLength) {
            throw new ExtractionException("Text too short len=" + (text == null ? 0 : text.length())
                    + " min=" + minTextLength + " url=" + document.finalUrl());
        }

        String title = raw.title();
        if (title == null || title.isBlank()) {
            title = firstSentence(text);
        }

        log.debug("Extracted url={} method={} confidence={} len={}", document.finalUrl(), raw.method(), raw.confidence(), text.length());
        return new ExtractedContent(title, text, raw.byline(),
                raw.publishedAt() != null ? raw.publishedAt() : document.publishedHint(),
                raw.canonicalUrlHint(), raw.confidence(), raw.method());
    }

    private static String normalize(String s) {
        if (s == null) return null;
        StringBuilder sb = new StringBuilder(s.length());
        for (String line : s.split("\\R+")) {
            String l = MULTI_WS.matcher(line).replaceAll(" ").trim();
            if (l.isEmpty()) continue;
            if (!sb.isEmpty()) sb.append("\n");
            sb.append(l);
        }
        return sb.isEmpty() ? null : sb.toString();
    }

    private static String firstSentence(String text) {
        int end = text.indexOf(". ");
        String s = end > 0 ? text.substring(0, end) : text;
        return s.length() > 160 ? s.substring(0, 160).trim() : s.trim();
    }
}
