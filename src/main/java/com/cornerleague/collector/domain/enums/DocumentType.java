package com.cornerleague.collector.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum DocumentType {
    HTML,
    FEED,
    PLAIN_TEXT;

    public static Optional<DocumentType> fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) return Optional.of(HTML);
        String ct = contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("text/html") || ct.contains("application/xhtml+xml")) return Optional.of(HTML);
        if (ct.contains("rss+xml") || ct.contains("atom+xml") || ct.contains("application/xml") || ct.contains("text/xml")) {
            return Optional.of(FEED);
        }
        if (ct.contains("text/plain")) return Optional.of(PLAIN_TEXT);
        return Optional.empty();
    }
}
