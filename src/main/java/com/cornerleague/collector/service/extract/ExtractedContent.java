package com.cornerleague.collector.service.extract;

import java.time.Instant;

/**
 * Fields pulled out of one fetched document. {@code confidence} is in [0,1] and reflects
 * how specific the selector that produced the body text was.
 */
public record ExtractedContent(
        String title,
        String text,
        String byline,
        Instant publishedAt,
        String canonicalUrlHint,
        double confidence,
        String method
) {}
