package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.exception.ExtractionException;
import org.springframework.stereotype.Component;

@Component
public class PlainTextExtractionStrategy implements ExtractionStrategy {

    @Override
    public DocumentType type() {
        return DocumentType.PLAIN_TEXT;
    }

    @Override
    public ExtractedContent extract(RawDocument document) {
        String body = document.body();
        if (body == null || body.isBlank()) {
            throw new ExtractionException("Empty text body url=" + document.finalUrl());
        }

        String trimmed = body.strip();
        int nl = trimmed.indexOf('\n');
        String title = nl > 0 ? trimmed.substring(0, nl).trim() : null;
        String text = nl > 0 ? trimmed.substring(nl + 1).trim() : trimmed;

        return new ExtractedContent(title, text, null, null, null, 0.4, "plain-text");
    }
}
