package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.enums.DocumentType;

public interface ExtractionStrategy {

    DocumentType type();

    /**
     * @throws com.cornerleague.collector.exception.ExtractionException when the document is malformed
     */
    ExtractedContent extract(RawDocument document);
}
