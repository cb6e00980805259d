package com.cornerleague.collector.domain.dto;

import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.DocumentType;

import java.time.Instant;

public record RawDocument(
        Source source,
        String originalUrl,
        String finalUrl,
        String body,
        DocumentType type,
        Instant publishedHint,
        Instant fetchedAt,
        Long jobId,
        String correlationId
) {}
