package com.cornerleague.collector.integration.summarizer;

import java.util.List;

public record SummaryResult(
        String summary,
        double confidenceScore,
        List<String> keyEntities,
        long generationTimeMs
) {}
