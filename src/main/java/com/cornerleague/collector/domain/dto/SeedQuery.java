package com.cornerleague.collector.domain.dto;

import java.time.Instant;

public record SeedQuery(
        String term,
        String query,
        double burstScore,
        Instant createdAt
) {}
