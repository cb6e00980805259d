package com.cornerleague.collector.service.trending;

import com.cornerleague.collector.domain.enums.TermState;

import java.time.Instant;

public record TrendingTerm(
        String term,
        int count,
        double baseline,
        double burstScore,
        TermState state,
        Instant since
) {

    public boolean isTrending() {
        return state == TermState.TRENDING;
    }
}
