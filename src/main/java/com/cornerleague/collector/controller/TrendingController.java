package com.cornerleague.collector.controller;

import com.cornerleague.collector.service.trending.TrendingDetector;
import com.cornerleague.collector.service.trending.TrendingTerm;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/trending")
@RequiredArgsConstructor
public class TrendingController {

    private final TrendingDetector trendingDetector;

    @GetMapping
    public ResponseEntity<TrendingResponse> trending(
            @RequestParam(name = "limit", required = false, defaultValue = "10") int limit
    ) {
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }

        List<TrendingTermResponse> terms = trendingDetector.topTrending(limit).stream()
                .map(TrendingTermResponse::from)
                .toList();
        return ResponseEntity.ok(new TrendingResponse(terms, trendingDetector.lastComputedAt()));
    }

    public record TrendingResponse(List<TrendingTermResponse> terms, Instant computedAt) {}

    public record TrendingTermResponse(
            String term,
            double burstScore,
            boolean isTrending,
            String state,
            int count,
            Instant since
    ) {
        static TrendingTermResponse from(TrendingTerm t) {
            return new TrendingTermResponse(t.term(), t.burstScore(), t.isTrending(), t.state().name(), t.count(), t.since());
        }
    }
}
