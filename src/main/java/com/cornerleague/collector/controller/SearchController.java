package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.enums.SortOrder;
import com.cornerleague.collector.dto.SearchFilters;
import com.cornerleague.collector.dto.SearchRequest;
import com.cornerleague.collector.dto.SearchResponse;
import com.cornerleague.collector.service.search.RankingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final RankingService rankingService;

    @PostMapping
    public ResponseEntity<SearchResponse> search(@RequestBody @Valid SearchRequest request) {
        return ResponseEntity.ok(rankingService.query(request));
    }

    @GetMapping
    public ResponseEntity<SearchResponse> searchByParams(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "sport", required = false) List<String> sports,
            @RequestParam(name = "source", required = false) List<String> sources,
            @RequestParam(name = "minQuality", required = false) Double minQuality,
            @RequestParam(name = "sort", required = false, defaultValue = "relevance") String sort,
            @RequestParam(name = "limit", required = false, defaultValue = "20") int limit,
            @RequestParam(name = "cursor", required = false) String cursor,
            @RequestParam(name = "includeSpam", required = false, defaultValue = "false") boolean includeSpam
    ) {
        if (query != null && query.length() > 500) {
            throw new IllegalArgumentException("q must be at most 500 characters");
        }
        if (minQuality != null && (minQuality < 0 || minQuality > 1)) {
            throw new IllegalArgumentException("minQuality must be between 0 and 1");
        }

        SearchRequest request = SearchRequest.builder()
                .query(query)
                .filters(SearchFilters.builder()
                        .sports(sports)
                        .sources(sources)
                        .minQuality(minQuality)
                        .build())
                .sortBy(parseSort(sort))
                .limit(limit)
                .cursor(cursor)
                .includeSpam(includeSpam)
                .build();
        return ResponseEntity.ok(rankingService.query(request));
    }

    private static SortOrder parseSort(String sort) {
        try {
            return SortOrder.valueOf(sort.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sort must be one of relevance, date, quality");
        }
    }
}
