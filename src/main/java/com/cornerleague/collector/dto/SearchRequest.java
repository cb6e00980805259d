package com.cornerleague.collector.dto;

import com.cornerleague.collector.domain.enums.SortOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @Size(max = 500)
    private String query;

    @Valid
    private SearchFilters filters;

    @Builder.Default
    private SortOrder sortBy = SortOrder.RELEVANCE;

    @Min(1)
    @Max(100)
    @Builder.Default
    private Integer limit = 20;

    private String cursor;

    @Builder.Default
    private boolean includeSpam = false;

    private List<String> favoriteSports;

    private List<String> favoriteTeams;
}
