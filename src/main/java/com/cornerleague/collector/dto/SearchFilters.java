package com.cornerleague.collector.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {

    private List<String> sports;

    private List<String> sources;

    @Min(0)
    @Max(1)
    private Double minQuality;
}
