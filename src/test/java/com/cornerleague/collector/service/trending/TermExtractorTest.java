package com.cornerleague.collector.service.trending;

import com.cornerleague.collector.domain.entity.ContentItem;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TermExtractorTest {

    private final TermExtractor extractor = new TermExtractor();

    @Test
    void terms_includeTitleUnigramsBigramsAndKeywords() {
        ContentItem item = ContentItem.builder()
                .title("Mahomes leads Chiefs to OT win")
                .sportsKeywords("nfl,Super Bowl")
                .build();

        assertThat(extractor.terms(item))
                .contains("mahomes", "chiefs", "mahomes leads", "chiefs ot", "ot win", "nfl", "super bowl")
                .doesNotContain("ot", "to");
    }
}
