package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.ExtractionStatus;
import com.cornerleague.collector.repository.ContentItemRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContentController.class)
class ContentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ContentItemRepository contentItemRepository;

    @Test
    void get_returnsItemWithSplitTaxonomy() throws Exception {
        ContentItem item = ContentItem.builder()
                .id(12L)
                .source(Source.builder().id(1L).domain("espn.com").build())
                .canonicalUrl("https://espn.com/nba/story/1")
                .title("Celtics beat Knicks")
                .sports("basketball")
                .sportsKeywords("nba,celtics,knicks")
                .qualityScore(0.81)
                .extractionStatus(ExtractionStatus.EXTRACTED)
                .duplicate(true)
                .duplicateOfId(4L)
                .build();
        when(contentItemRepository.findById(12L)).thenReturn(Optional.of(item));

        mockMvc.perform(get("/api/content/{id}", 12L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceDomain").value("espn.com"))
                .andExpect(jsonPath("$.sports[0]").value("basketball"))
                .andExpect(jsonPath("$.sportsKeywords.length()").value(3))
                .andExpect(jsonPath("$.extractionStatus").value("EXTRACTED"))
                .andExpect(jsonPath("$.duplicate").value(true))
                .andExpect(jsonPath("$.duplicateOfId").value(4));
    }

    @Test
    void get_missing_is404() throws Exception {
        when(contentItemRepository.findById(5L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/content/{id}", 5L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void get_nonNumericId_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/content/{id}", "abc"))
                .andExpect(status().isBadRequest());
    }
}
