package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.enums.TermState;
import com.cornerleague.collector.service.trending.TrendingDetector;
import com.cornerleague.collector.service.trending.TrendingTerm;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrendingController.class)
class TrendingControllerTest {

    private static final Instant COMPUTED = Instant.parse("2025-10-28T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TrendingDetector trendingDetector;

    @Test
    void trending_returnsRankedTerms() throws Exception {
        when(trendingDetector.topTrending(2)).thenReturn(List.of(
                new TrendingTerm("tatum", 11, 2.0, 5.5, TermState.TRENDING, COMPUTED.minusSeconds(3600)),
                new TrendingTerm("ohtani", 4, 2.0, 2.0, TermState.RISING, COMPUTED)));
        when(trendingDetector.lastComputedAt()).thenReturn(COMPUTED);

        mockMvc.perform(get("/api/trending").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.terms[0].term").value("tatum"))
                .andExpect(jsonPath("$.terms[0].burstScore").value(5.5))
                .andExpect(jsonPath("$.terms[0].state").value("TRENDING"))
                .andExpect(jsonPath("$.terms[1].state").value("RISING"))
                .andExpect(jsonPath("$.terms[1].count").value(4))
                .andExpect(jsonPath("$.computedAt").exists());
    }

    @Test
    void trending_beforeFirstRecompute_isEmpty() throws Exception {
        when(trendingDetector.topTrending(10)).thenReturn(List.of());

        mockMvc.perform(get("/api/trending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.terms").isEmpty());
    }

    @Test
    void trending_limitOutOfRange_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/trending").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/trending").param("limit", "abc"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(trendingDetector);
    }
}
