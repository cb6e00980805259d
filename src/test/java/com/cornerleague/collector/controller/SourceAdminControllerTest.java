package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.RobotsRulesCache;
import com.cornerleague.collector.repository.SourceRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SourceAdminController.class)
class SourceAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SourceRepository sourceRepository;

    @MockitoBean
    private RobotsRulesCache robotsRulesCache;

    @Test
    void listSources_returnsSortedSources() throws Exception {
        when(sourceRepository.findAll(any(Sort.class))).thenReturn(List.of(
                Source.builder().id(1L).name("ESPN").domain("espn.com").baseUrl("https://espn.com").build(),
                Source.builder().id(2L).name("CBS").domain("cbssports.com").baseUrl("https://cbssports.com")
                        .degraded(true).build()));

        mockMvc.perform(get("/admin/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].domain").value("espn.com"))
                .andExpect(jsonPath("$[0].crawlFrequency").value(3600))
                .andExpect(jsonPath("$[1].degraded").value(true));
    }

    @Test
    void createSource_normalizesDomain_andAppliesDefaults() throws Exception {
        when(sourceRepository.save(any(Source.class))).thenAnswer(inv -> {
            Source s = inv.getArgument(0);
            s.setId(3L);
            return s;
        });

        String payload = """
                {
                  "name": "ESPN",
                  "domain": " ESPN.com ",
                  "baseUrl": "https://www.espn.com",
                  "rssUrl": "https://www.espn.com/espn/rss/news"
                }
                """;

        mockMvc.perform(post("/admin/sources").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.domain").value("espn.com"))
                .andExpect(jsonPath("$.qualityTier").value(2))
                .andExpect(jsonPath("$.reputationScore").value(0.5))
                .andExpect(jsonPath("$.enabled").value(true));

        ArgumentCaptor<Source> captor = ArgumentCaptor.forClass(Source.class);
        verify(sourceRepository).save(captor.capture());
        assertThat(captor.getValue().getCrawlFrequency()).isEqualTo(3600);
    }

    @Test
    void createSource_rejectsInvalidPayload() throws Exception {
        String payload = """
                { "name": "", "domain": "espn.com", "baseUrl": "https://espn.com", "crawlFrequency": 5 }
                """;

        mockMvc.perform(post("/admin/sources").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
        verifyNoInteractions(sourceRepository);
    }

    @Test
    void createSource_duplicateDomain_isBadRequest() throws Exception {
        when(sourceRepository.save(any(Source.class))).thenThrow(new DataIntegrityViolationException("uq_domain"));

        String payload = """
                { "name": "ESPN", "domain": "espn.com", "baseUrl": "https://espn.com" }
                """;

        mockMvc.perform(post("/admin/sources").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Source domain already exists: espn.com"));
    }

    @Test
    void updateSource_updatesFields_andInvalidatesRobotsOnRobotsChange() throws Exception {
        Source existing = Source.builder().id(3L).name("Old").domain("espn.com").baseUrl("https://espn.com").build();
        when(sourceRepository.findById(3L)).thenReturn(Optional.of(existing));
        when(sourceRepository.save(existing)).thenReturn(existing);

        String payload = """
                { "enabled": false, "crawlFrequency": 900, "robotsTxtUrl": "https://espn.com/robots-bots.txt" }
                """;

        mockMvc.perform(patch("/admin/sources/{id}", 3L).contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.crawlFrequency").value(900))
                .andExpect(jsonPath("$.name").value("Old"));

        verify(robotsRulesCache).invalidate("espn.com");
    }

    @Test
    void updateSource_missing_is404() throws Exception {
        when(sourceRepository.findById(8L)).thenReturn(Optional.empty());

        mockMvc.perform(patch("/admin/sources/{id}", 8L).contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound());
    }
}
