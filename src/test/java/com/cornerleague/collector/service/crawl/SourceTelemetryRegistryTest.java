package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.repository.SourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceTelemetryRegistryTest {

    private static final Instant NOW = Instant.parse("2025-05-05T05:00:00Z");

    @Mock
    SourceRepository sourceRepository;

    private SourceTelemetryRegistry registry;
    private Source source;

    @BeforeEach
    void setUp() {
        registry = new SourceTelemetryRegistry(sourceRepository, Clock.fixed(NOW, ZoneOffset.UTC), 0.2, 3, 4.0);
        source = Source.builder().id(1L).domain("espn.com").crawlFrequency(600).successRate(1.0).build();
    }

    @Test
    void consecutiveTransientFailures_degradeSource_andLengthenInterval() {
        for (int i = 0; i < 2; i++) {
            assertThat(registry.recordTransientFailure(source, 100).degraded()).isFalse();
        }
        SourceTelemetry third = registry.recordTransientFailure(source, 100);

        assertThat(third.degraded()).isTrue();
        assertThat(third.consecutiveFailures()).isEqualTo(3);
        assertThat(third.successRate()).isCloseTo(0.512, within(1e-9));
        assertThat(registry.effectiveInterval(source)).isGreaterThan(Duration.ofSeconds(600));
        verify(sourceRepository, times(3)).updateTelemetry(eq(1L), anyDouble(), any(), anyInt(), anyBoolean(), eq(NOW));
    }

    @Test
    void crawlStart_defersTheNextRun_withoutTouchingHealth() {
        assertThat(registry.isDue(source, NOW)).isTrue();

        SourceTelemetry started = registry.recordCrawlStarted(source);

        assertThat(started.lastCrawled()).isEqualTo(NOW);
        assertThat(started.successRate()).isEqualTo(1.0);
        assertThat(started.consecutiveFailures()).isZero();
        assertThat(registry.isDue(source, NOW)).isFalse();
        assertThat(registry.isDue(source, NOW.plusSeconds(599))).isFalse();
        assertThat(registry.isDue(source, NOW.plusSeconds(600))).isTrue();
        verify(sourceRepository).updateTelemetry(1L, 1.0, null, 0, false, NOW);
    }

    @Test
    void success_clearsDegradation() {
        for (int i = 0; i < 3; i++) registry.recordTransientFailure(source, 100);

        SourceTelemetry recovered = registry.recordSuccess(source, 250);

        assertThat(recovered.degraded()).isFalse();
        assertThat(recovered.consecutiveFailures()).isZero();
        assertThat(registry.effectiveInterval(source)).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void averageResponseTime_isSmoothed() {
        registry.recordSuccess(source, 100);
        SourceTelemetry second = registry.recordSuccess(source, 200);

        assertThat(second.avgResponseTimeMs()).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void isDue_followsLastCrawlAndInterval() {
        assertThat(registry.isDue(source, NOW)).isTrue();

        registry.recordSuccess(source, 50);

        assertThat(registry.isDue(source, NOW.plusSeconds(599))).isFalse();
        assertThat(registry.isDue(source, NOW.plusSeconds(600))).isTrue();
    }

    @Test
    void permanentFailure_doesNotDegrade() {
        SourceTelemetry t = registry.recordPermanentFailure(source);

        assertThat(t.degraded()).isFalse();
        assertThat(t.successRate()).isEqualTo(1.0);
        assertThat(t.lastCrawled()).isEqualTo(NOW);
    }

    @Test
    void persistenceFailure_doesNotLoseInMemoryState() {
        when(sourceRepository.updateTelemetry(anyLong(), anyDouble(), any(), anyInt(), anyBoolean(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> registry.recordTransientFailure(source, 100)).doesNotThrowAnyException();
        assertThat(registry.current(source).consecutiveFailures()).isEqualTo(1);
    }
}
