package com.cornerleague.collector.service.dedup;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.DedupDecision;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.extract.MinHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.cornerleague.collector.service.dedup.NearDuplicateIndexTest.signature;
import static com.cornerleague.collector.service.dedup.NearDuplicateIndexTest.variant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DedupServiceTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    ContentItemRepository contentItemRepository;

    private DedupService service;

    @BeforeEach
    void setUp() {
        service = new DedupService(contentItemRepository, 0.8, 32, 4, 1000, 16, 0);
    }

    @Test
    void exactHashMatch_onOtherUrl_isExactDuplicateOfRepresentative() {
        ContentItem stored = ContentItem.builder().id(11L).canonicalUrl("https://espn.com/a").contentHash("h").build();
        when(contentItemRepository.findFirstByContentHash("h")).thenReturn(Optional.of(stored));

        DedupResult r = service.classifyAndRegister("https://yahoo.com/a", "h", signature(1), T0, 0.5);

        assertThat(r.decision()).isEqualTo(DedupDecision.EXACT_DUPLICATE);
        assertThat(r.representativeId()).isEqualTo(11L);
        assertThat(r.representativeKey()).isEqualTo("https://espn.com/a");
    }

    @Test
    void exactHashMatch_onDuplicateRow_pointsAtItsRepresentative() {
        ContentItem stored = ContentItem.builder().id(12L).canonicalUrl("https://cbs.com/a")
                .duplicate(true).duplicateOfId(3L).build();
        when(contentItemRepository.findFirstByContentHash("h")).thenReturn(Optional.of(stored));

        DedupResult r = service.classifyAndRegister("https://yahoo.com/a", "h", signature(1), T0, 0.5);

        assertThat(r.representativeId()).isEqualTo(3L);
    }

    @Test
    void ninetyFivePercentOverlap_isNearDuplicate() {
        when(contentItemRepository.findFirstByContentHash(anyString())).thenReturn(Optional.empty());
        long[] a = signature(4);

        DedupResult first = service.classifyAndRegister("https://espn.com/a", "h1", a, T0, 0.9);
        DedupResult second = service.classifyAndRegister("https://yahoo.com/a", "h2", variant(a, 6), T0, 0.5);

        assertThat(first.isUnique()).isTrue();
        assertThat(second.decision()).isEqualTo(DedupDecision.NEAR_DUPLICATE);
        assertThat(second.representativeKey()).isEqualTo("https://espn.com/a");
        assertThat(second.similarity()).isGreaterThanOrEqualTo(0.95);
    }

    @Test
    void sameUrlReRegistered_afterRelease_isUnique() {
        when(contentItemRepository.findFirstByContentHash(anyString())).thenReturn(Optional.empty());
        long[] a = signature(5);

        service.classifyAndRegister("https://espn.com/a", "h1", a, T0, 0.9);
        service.release("https://espn.com/a");

        assertThat(service.classifyAndRegister("https://espn.com/a", "h2", variant(a, 2), T0, 0.9).isUnique()).isTrue();
    }

    @Test
    void representativeOrder_prefersEarliestThenMostReputable() {
        NearDuplicateIndex.Entry early = new NearDuplicateIndex.Entry("b", new long[0], T0, 0.1, 1);
        NearDuplicateIndex.Entry late = new NearDuplicateIndex.Entry("a", new long[0], T0.plusSeconds(60), 0.9, 2);
        NearDuplicateIndex.Entry sameTimeBetter = new NearDuplicateIndex.Entry("c", new long[0], T0, 0.8, 3);

        List<NearDuplicateIndex.Match> matches = new ArrayList<>(List.of(
                new NearDuplicateIndex.Match(late, 0.9),
                new NearDuplicateIndex.Match(early, 0.9),
                new NearDuplicateIndex.Match(sameTimeBetter, 0.9)));
        matches.sort(DedupService.REPRESENTATIVE_ORDER);

        assertThat(matches).extracting(m -> m.entry().key()).containsExactly("c", "b", "a");
    }

    @Test
    void warmUp_loadsStoredSignatures_andToleratesDatabaseErrors() {
        DedupService warm = new DedupService(contentItemRepository, 0.8, 32, 4, 1000, 16, 10);
        Source src = Source.builder().id(1L).reputationScore(0.7).build();
        ContentItem stored = ContentItem.builder().canonicalUrl("https://espn.com/w").source(src)
                .minhashSignature(MinHasher.encode(signature(9))).publishedAt(T0).build();
        when(contentItemRepository.findRecentWithSignature(any(Pageable.class))).thenReturn(List.of(stored));

        warm.warmUp();
        assertThat(warm.index().contains("https://espn.com/w")).isTrue();

        DedupService broken = new DedupService(contentItemRepository, 0.8, 32, 4, 1000, 16, 10);
        when(contentItemRepository.findRecentWithSignature(any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));
        broken.warmUp();
        assertThat(broken.index().size()).isZero();
    }
}
