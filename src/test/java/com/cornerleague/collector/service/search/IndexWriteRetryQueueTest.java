package com.cornerleague.collector.service.search;

import com.cornerleague.collector.exception.SearchBackendException;
import com.cornerleague.collector.repository.ContentItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexWriteRetryQueueTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    @Mock SearchBackend backend;
    @Mock ContentItemRepository contentItemRepository;

    private IndexWriteRetryQueue queue;

    @BeforeEach
    void setUp() {
        queue = new IndexWriteRetryQueue(backend, contentItemRepository, Clock.fixed(NOW, ZoneOffset.UTC), 2);
    }

    private static IndexedDocument doc(String url, Long id) {
        return new IndexedDocument(url, id, "h", "title", null, "espn.com", List.of(), List.of(), null,
                0.5, false, 10, Map.of("title", 1));
    }

    @Test
    void enqueue_keepsLatestVersionPerUrl_andRefusesWhenFull() {
        assertThat(queue.enqueue(doc("https://a.com/1", 1L))).isTrue();
        assertThat(queue.enqueue(doc("https://a.com/1", 1L))).isTrue();
        assertThat(queue.enqueue(doc("https://a.com/2", 2L))).isTrue();

        assertThat(queue.enqueue(doc("https://a.com/3", 3L))).isFalse();
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void flush_replaysInOrder_andMarksItemsIndexed() {
        IndexedDocument first = doc("https://a.com/1", 1L);
        IndexedDocument second = doc("https://a.com/2", 2L);
        queue.enqueue(first);
        queue.enqueue(second);

        queue.flush();

        InOrder order = inOrder(backend);
        order.verify(backend).upsert(first);
        order.verify(backend).upsert(second);
        verify(contentItemRepository).markIndexed(1L, NOW);
        verify(contentItemRepository).markIndexed(2L, NOW);
        assertThat(queue.size()).isZero();
    }

    @Test
    void flush_stopsAtFirstFailure_andKeepsRemainingWrites() {
        queue.enqueue(doc("https://a.com/1", 1L));
        queue.enqueue(doc("https://a.com/2", 2L));
        doThrow(new SearchBackendException("still down", null)).when(backend).upsert(any());

        queue.flush();

        verify(backend, times(1)).upsert(any());
        verifyNoInteractions(contentItemRepository);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void flush_markIndexedFailure_doesNotRequeue() {
        queue.enqueue(doc("https://a.com/1", 1L));
        doThrow(new QueryTimeoutException("slow")).when(contentItemRepository).markIndexed(eq(1L), any());

        queue.flush();

        assertThat(queue.size()).isZero();
    }

    @Test
    void discard_dropsPendingWrite() {
        queue.enqueue(doc("https://a.com/1", 1L));
        queue.discard("https://a.com/1");

        queue.flush();

        verifyNoInteractions(backend);
    }
}
