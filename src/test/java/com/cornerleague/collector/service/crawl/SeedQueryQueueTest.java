package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.dto.SeedQuery;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeedQueryQueueTest {

    private static SeedQuery seed(String term) {
        return new SeedQuery(term, term, 6.0, Instant.EPOCH);
    }

    @Test
    void offer_dropsWhenFull() {
        SeedQueryQueue queue = new SeedQueryQueue(2);

        assertTrue(queue.offer(seed("tatum")));
        assertTrue(queue.offer(seed("ohtani")));
        assertFalse(queue.offer(seed("mahomes")));
        assertEquals(2, queue.size());
    }

    @Test
    void drain_takesAtMostMax_inArrivalOrder() {
        SeedQueryQueue queue = new SeedQueryQueue(10);
        queue.offer(seed("a"));
        queue.offer(seed("b"));
        queue.offer(seed("c"));

        List<SeedQuery> first = queue.drain(2);

        assertEquals(List.of("a", "b"), first.stream().map(SeedQuery::term).toList());
        assertEquals(1, queue.size());
        assertEquals(1, queue.drain(10).size());
        assertTrue(queue.drain(10).isEmpty());
    }
}
