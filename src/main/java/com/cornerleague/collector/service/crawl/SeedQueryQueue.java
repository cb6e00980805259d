package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.dto.SeedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded hand-off of discovery seed queries from trending detection to the fetch scheduler.
 */
@Slf4j
@Component
public class SeedQueryQueue {

    private final BlockingQueue<SeedQuery> queue;

    public SeedQueryQueue(@Value("${trending.seed-queue-capacity:200}") int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public boolean offer(SeedQuery seed) {
        boolean accepted = queue.offer(seed);
        if (!accepted) {
            log.warn("Seed queue full, dropping seed term='{}' query='{}'", seed.term(), seed.query());
        }
        return accepted;
    }

    public List<SeedQuery> drain(int max) {
        List<SeedQuery> out = new ArrayList<>();
        queue.drainTo(out, max);
        return out;
    }

    public int size() {
        return queue.size();
    }
}
