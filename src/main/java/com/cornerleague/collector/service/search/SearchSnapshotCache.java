package com.cornerleague.collector.service.search;

import com.cornerleague.collector.dto.SearchResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last good response per query key, served when the backend cannot answer.
 */
@Component
public class SearchSnapshotCache {

    private final Map<String, SearchResponse> snapshots;

    public SearchSnapshotCache(@Value("${search.snapshot-capacity:256}") int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("search.snapshot-capacity must be >= 1");
        this.snapshots = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SearchResponse> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void put(String key, SearchResponse response) {
        snapshots.put(key, response);
    }

    public synchronized Optional<SearchResponse> get(String key) {
        return Optional.ofNullable(snapshots.get(key));
    }

    public synchronized int size() {
        return snapshots.size();
    }
}
