package com.cornerleague.collector.service.dedup;

import com.cornerleague.collector.service.extract.MinHasher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded window of recent MinHash signatures with LSH banding. Band buckets are spread over
 * shards, each behind its own read/write lock; lookups take read locks, inserts take the write
 * locks of the shards their band keys fall into (always in ascending shard order).
 * Two signatures that share any band bucket therefore never insert concurrently.
 */
public class NearDuplicateIndex {

    public record Entry(String key, long[] signature, Instant publishedAt, double reputation, long seq) {}

    public record Match(Entry entry, double similarity) {}

    private final int bands;
    private final int rows;
    private final int capacity;
    private final Shard[] shards;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<Entry> insertionOrder = new ConcurrentLinkedDeque<>();
    private final AtomicLong seq = new AtomicLong();

    public NearDuplicateIndex(int bands, int rows, int capacity, int shardCount) {
        if (bands <= 0 || rows <= 0) throw new IllegalArgumentException("bands and rows must be > 0");
        this.bands = bands;
        this.rows = rows;
        this.capacity = Math.max(1, capacity);
        this.shards = new Shard[Math.max(1, shardCount)];
        for (int i = 0; i < shards.length; i++) {
            shards[i] = new Shard();
        }
    }

    public int size() {
        return entries.size();
    }

    int trackedInsertions() {
        return insertionOrder.size();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public List<Match> findSimilar(long[] signature, double threshold, String excludeKey) {
        long[] keys = bandKeys(signature);
        Set<String> candidates = new HashSet<>();
        for (long k : keys) {
            Shard shard = shards[shardOf(k)];
            shard.lock.readLock().lock();
            try {
                Set<String> bucket = shard.buckets.get(k);
                if (bucket != null) candidates.addAll(bucket);
            } finally {
                shard.lock.readLock().unlock();
            }
        }
        return score(candidates, signature, threshold, excludeKey);
    }

    /**
     * Inserts the signature unless a similar one is already present; returns the matches found
     * (empty when the entry was inserted).
     */
    public List<Match> insertIfUnique(String key, long[] signature, Instant publishedAt, double reputation, double threshold) {
        long[] keys = bandKeys(signature);
        int[] shardIdx = sortedShards(keys);

        List<Match> matches;
        lockAll(shardIdx);
        try {
            Set<String> candidates = new HashSet<>();
            for (long k : keys) {
                Set<String> bucket = shards[shardOf(k)].buckets.get(k);
                if (bucket != null) candidates.addAll(bucket);
            }
            matches = score(candidates, signature, threshold, key);
            if (matches.isEmpty()) {
                Entry entry = new Entry(key, signature.clone(), publishedAt, reputation, seq.incrementAndGet());
                entries.put(key, entry);
                for (long k : keys) {
                    shards[shardOf(k)].buckets.computeIfAbsent(k, x -> new HashSet<>()).add(key);
                }
                insertionOrder.addLast(entry);
            }
        } finally {
            unlockAll(shardIdx);
        }

        if (matches.isEmpty()) {
            evictOverflow();
        }
        return matches;
    }

    public boolean remove(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return false;
        if (!unlink(key, entry)) return false;
        insertionOrder.removeFirstOccurrence(entry);
        return true;
    }

    private boolean unlink(String key, Entry entry) {
        long[] keys = bandKeys(entry.signature());
        int[] shardIdx = sortedShards(keys);
        lockAll(shardIdx);
        try {
            if (!entries.remove(key, entry)) return false;
            for (long k : keys) {
                Map<Long, Set<String>> buckets = shards[shardOf(k)].buckets;
                Set<String> bucket = buckets.get(k);
                if (bucket == null) continue;
                bucket.remove(key);
                if (bucket.isEmpty()) buckets.remove(k);
            }
            return true;
        } finally {
            unlockAll(shardIdx);
        }
    }

    private void evictOverflow() {
        while (entries.size() > capacity) {
            Entry oldest = insertionOrder.pollFirst();
            if (oldest == null) return;
            Entry live = entries.get(oldest.key());
            if (live != null && live.seq() == oldest.seq()) {
                unlink(oldest.key(), live);
            }
        }
    }

    private List<Match> score(Set<String> candidates, long[] signature, double threshold, String excludeKey) {
        List<Match> out = new ArrayList<>();
        for (String c : candidates) {
            if (c.equals(excludeKey)) continue;
            Entry e = entries.get(c);
            if (e == null) continue;
            double sim = MinHasher.similarity(signature, e.signature());
            if (sim >= threshold) out.add(new Match(e, sim));
        }
        return out;
    }

    long[] bandKeys(long[] signature) {
        if (signature.length < bands * rows) {
            throw new IllegalArgumentException("signature length " + signature.length + " < bands*rows " + bands * rows);
        }
        long[] keys = new long[bands];
        for (int b = 0; b < bands; b++) {
            long h = 0x9E3779B97F4A7C15L * (b + 1);
            for (int r = 0; r < rows; r++) {
                h = h * 31 + signature[b * rows + r];
            }
            keys[b] = h;
        }
        return keys;
    }

    private int shardOf(long bandKey) {
        return Math.floorMod(Long.hashCode(bandKey), shards.length);
    }

    private int[] sortedShards(long[] keys) {
        return Arrays.stream(keys).mapToInt(this::shardOf).distinct().sorted().toArray();
    }

    private void lockAll(int[] shardIdx) {
        for (int i : shardIdx) shards[i].lock.writeLock().lock();
    }

    private void unlockAll(int[] shardIdx) {
        for (int i = shardIdx.length - 1; i >= 0; i--) shards[shardIdx[i]].lock.writeLock().unlock();
    }

    private static final class Shard {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<Long, Set<String>> buckets = new HashMap<>();
    }
}
