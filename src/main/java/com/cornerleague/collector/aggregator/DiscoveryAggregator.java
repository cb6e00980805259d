package com.cornerleague.collector.aggregator;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.source.DiscoverySource;
import crawlercommons.robots.BaseRobotRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs every discovery source for one Source concurrently and merges the results,
 * keeping the first occurrence of each canonical URL.
 */
@Slf4j
@Component
public class DiscoveryAggregator {

    private final List<DiscoverySource> sources;
    private final Executor executor;

    public DiscoveryAggregator(List<DiscoverySource> sources, @Qualifier("discoveryExecutor") Executor executor) {
        this.sources = sources;
        this.executor = executor;
    }

    public List<DiscoveredUrl> discover(Source source, BaseRobotRules robotRules) {
        List<CompletableFuture<List<DiscoveredUrl>>> futures = sources.stream()
                .map(src -> CompletableFuture.supplyAsync(() -> {
                    List<DiscoveredUrl> data = src.discover(source, robotRules);
                    log.debug("Discovered {} urls from {} sourceId={}", data.size(), src.name(), source.getId());
                    return data;
                }, executor).exceptionally(ex -> {
                    log.warn("Discovery {} failed sourceId={}: {}", src.name(), source.getId(), ex.toString());
                    return List.of();
                }))
                .toList();

        Map<String, DiscoveredUrl> merged = new LinkedHashMap<>();
        futures.stream()
                .map(CompletableFuture::join)
                .flatMap(List::stream)
                .forEach(d -> merged.putIfAbsent(d.canonicalUrl(), d));

        return new ArrayList<>(merged.values());
    }
}
