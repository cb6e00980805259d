package com.cornerleague.collector.service.search;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.enums.SortOrder;
import com.cornerleague.collector.dto.SearchFilters;
import com.cornerleague.collector.dto.SearchHit;
import com.cornerleague.collector.dto.SearchRequest;
import com.cornerleague.collector.dto.SearchResponse;
import com.cornerleague.collector.exception.IndexUnavailableException;
import com.cornerleague.collector.exception.InvalidCursorException;
import com.cornerleague.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RankingService {

    private static final Comparator<Ranked> BY_SCORE = Comparator.comparingDouble(Ranked::score).reversed();
    private static final Comparator<Ranked> BY_QUALITY = Comparator.comparingDouble(Ranked::quality).reversed();
    private static final Comparator<Ranked> BY_DATE = Comparator.comparing(
            Ranked::publishedAt, Comparator.nullsLast(Comparator.reverseOrder()));
    private static final Comparator<Ranked> BY_URL = Comparator.comparing(Ranked::canonicalUrl);

    private final SearchBackend backend;
    private final Bm25Scorer bm25Scorer;
    private final SearchCursorCodec cursorCodec;
    private final SearchSnapshotCache snapshotCache;
    private final IndexWriteRetryQueue writeRetryQueue;
    private final Clock clock;

    @Value("${search.weights.text:0.6}")
    private double textWeight = 0.6;

    @Value("${search.weights.quality:0.25}")
    private double qualityWeight = 0.25;

    @Value("${search.weights.freshness:0.15}")
    private double freshnessWeight = 0.15;

    @Value("${search.freshness-half-life-hours:24}")
    private double halfLifeHours = 24;

    @Value("${search.unknown-date-freshness:0.3}")
    private double unknownDateFreshness = 0.3;

    @Value("${search.personalization-boost:0.1}")
    private double personalizationBoost = 0.1;

    @Value("${search.max-candidates:5000}")
    private int maxCandidates = 5000;

    /**
     * Upserts the item keyed by canonical URL. Duplicates are never indexed.
     *
     * @return true when the backend accepted the write; false when it was skipped or queued for retry
     */
    public boolean index(ContentItem item) {
        if (item.isDuplicate() || item.getCanonicalUrl() == null) {
            return false;
        }

        IndexedDocument doc = IndexedDocument.from(item);
        try {
            backend.upsert(doc);
            writeRetryQueue.discard(doc.canonicalUrl());
            return true;
        } catch (RuntimeException e) {
            log.warn("Index write failed for {} on {}, queued for retry: {}", doc.canonicalUrl(), backend.engine(), e.getMessage());
            writeRetryQueue.enqueue(doc);
            return false;
        }
    }

    public void remove(String canonicalUrl) {
        writeRetryQueue.discard(canonicalUrl);
        backend.delete(canonicalUrl);
    }

    public String engine() {
        return backend.engine();
    }

    public SearchResponse query(SearchRequest request) {
        long started = System.currentTimeMillis();

        SortOrder sort = request.getSortBy() != null ? request.getSortBy() : SortOrder.RELEVANCE;
        int limit = request.getLimit() != null ? request.getLimit() : 20;
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }

        SearchCursor cursor = cursorCodec.decode(request.getCursor());
        if (cursor != null && cursor.sort() != sort) {
            throw new InvalidCursorException("Cursor was issued for sort " + cursor.sort(), null);
        }
        Instant asOf = cursor != null ? Instant.ofEpochMilli(cursor.asOf()) : clock.instant().truncatedTo(ChronoUnit.MILLIS);

        SearchQuery query = toQuery(request, sort);
        String snapshotKey = snapshotKey(request, sort, limit);

        CandidateSet candidates;
        try {
            candidates = backend.candidates(query);
        } catch (RuntimeException e) {
            Optional<SearchResponse> snapshot = snapshotCache.get(snapshotKey);
            if (snapshot.isPresent()) {
                log.warn("Search backend {} failed, serving snapshot: {}", backend.engine(), e.getMessage());
                return snapshot.get().asCached(System.currentTimeMillis() - started);
            }
            throw new IndexUnavailableException("Search backend " + backend.engine() + " unavailable", e);
        }

        Set<String> favoriteSports = lowerSet(request.getFavoriteSports());
        Set<String> favoriteTeams = lowerSet(request.getFavoriteTeams());

        List<Ranked> ranked = new ArrayList<>();
        for (IndexedDocument doc : candidates.documents()) {
            if (!query.accepts(doc)) continue;

            double relevance = 0.0;
            if (query.hasTerms()) {
                double bm25 = bm25Scorer.score(doc, query.terms(), candidates.stats());
                if (bm25 <= 0.0) continue;
                relevance = bm25 / (bm25 + 1.0);
            }

            double score = textWeight * relevance
                    + qualityWeight * doc.qualityScore()
                    + freshnessWeight * freshness(doc.publishedAt(), asOf)
                    + personalization(doc, favoriteSports, favoriteTeams);
            ranked.add(new Ranked(doc, score));
        }

        Comparator<Ranked> order = comparatorFor(sort);
        ranked.sort(order);

        List<Ranked> remaining = ranked;
        if (cursor != null) {
            Ranked position = Ranked.position(cursor);
            remaining = ranked.stream().filter(r -> order.compare(r, position) > 0).collect(Collectors.toList());
        }

        boolean hasMore = remaining.size() > limit;
        List<Ranked> page = remaining.subList(0, Math.min(limit, remaining.size()));

        String nextCursor = null;
        if (hasMore) {
            Ranked last = page.get(page.size() - 1);
            nextCursor = cursorCodec.encode(new SearchCursor(
                    sort,
                    last.score(),
                    last.quality(),
                    last.publishedAt() != null ? last.publishedAt().toEpochMilli() : null,
                    last.canonicalUrl(),
                    asOf.toEpochMilli()
            ));
        }

        SearchResponse response = new SearchResponse(
                page.stream().map(Ranked::toHit).toList(),
                ranked.size(),
                hasMore,
                nextCursor,
                backend.engine(),
                false,
                System.currentTimeMillis() - started
        );
        snapshotCache.put(snapshotKey, response);

        log.debug("Search terms={} sort={} matched={} returned={} engine={}",
                query.terms(), sort, ranked.size(), page.size(), backend.engine());
        return response;
    }

    double freshness(Instant publishedAt, Instant asOf) {
        if (publishedAt == null) return unknownDateFreshness;
        double ageHours = Math.max(0L, Duration.between(publishedAt, asOf).toMillis()) / 3_600_000.0;
        return Math.pow(0.5, ageHours / halfLifeHours);
    }

    private double personalization(IndexedDocument doc, Set<String> favoriteSports, Set<String> favoriteTeams) {
        if (personalizationBoost <= 0.0) return 0.0;

        for (String sport : doc.sports()) {
            if (favoriteSports.contains(sport.toLowerCase(Locale.ROOT))) return personalizationBoost;
        }

        if (!favoriteTeams.isEmpty()) {
            String haystack = (String.valueOf(doc.title()) + " " + String.join(" ", doc.sportsKeywords())).toLowerCase(Locale.ROOT);
            for (String team : favoriteTeams) {
                if (haystack.contains(team)) return personalizationBoost;
            }
        }
        return 0.0;
    }

    private SearchQuery toQuery(SearchRequest request, SortOrder sort) {
        SearchFilters filters = request.getFilters();
        Set<String> sports = filters != null ? lowerSet(filters.getSports()) : Set.of();
        Set<String> sources = filters != null ? lowerSet(filters.getSources()) : Set.of();
        double minQuality = filters != null && filters.getMinQuality() != null ? filters.getMinQuality() : 0.0;

        List<String> terms = TextNormalizer.tokenize(request.getQuery()).stream().distinct().toList();
        return new SearchQuery(terms, sports, sources, minQuality, request.isIncludeSpam(), sort, maxCandidates);
    }

    private static String snapshotKey(SearchRequest request, SortOrder sort, int limit) {
        SearchFilters f = request.getFilters();
        return String.join("|",
                String.join(" ", TextNormalizer.tokenize(request.getQuery())),
                f != null ? String.valueOf(lowerSet(f.getSports())) : "",
                f != null ? String.valueOf(lowerSet(f.getSources())) : "",
                f != null ? String.valueOf(f.getMinQuality()) : "",
                sort.name(),
                String.valueOf(limit),
                String.valueOf(request.getCursor()),
                String.valueOf(request.isIncludeSpam()),
                String.valueOf(lowerSet(request.getFavoriteSports())),
                String.valueOf(lowerSet(request.getFavoriteTeams())));
    }

    private static Set<String> lowerSet(List<String> values) {
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> out = new TreeSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    static Comparator<Ranked> comparatorFor(SortOrder sort) {
        return switch (sort) {
            case RELEVANCE -> BY_SCORE.thenComparing(BY_DATE).thenComparing(BY_URL);
            case DATE -> BY_DATE.thenComparing(BY_SCORE).thenComparing(BY_URL);
            case QUALITY -> BY_QUALITY.thenComparing(BY_SCORE).thenComparing(BY_URL);
        };
    }

    record Ranked(IndexedDocument doc, double score, double quality, Instant publishedAt, String canonicalUrl) {

        Ranked(IndexedDocument doc, double score) {
            this(doc, score, doc.qualityScore(),
                    doc.publishedAt() != null ? doc.publishedAt().truncatedTo(ChronoUnit.MILLIS) : null,
                    doc.canonicalUrl());
        }

        static Ranked position(SearchCursor cursor) {
            Instant published = cursor.publishedAt() != null ? Instant.ofEpochMilli(cursor.publishedAt()) : null;
            return new Ranked(null, cursor.score(), cursor.quality(), published, cursor.canonicalUrl());
        }

        SearchHit toHit() {
            return new SearchHit(
                    doc.contentItemId(),
                    doc.canonicalUrl(),
                    doc.title(),
                    doc.byline(),
                    doc.sourceDomain(),
                    doc.sports(),
                    doc.publishedAt(),
                    doc.qualityScore(),
                    score
            );
        }
    }
}
