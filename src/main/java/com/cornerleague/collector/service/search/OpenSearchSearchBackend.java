package com.cornerleague.collector.service.search;

import com.cornerleague.collector.integration.opensearch.OpenSearchClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Stores documents in an OpenSearch index. Each document keeps its distinct tokens in a keyword field for
 * matching and its raw term frequencies in an unindexed object, so candidates are scored with the same
 * BM25 code path as the relational backend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "search.backend", havingValue = "opensearch")
public class OpenSearchSearchBackend implements SearchBackend {

    public static final String ENGINE = "opensearch";

    private final OpenSearchClient client;
    private final ObjectMapper mapper;

    private volatile boolean indexReady = false;

    @Override
    public String engine() {
        return ENGINE;
    }

    @Override
    public void upsert(IndexedDocument doc) {
        ensureIndex();
        client.putDocument(documentId(doc.canonicalUrl()), toSource(doc));
    }

    @Override
    public void delete(String canonicalUrl) {
        ensureIndex();
        client.deleteDocument(documentId(canonicalUrl));
    }

    @Override
    public CandidateSet candidates(SearchQuery query) {
        ensureIndex();

        ObjectNode body = mapper.createObjectNode();
        body.put("size", query.maxCandidates());

        ObjectNode bool = body.putObject("query").putObject("bool");
        ArrayNode filter = bool.putArray("filter");
        if (!query.includeSpam()) {
            filter.addObject().putObject("term").put("spam", false);
        }
        if (query.minQuality() > 0) {
            filter.addObject().putObject("range").putObject("qualityScore").put("gte", query.minQuality());
        }
        if (!query.sources().isEmpty()) {
            ArrayNode values = filter.addObject().putObject("terms").putArray("sourceDomain");
            query.sources().forEach(values::add);
        }
        if (!query.sports().isEmpty()) {
            ArrayNode values = filter.addObject().putObject("terms").putArray("sports");
            query.sports().forEach(values::add);
        }

        if (query.hasTerms()) {
            ArrayNode values = filter.addObject().putObject("terms").putArray("terms");
            query.terms().forEach(values::add);
        } else {
            ArrayNode sort = body.putArray("sort");
            sort.addObject().putObject("qualityScore").put("order", "desc");
            sort.addObject().putObject("publishedAt").put("order", "desc").put("missing", "_last");
        }

        ObjectNode corpus = body.putObject("aggs").putObject("corpus");
        corpus.putObject("global");
        ObjectNode corpusAggs = corpus.putObject("aggs");
        corpusAggs.putObject("avg_len").putObject("avg").put("field", "docLength");
        if (query.hasTerms()) {
            ObjectNode df = corpusAggs.putObject("df").putObject("terms");
            df.put("field", "terms");
            df.put("size", query.terms().size());
            ArrayNode include = df.putArray("include");
            query.terms().forEach(include::add);
        }

        JsonNode resp = client.search(body);

        List<IndexedDocument> docs = new ArrayList<>();
        for (JsonNode hit : resp.path("hits").path("hits")) {
            IndexedDocument doc = fromSource(hit.path("_source"));
            if (query.accepts(doc)) docs.add(doc);
        }

        JsonNode aggs = resp.path("aggregations").path("corpus");
        long n = aggs.path("doc_count").asLong(0);
        double avgdl = aggs.path("avg_len").path("value").asDouble(0.0);
        Map<String, Long> df = new HashMap<>();
        for (JsonNode bucket : aggs.path("df").path("buckets")) {
            df.put(bucket.path("key").asText(), bucket.path("doc_count").asLong());
        }

        return new CandidateSet(docs, new CorpusStats(n, avgdl, df));
    }

    private void ensureIndex() {
        if (indexReady) return;
        synchronized (this) {
            if (indexReady) return;
            if (!client.indexExists()) {
                log.info("OpenSearch index {} missing: creating", client.indexName());
                client.createIndex(indexDefinition());
            }
            indexReady = true;
        }
    }

    private ObjectNode indexDefinition() {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode props = body.putObject("mappings").putObject("properties");
        props.putObject("canonicalUrl").put("type", "keyword");
        props.putObject("contentItemId").put("type", "long");
        props.putObject("contentHash").put("type", "keyword");
        props.putObject("title").put("type", "text");
        props.putObject("byline").put("type", "text");
        props.putObject("sourceDomain").put("type", "keyword");
        props.putObject("sports").put("type", "keyword");
        props.putObject("sportsKeywords").put("type", "keyword");
        props.putObject("publishedAt").put("type", "date");
        props.putObject("qualityScore").put("type", "double");
        props.putObject("spam").put("type", "boolean");
        props.putObject("docLength").put("type", "integer");
        props.putObject("terms").put("type", "keyword");
        props.putObject("termFrequencies").put("type", "object").put("enabled", false);
        return body;
    }

    ObjectNode toSource(IndexedDocument doc) {
        ObjectNode src = mapper.createObjectNode();
        src.put("canonicalUrl", doc.canonicalUrl());
        if (doc.contentItemId() != null) src.put("contentItemId", doc.contentItemId());
        src.put("contentHash", doc.contentHash());
        src.put("title", doc.title());
        src.put("byline", doc.byline());
        src.put("sourceDomain", doc.sourceDomain());
        ArrayNode sports = src.putArray("sports");
        doc.sports().forEach(sports::add);
        ArrayNode keywords = src.putArray("sportsKeywords");
        doc.sportsKeywords().forEach(keywords::add);
        if (doc.publishedAt() != null) src.put("publishedAt", doc.publishedAt().toString());
        src.put("qualityScore", doc.qualityScore());
        src.put("spam", doc.spam());
        src.put("docLength", doc.docLength());

        ArrayNode terms = src.putArray("terms");
        ObjectNode tf = src.putObject("termFrequencies");
        doc.termFrequencies().forEach((term, count) -> {
            terms.add(term);
            tf.put(term, count);
        });
        return src;
    }

    IndexedDocument fromSource(JsonNode src) {
        List<String> sports = new ArrayList<>();
        src.path("sports").forEach(n -> sports.add(n.asText()));
        List<String> keywords = new ArrayList<>();
        src.path("sportsKeywords").forEach(n -> keywords.add(n.asText()));

        Map<String, Integer> tf = new HashMap<>();
        src.path("termFrequencies").fields().forEachRemaining(e -> tf.put(e.getKey(), e.getValue().asInt()));

        String published = src.path("publishedAt").asText(null);
        JsonNode id = src.path("contentItemId");

        return new IndexedDocument(
                src.path("canonicalUrl").asText(),
                id.isMissingNode() || id.isNull() ? null : id.asLong(),
                src.path("contentHash").asText(null),
                src.path("title").asText(null),
                src.path("byline").asText(null),
                src.path("sourceDomain").asText(null),
                sports,
                keywords,
                published == null || published.isBlank() ? null : Instant.parse(published),
                src.path("qualityScore").asDouble(0.0),
                src.path("spam").asBoolean(false),
                src.path("docLength").asInt(0),
                tf
        );
    }

    static String documentId(String canonicalUrl) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(canonicalUrl.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
