package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
public class ContentController {

    private final ContentItemRepository contentItemRepository;

    @GetMapping("/{id}")
    public ResponseEntity<ContentItemResponse> get(@PathVariable("id") Long id) {
        ContentItem item = contentItemRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Content item not found: " + id));
        return ResponseEntity.ok(ContentItemResponse.from(item));
    }

    public record ContentItemResponse(
            Long id,
            String sourceDomain,
            String originalUrl,
            String canonicalUrl,
            String title,
            String byline,
            String text,
            String summary,
            Instant publishedAt,
            int wordCount,
            List<String> sports,
            List<String> sportsKeywords,
            String contentType,
            Double qualityScore,
            String extractionStatus,
            boolean duplicate,
            Long duplicateOfId,
            boolean spam,
            Instant indexedAt
    ) {
        static ContentItemResponse from(ContentItem c) {
            return new ContentItemResponse(
                    c.getId(),
                    c.getSource() != null ? c.getSource().getDomain() : null,
                    c.getOriginalUrl(),
                    c.getCanonicalUrl(),
                    c.getTitle(),
                    c.getByline(),
                    c.getText(),
                    c.getSummary(),
                    c.getPublishedAt(),
                    c.getWordCount(),
                    TextNormalizer.splitCsv(c.getSports()),
                    TextNormalizer.splitCsv(c.getSportsKeywords()),
                    c.getContentType(),
                    c.getQualityScore(),
                    c.getExtractionStatus() != null ? c.getExtractionStatus().name() : null,
                    c.isDuplicate(),
                    c.getDuplicateOfId(),
                    c.isSpam(),
                    c.getIndexedAt()
            );
        }
    }
}
