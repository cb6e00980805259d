package com.cornerleague.collector.repository;

import com.cornerleague.collector.domain.entity.ContentItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ContentItemRepository extends JpaRepository<ContentItem, Long> {

    Optional<ContentItem> findByCanonicalUrl(String canonicalUrl);

    Optional<ContentItem> findFirstByContentHash(String contentHash);

    @Query("""
        select c
          from ContentItem c
          join fetch c.source
         where c.duplicate = false
           and c.minhashSignature is not null
         order by c.id desc
        """)
    List<ContentItem> findRecentWithSignature(Pageable pageable);

    @Query("""
        select c.canonicalUrl
          from ContentItem c
         where c.canonicalUrl in :urls
           and (c.extractionStatus = com.cornerleague.collector.domain.enums.ExtractionStatus.EXTRACTED
                or c.extractionStatus = com.cornerleague.collector.domain.enums.ExtractionStatus.SKIPPED
                or c.retryCount >= :maxRetries)
        """)
    Set<String> findSettledUrls(@Param("urls") Set<String> urls, @Param("maxRetries") int maxRetries);

    @Query("""
        select c
          from ContentItem c
         where c.indexedAt >= :from
           and c.indexedAt < :to
           and c.duplicate = false
        """)
    List<ContentItem> findIndexedBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("""
        select c
          from ContentItem c
          join fetch c.source
         where c.needsRescore = true
           and c.duplicate = false
           and c.id > :afterId
         order by c.id
        """)
    List<ContentItem> findNeedingRescoreAfter(@Param("afterId") long afterId, Pageable pageable);

    @Modifying
    @Transactional
    @Query("update ContentItem c set c.indexedAt = :indexedAt where c.id = :id")
    int markIndexed(@Param("id") Long id, @Param("indexedAt") Instant indexedAt);

    @Modifying
    @Transactional
    @Query("update ContentItem c set c.needsRescore = true where c.id = :id")
    int flagForRescore(@Param("id") Long id);

    @Modifying
    @Transactional
    @Query("update ContentItem c set c.summary = :summary, c.summaryConfidence = :confidence where c.id = :id")
    int updateSummary(@Param("id") Long id, @Param("summary") String summary, @Param("confidence") Double confidence);
}
