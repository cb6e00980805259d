package com.cornerleague.collector.repository;

import com.cornerleague.collector.domain.entity.Source;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SourceRepository extends JpaRepository<Source, Long> {

    List<Source> findAllByEnabledTrue();

    Optional<Source> findByDomain(String domain);

    @Modifying
    @Transactional
    @Query("""
        update Source s
           set s.successRate = :successRate,
               s.avgResponseTime = :avgResponseTime,
               s.consecutiveFailures = :consecutiveFailures,
               s.degraded = :degraded,
               s.lastCrawled = :lastCrawled,
               s.updatedAt = :lastCrawled
         where s.id = :id
        """)
    int updateTelemetry(@Param("id") Long id,
                        @Param("successRate") double successRate,
                        @Param("avgResponseTime") Double avgResponseTime,
                        @Param("consecutiveFailures") int consecutiveFailures,
                        @Param("degraded") boolean degraded,
                        @Param("lastCrawled") Instant lastCrawled);
}
