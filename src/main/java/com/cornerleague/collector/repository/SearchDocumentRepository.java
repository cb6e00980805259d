package com.cornerleague.collector.repository;

import com.cornerleague.collector.domain.entity.SearchDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface SearchDocumentRepository extends JpaRepository<SearchDocument, String> {

    @Query("select coalesce(avg(d.docLength), 0) from SearchDocument d")
    double averageDocLength();

    @Query("select d from SearchDocument d order by d.qualityScore desc, d.publishedAt desc")
    List<SearchDocument> findTopByQuality(Pageable pageable);
}
