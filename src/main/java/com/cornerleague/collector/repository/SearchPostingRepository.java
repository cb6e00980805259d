package com.cornerleague.collector.repository;

import com.cornerleague.collector.domain.entity.SearchPosting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface SearchPostingRepository extends JpaRepository<SearchPosting, Long> {

    List<SearchPosting> findByTermIn(Collection<String> terms);

    List<SearchPosting> findByCanonicalUrlIn(Collection<String> canonicalUrls);

    @Query("""
        select p.term, count(p)
          from SearchPosting p
         where p.term in :terms
         group by p.term
        """)
    List<Object[]> countDocumentFrequencies(@Param("terms") Collection<String> terms);

    @Modifying
    @Query("delete from SearchPosting p where p.canonicalUrl = :canonicalUrl")
    int deleteByCanonicalUrl(@Param("canonicalUrl") String canonicalUrl);
}
