package com.cornerleague.collector.repository;

import com.cornerleague.collector.domain.entity.IngestionJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface IngestionJobRepository extends JpaRepository<IngestionJob, Long> {

    @Modifying
    @Transactional
    @Query("update IngestionJob j set j.itemsDiscovered = j.itemsDiscovered + :n where j.id = :id")
    int incrementDiscovered(@Param("id") Long id, @Param("n") int n);

    @Modifying
    @Transactional
    @Query("""
        update IngestionJob j
           set j.itemsProcessed = j.itemsProcessed + 1,
               j.itemsSuccessful = j.itemsSuccessful + 1
         where j.id = :id
        """)
    int incrementSuccessful(@Param("id") Long id);

    @Modifying
    @Transactional
    @Query("""
        update IngestionJob j
           set j.itemsProcessed = j.itemsProcessed + 1,
               j.itemsFailed = j.itemsFailed + 1
         where j.id = :id
        """)
    int incrementFailed(@Param("id") Long id);
}
