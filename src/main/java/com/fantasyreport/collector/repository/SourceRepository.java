package com.fantasyreport.collector.repository;

import com.fantasyreport.collector.domain.entity.Source;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface SourceRepository extends JpaRepository<Source, Long> {

    List<Source> findAllByAllowedTrueOrderByPriorityDescIdAsc();

    @Modifying
    @Transactional
    @Query("""
           update Source s
           set s.feedUrl = :feedUrl, s.updatedAt = :updatedAt
           where s.id = :id
           """)
    int updateFeedUrl(@Param("id") Long id, @Param("feedUrl") String feedUrl, @Param("updatedAt") Instant updatedAt);
}
