package com.fantasyreport.collector.repository;

import com.fantasyreport.collector.domain.entity.BlockedUrl;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BlockedUrlRepository extends JpaRepository<BlockedUrl, Long> {

    boolean existsByUrl(String url);
}
