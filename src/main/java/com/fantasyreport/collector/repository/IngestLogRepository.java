package com.fantasyreport.collector.repository;

import com.fantasyreport.collector.domain.entity.IngestLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IngestLogRepository extends JpaRepository<IngestLog, Long> {
}
