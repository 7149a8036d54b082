package com.fantasyreport.collector.service;

import com.fantasyreport.collector.domain.entity.IngestLog;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.repository.IngestLogRepository;
import com.fantasyreport.collector.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Append-only diagnostic trail for the health dashboard. Writing a log entry never throws: a failed write
 * is reported to the application log and the pipeline carries on with the item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestLogService {

    private static final int MAX_DETAIL = 2000;

    private final IngestLogRepository ingestLogRepository;

    public void record(Long sourceId, String url, String title, IngestReason reason, String detail) {
        try {
            IngestLog entry = IngestLog.builder()
                    .sourceId(sourceId)
                    .url(url)
                    .title(title == null ? null : TextUtils.abbreviate(title, 500))
                    .domain(TextUtils.hostOf(url))
                    .reason(reason)
                    .detail(detail == null ? null : TextUtils.abbreviate(detail, MAX_DETAIL))
                    .correlationId(MDC.get("corrId"))
                    .createdAt(Instant.now())
                    .build();
            ingestLogRepository.save(entry);
        } catch (Exception e) {
            log.warn("IngestLog: write failed sourceId={} reason={} url={} err={}",
                    sourceId, reason.code(), url, e.toString());
        }
    }

    public void sourceFailure(Long sourceId, String url, IngestReason reason, String detail) {
        record(sourceId, url, null, reason, detail);
    }
}
