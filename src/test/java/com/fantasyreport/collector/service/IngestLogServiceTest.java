package com.fantasyreport.collector.service;

import com.fantasyreport.collector.domain.entity.IngestLog;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.repository.IngestLogRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestLogServiceTest {

    @Mock IngestLogRepository ingestLogRepository;

    @InjectMocks IngestLogService ingestLogService;

    @Test
    void record_enrichesWithDomainAndCorrelationId() {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", "cid-42")) {
            ingestLogService.record(3L, "https://www.s.com/a1", "Title", IngestReason.NON_NFL_LEAGUE, "league=OTHER");
        }

        ArgumentCaptor<IngestLog> cap = ArgumentCaptor.forClass(IngestLog.class);
        verify(ingestLogRepository).save(cap.capture());
        IngestLog entry = cap.getValue();
        assertEquals(3L, entry.getSourceId());
        assertEquals("s.com", entry.getDomain());
        assertEquals(IngestReason.NON_NFL_LEAGUE, entry.getReason());
        assertEquals("league=OTHER", entry.getDetail());
        assertEquals("cid-42", entry.getCorrelationId());
        assertNotNull(entry.getCreatedAt());
    }

    @Test
    void record_neverThrows() {
        when(ingestLogRepository.save(any(IngestLog.class))).thenThrow(new RuntimeException("db down"));

        assertDoesNotThrow(() -> ingestLogService.sourceFailure(1L, "https://s.com/feed", IngestReason.FETCH_ERROR, "404"));
    }

    @Test
    void reasonCodesRoundTrip() {
        for (IngestReason r : IngestReason.values()) {
            assertSame(r, IngestReason.fromCode(r.code()));
        }
        assertEquals("non_nfl_league", IngestReason.NON_NFL_LEAGUE.code());
    }
}
