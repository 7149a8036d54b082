package com.fantasyreport.collector.scheduler;

import com.fantasyreport.collector.domain.dto.IngestRunSummary;
import com.fantasyreport.collector.exception.IngestAbortedException;
import com.fantasyreport.collector.service.IngestionService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IngestionSchedulerTest {

    @Test
    void run_callsServiceWithRandomCorrelationId() {
        IngestionService svc = mock(IngestionService.class);
        when(svc.ingestAllSources(anyString()))
                .thenReturn(new IngestRunSummary("x", Instant.now(), 1, 0, 0, 0, 0, 0, 0, List.of(), null));
        IngestionScheduler scheduler = new IngestionScheduler(svc);

        scheduler.run();

        var cap = org.mockito.ArgumentCaptor.forClass(String.class);
        verify(svc).ingestAllSources(cap.capture());
        assertThat(cap.getValue()).isNotBlank();
        UUID.fromString(cap.getValue());
    }

    @Test
    void run_abortIsLoggedNotThrown() {
        IngestionService svc = mock(IngestionService.class);
        when(svc.ingestAllSources(anyString())).thenThrow(new IngestAbortedException("Datastore unavailable", null));

        assertDoesNotThrow(() -> new IngestionScheduler(svc).run());
    }
}
