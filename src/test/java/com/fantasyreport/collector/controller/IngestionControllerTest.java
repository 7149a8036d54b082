package com.fantasyreport.collector.controller;

import com.fantasyreport.collector.domain.dto.IngestRunSummary;
import com.fantasyreport.collector.exception.IngestAbortedException;
import com.fantasyreport.collector.service.IngestionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IngestionController.class)
class IngestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IngestionService ingestionService;

    private static IngestRunSummary summary(String cid) {
        return new IngestRunSummary(cid, Instant.parse("2024-10-01T00:00:00Z"), 42, 3, 10, 4, 0, 5, 1,
                List.of("sourceId=7 Gave up"), null);
    }

    @Test
    void runIngestion_passesParametersAndReturnsSummary() throws Exception {
        when(ingestionService.run("cid-1", null, 20, true)).thenReturn(summary("cid-1"));

        mockMvc.perform(post("/admin/ingestion/run")
                        .param("correlationId", "cid-1")
                        .param("limit", "20")
                        .param("verbose", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correlationId").value("cid-1"))
                .andExpect(jsonPath("$.inserted").value(4))
                .andExpect(jsonPath("$.skipped").value(5))
                .andExpect(jsonPath("$.errorMessages[0]").value("sourceId=7 Gave up"))
                .andExpect(jsonPath("$.sources").doesNotExist());
    }

    @Test
    void runIngestion_generatesCorrelationIdIfMissing() throws Exception {
        when(ingestionService.run(anyString(), isNull(), isNull(), eq(false))).thenReturn(summary("generated"));

        mockMvc.perform(post("/admin/ingestion/run"))
                .andExpect(status().isOk());

        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(ingestionService).run(captor.capture(), isNull(), isNull(), eq(false));
        assertThat(captor.getValue()).isNotBlank();
        UUID.fromString(captor.getValue());
    }

    @Test
    void runIngestionForSource_runsSingleSourceVerbose() throws Exception {
        when(ingestionService.run("cid-2", 10L, null, true)).thenReturn(summary("cid-2"));

        mockMvc.perform(post("/admin/ingestion/run/{sourceId}", 10L)
                        .param("correlationId", "cid-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correlationId").value("cid-2"));

        verify(ingestionService).run("cid-2", 10L, null, true);
    }

    @Test
    void abortedRunIsServiceUnavailable() throws Exception {
        when(ingestionService.run(anyString(), isNull(), isNull(), eq(false)))
                .thenThrow(new IngestAbortedException("Datastore unavailable: connection refused", null));

        mockMvc.perform(post("/admin/ingestion/run"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("ingest_aborted"))
                .andExpect(jsonPath("$.message").value("Datastore unavailable: connection refused"));
    }

    @Test
    void unknownSourceIsBadRequest() throws Exception {
        when(ingestionService.run(anyString(), eq(404L), isNull(), eq(true)))
                .thenThrow(new IllegalArgumentException("Source not found: 404"));

        mockMvc.perform(post("/admin/ingestion/run/{sourceId}", 404L))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"))
                .andExpect(jsonPath("$.message").value("Source not found: 404"));
    }

    @Test
    void limitOutOfRangeIsRejectedBeforeRunning() throws Exception {
        mockMvc.perform(post("/admin/ingestion/run").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));

        mockMvc.perform(post("/admin/ingestion/run/{sourceId}", 3L).param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));

        verifyNoInteractions(ingestionService);
    }
}
