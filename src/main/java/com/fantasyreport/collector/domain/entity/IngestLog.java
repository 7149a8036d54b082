package com.fantasyreport.collector.domain.entity;

import com.fantasyreport.collector.domain.enums.IngestReason;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "ingest_logs", schema = "content")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id")
    private Long sourceId;

    @Column(columnDefinition = "text")
    private String url;

    @Column(columnDefinition = "text")
    private String title;

    @Column(length = 255)
    private String domain;

    @Column(nullable = false, length = 40)
    private IngestReason reason;

    @Column(columnDefinition = "text")
    private String detail;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
