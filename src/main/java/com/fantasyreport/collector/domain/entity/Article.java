package com.fantasyreport.collector.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "articles",
        schema = "content",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_articles_canonical_url", columnNames = "canonical_url"),
                @UniqueConstraint(name = "uq_articles_fingerprint", columnNames = "fingerprint")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_id", nullable = false)
    private Source source;

    @Column(nullable = false, columnDefinition = "text")
    private String url;

    @Column(name = "canonical_url", nullable = false, columnDefinition = "text")
    private String canonicalUrl;

    @Column(length = 255)
    private String domain;

    @Column(nullable = false, columnDefinition = "text")
    private String title;

    @Column(name = "cleaned_title", columnDefinition = "text")
    private String cleanedTitle;

    @Column(nullable = false, length = 120)
    private String slug;

    @Column(nullable = false, length = 40)
    private String fingerprint;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Builder.Default
    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt = Instant.now();

    @Builder.Default
    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "topics", columnDefinition = "text[]")
    private List<String> topics = new ArrayList<>();

    @Column(name = "primary_topic", length = 40)
    private String primaryTopic;

    @Column(name = "secondary_topic", length = 40)
    private String secondaryTopic;

    @Column(name = "topic_confidence")
    private Double topicConfidence;

    private Integer week;

    @Builder.Default
    @Column(nullable = false, length = 20)
    private String sport = "nfl";

    // populated by enrichment jobs outside the ingest path
    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    @Column(name = "is_player_page")
    private Boolean playerPage;
}
