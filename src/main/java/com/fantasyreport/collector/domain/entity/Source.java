package com.fantasyreport.collector.domain.entity;

import com.fantasyreport.collector.domain.enums.FetchMethod;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "sources", schema = "content")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "feed_url", columnDefinition = "text")
    private String feedUrl;

    @Column(name = "homepage_url", columnDefinition = "text")
    private String homepageUrl;

    @Column(name = "scrape_selector", columnDefinition = "text")
    private String scrapeSelector;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "fetch_method", nullable = false, length = 20)
    private FetchMethod fetchMethod = FetchMethod.FEED;

    @Builder.Default
    @Column(nullable = false)
    private boolean allowed = true;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 0;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Builder.Default
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
    }
}
