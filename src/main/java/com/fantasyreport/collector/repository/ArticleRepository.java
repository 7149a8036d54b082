package com.fantasyreport.collector.repository;

import com.fantasyreport.collector.domain.entity.Article;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ArticleRepository extends JpaRepository<Article, Long> {

    boolean existsByCanonicalUrlOrFingerprint(String canonicalUrl, String fingerprint);
}
