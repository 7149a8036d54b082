package com.fantasyreport.collector.config;

import com.fantasyreport.collector.classifier.ClassifierRuleConfig;
import com.fantasyreport.collector.filter.AdmissionRuleConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Classifier and admission tables are data, not code. Point {@code ingest.classifier-rules} or
 * {@code ingest.admission-rules} at a file to retune them without a rebuild.
 */
@Slf4j
@Configuration
public class RuleSetConfig {

    @Bean
    public ClassifierRuleConfig classifierRuleConfig(
            ObjectMapper objectMapper,
            @Value("${ingest.classifier-rules:classpath:classifier-rules.json}") Resource resource
    ) {
        return read(objectMapper, resource, ClassifierRuleConfig.class);
    }

    @Bean
    public AdmissionRuleConfig admissionRuleConfig(
            ObjectMapper objectMapper,
            @Value("${ingest.admission-rules:classpath:admission-rules.json}") Resource resource
    ) {
        return read(objectMapper, resource, AdmissionRuleConfig.class);
    }

    public static <T> T read(ObjectMapper objectMapper, Resource resource, Class<T> type) {
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(in);
            log.info("Rules: loaded type={} from={}", type.getSimpleName(), resource.getDescription());
            return value;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load rules from " + resource.getDescription(), e);
        }
    }
}
