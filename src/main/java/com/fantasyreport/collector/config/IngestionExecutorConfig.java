package com.fantasyreport.collector.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class IngestionExecutorConfig {

    // keep at or below the datasource pool size
    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(@Value("${ingest.workers:4}") int workers) {
        return Executors.newFixedThreadPool(Math.max(1, workers));
    }
}
