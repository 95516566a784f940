package com.fantasycricket.season_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class IngestionExecutorConfig {

    /**
     * Worker pool shared by every batch. One club is one task, so this also
     * caps how many clubs are applied at once across concurrent batches.
     */
    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(@Value("${fantasy.ingestion.parallelism:4}") int parallelism) {
        if (parallelism < 1) {
            throw new IllegalStateException("fantasy.ingestion.parallelism must be at least 1, was " + parallelism);
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "ingest-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
