package com.genai.anomaly.config;

import com.genai.anomaly.service.RecordIdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecordIdGenerator recordIdGenerator() {
        return RecordIdGenerator.randomUuid();
    }

    // Parallel per-metric evaluation within one detection pass
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService detectionExecutor(AnomalyProperties properties) {
        return Executors.newFixedThreadPool(properties.getDetection().getParallelism(), namedDaemon("detection-worker"));
    }

    // Asynchronous replay jobs, bounded so audits cannot starve live detection
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService replayExecutor(AnomalyProperties properties) {
        return Executors.newFixedThreadPool(properties.getReplay().getMaxConcurrent(), namedDaemon("replay-worker"));
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
