package com.chicu.aiforecast.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({
        PipelineProperties.class,
        SourceProperties.class,
        FeatureProperties.class,
        TrainingProperties.class,
        InsightProperties.class
})
public class PipelineConfig {

    /**
     * Количество источников фиксировано, пул не больше их числа.
     */
    private static final int CONNECTOR_COUNT = 3;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "collectorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collectorExecutor(PipelineProperties props) {
        int size = Math.max(1, Math.min(props.getMaxConcurrentCalls(), CONNECTOR_COUNT));
        return Executors.newFixedThreadPool(size, daemonFactory("SourceCollector-"));
    }

    @Bean(name = "trainingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService trainingExecutor(TrainingProperties props) {
        int size = Math.max(1, props.getThreads());
        return Executors.newFixedThreadPool(size, daemonFactory("ModelTrainer-"));
    }

    static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(prefix + seq.incrementAndGet());
            return t;
        };
    }
}
