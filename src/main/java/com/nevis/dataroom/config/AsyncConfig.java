package com.nevis.dataroom.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "pipelineTaskExecutor")
    public Executor pipelineTaskExecutor() {
        return boundedExecutor("index-run-", 1);
    }

    @Bean(name = "converterTaskExecutor")
    public Executor converterTaskExecutor(ConverterProperties converterProperties) {
        return boundedExecutor("convert-", converterProperties.concurrency());
    }

    @Bean(name = "rasterTaskExecutor")
    public Executor rasterTaskExecutor(IndexerProperties indexerProperties) {
        return boundedExecutor("raster-", indexerProperties.rasterConcurrency());
    }

    @Bean(name = "summaryTaskExecutor")
    public Executor summaryTaskExecutor(SummaryProperties summaryProperties) {
        return boundedExecutor("summary-", summaryProperties.concurrency());
    }

    // Queue-backed so that work chained from a worker thread never waits for a free slot.
    private static ThreadPoolTaskExecutor boundedExecutor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
