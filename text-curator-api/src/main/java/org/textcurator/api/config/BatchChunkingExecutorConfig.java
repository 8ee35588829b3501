package org.textcurator.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Configuration for the executor that chunks the texts of batch jobs.
 *
 * <p>The pool is separate from the JVM common pool so batch load has bounded
 * concurrency and queueing, and shuts down cleanly. Each text of a batch is one task.
 */
@Configuration
@EnableConfigurationProperties(BatchChunkingExecutorConfig.BatchChunkingExecutorProperties.class)
public class BatchChunkingExecutorConfig {

    @Bean(name = "batchChunkingExecutor")
    public Executor batchChunkingExecutor(BatchChunkingExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCoreSize());
        executor.setMaxPoolSize(props.getMaxSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix("batch-chunking-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Bound from {@code curator.batch.executor.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "curator.batch.executor")
    public static class BatchChunkingExecutorProperties {

        /**
         * Core number of threads kept alive in the pool.
         */
        private int coreSize = 4;

        /**
         * Maximum number of threads allowed in the pool.
         */
        private int maxSize = 8;

        /**
         * Maximum number of queued texts before new tasks are rejected.
         */
        private int queueCapacity = 10000;

        /**
         * Seconds to wait during shutdown for running tasks to complete.
         */
        private int awaitTerminationSeconds = 30;
    }
}
