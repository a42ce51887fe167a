package org.tanzu.pvemcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools used by the engine.
 *
 * - pvePollScheduler times the poll loops and runs the daily alert cleanup; it never
 *   performs remote calls itself
 * - pvePollWorkers runs the poll cycles; it grows with the number of cycles in flight,
 *   so a slow endpoint never delays another endpoint's cycle
 * - pveBatchExecutor is the bounded pool shared by every batch dispatch
 */
@Configuration
public class ExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorConfig.class);

    static final int TIMER_THREADS = 2;

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pvePollScheduler() {
        logger.info("Creating poll scheduler with {} threads", TIMER_THREADS);
        return Executors.newScheduledThreadPool(TIMER_THREADS, new CustomizableThreadFactory("pve-timer-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pvePollWorkers() {
        logger.info("Creating poll worker pool");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("pve-poll-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pveBatchExecutor(PveProperties pveProperties) {
        int concurrency = Math.max(1, pveProperties.getBatch().getConcurrency());
        logger.info("Creating batch executor with concurrency {}", concurrency);
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("pve-batch-"));
    }
}
