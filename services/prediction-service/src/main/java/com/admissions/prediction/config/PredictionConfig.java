package com.admissions.prediction.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Shared infrastructure beans: the clock used for token timestamps and the
 * executor that runs predictor calls off the servlet thread.
 */
@Slf4j
@Configuration
public class PredictionConfig {

    /**
     * Time source for token issue and expiry checks. Tests replace it with a
     * fixed or manually advanced clock to exercise the expiry boundary.
     *
     * @return the system clock in UTC
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for predictor calls. A saturated pool rejects new work
     * (surfaced as a 500) instead of queueing without limit.
     */
    @Bean(name = "predictionExecutor")
    public ThreadPoolTaskExecutor predictionExecutor(PredictionExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(properties.getCorePoolSize(), properties.getMaxPoolSize()));
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("prediction-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Prediction executor ready: core={}, max={}, queue={}",
                properties.getCorePoolSize(), properties.getMaxPoolSize(), properties.getQueueCapacity());
        return executor;
    }
}
