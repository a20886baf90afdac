package com.apogee.config;

import com.apogee.service.core.CancellationToken;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads of the pipeline: a bounded pool for approved topics processed in parallel and a single
 * scheduler thread that fires the recurring batch.
 */
@Slf4j
@Configuration
public class PipelineExecutionConfig {

    @Bean
    public CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    /** Used only when {@code app.pipeline.item-concurrency} is above 1 */
    @Bean("workItemExecutor")
    public TaskExecutor workItemExecutor(PipelineProperties properties) {
        int concurrency = properties.getItemConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("WorkItem-");

        // cancellation ends every wait, so running items finish quickly on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(
                (int) properties.getShutdownGracePeriod().toSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.initialize();

        log.info("Initialized WorkItem ThreadPoolTaskExecutor: core=max={}", concurrency);
        return executor;
    }

    @Bean("pipelineTaskScheduler")
    public ThreadPoolTaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("PipelineScheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(
                t -> log.error("Scheduled pipeline task failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }
}
