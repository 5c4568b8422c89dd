package com.enterprise.softdelete.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for claimed delete operations
 *
 * 5W1H:
 * WHO: Cascade processor
 * WHAT: Bounded executor, one claimed operation per task
 * WHEN: Each poll cycle submits its claimed batch and waits for it
 * WHERE: In-process, sized by cascade-delete.processor.worker-threads
 * WHY: Bounds how many cascades one instance runs at a time
 * HOW: Caller-runs when the queue is full, so claimed work is never dropped
 */
@Configuration
@RequiredArgsConstructor
public class ProcessorConfig {

    private final CascadeDeleteProperties properties;

    @Bean(name = "cascadeDeleteTaskExecutor")
    public ThreadPoolTaskExecutor cascadeDeleteTaskExecutor() {
        int threads = Math.max(1, properties.getProcessor().getWorkerThreads());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getProcessor().getClaimBatchSize());
        executor.setThreadNamePrefix("cascade-delete-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
