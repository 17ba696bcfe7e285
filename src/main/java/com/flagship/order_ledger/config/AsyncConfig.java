package com.flagship.order_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Executor for projection dispatch.
 *
 * The pool is bounded. When it is saturated a dispatch is dropped with a
 * warning rather than run on the caller, because the caller is the command
 * path. The catch-up poller applies dropped events later.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "projectionExecutor")
    public ThreadPoolTaskExecutor projectionExecutor(
            @Value("${orders.projection.executor.core-pool-size:4}") int corePoolSize,
            @Value("${orders.projection.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${orders.projection.executor.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("projection-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Projection executor saturated (queue={}), dispatch dropped; catch-up will apply it",
                        pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Projection executor initialized - Core: {}, Max: {}, Queue: {}",
                corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    /**
     * Copies the submitting thread's MDC into the task, so projection logs
     * keep the correlation ID of the command that appended the events.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
