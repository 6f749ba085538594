package com.marketpush.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the push engine.
 *
 * <p>{@code pushTaskScheduler} owns every timer: recurring ticks, the accelerated
 * startup run and delayed follow-up messages. {@code pushWorkerExecutor} bounds how
 * many recipients one execution processes concurrently.
 */
@Configuration
public class AsyncConfig {

    private final PushProperties pushProperties;

    public AsyncConfig(PushProperties pushProperties) {
        this.pushProperties = pushProperties;
    }

    @Bean("pushTaskScheduler")
    public ThreadPoolTaskScheduler pushTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // two threads so a long execution never delays a pending welcome message
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("push-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean("pushWorkerExecutor")
    public ThreadPoolTaskExecutor pushWorkerExecutor() {
        int workers = Math.max(1, pushProperties.getDispatch().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("push-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
