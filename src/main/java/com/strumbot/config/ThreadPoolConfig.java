package com.strumbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools driving the watchers.
 *
 * <ul>
 *   <li>{@code watcherTimer}: a single thread that only fires ticks</li>
 *   <li>{@code watcherExecutor}: bounded pool running the ticks themselves</li>
 * </ul>
 *
 * <p>The worker pool uses {@link ThreadPoolExecutor.AbortPolicy}. Each watcher queues
 * at most one tick, so a rejection only happens when the pool is full of other
 * channels or shut down, and the watcher then completes that tick as FAILED.
 */
@Configuration
public class ThreadPoolConfig {

    private final StrumbotProperties properties;

    public ThreadPoolConfig(StrumbotProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "watcherExecutor")
    public ThreadPoolTaskExecutor watcherExecutor() {
        StrumbotProperties.Pool pool = properties.getPool();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getWorkerThreads());
        executor.setMaxPoolSize(pool.getWorkerThreads());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("strumbot-worker-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean(name = "watcherTimer")
    public ThreadPoolTaskScheduler watcherTimer() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("strumbot-timer-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
