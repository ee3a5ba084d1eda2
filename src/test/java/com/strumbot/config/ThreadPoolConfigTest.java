package com.strumbot.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @Test
    void watcherExecutor_SizedFromPoolSettings_AbortsOnRejection() {
        // Given
        StrumbotProperties properties = new StrumbotProperties();
        properties.getPool().setWorkerThreads(3);
        properties.getPool().setQueueCapacity(7);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).watcherExecutor();

        // When
        executor.initialize();

        // Then
        try {
            ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
            assertThat(pool.getCorePoolSize()).isEqualTo(3);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(3);
            assertThat(pool.getQueue().remainingCapacity()).isEqualTo(7);
            assertThat(pool.getRejectedExecutionHandler()).isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void watcherExecutor_AfterShutdown_RejectsInsteadOfDropping() {
        // Given
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new StrumbotProperties()).watcherExecutor();
        executor.initialize();
        executor.shutdown();

        // When/Then
        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(TaskRejectedException.class)
                .isInstanceOf(RejectedExecutionException.class);
    }
}
