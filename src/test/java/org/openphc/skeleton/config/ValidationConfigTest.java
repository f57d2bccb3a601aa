package org.openphc.skeleton.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ValidationConfig.
 */
class ValidationConfigTest {

    private final ThreadPoolTaskExecutor executor = new ValidationConfig().validationExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void shouldRunOnCallerThreadWhenSaturated() {
        executor.initialize();

        assertInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class,
                executor.getThreadPoolExecutor().getRejectedExecutionHandler());
    }

    @Test
    void shouldCompleteTasksBeyondQueueCapacity() throws Exception {
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.initialize();
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> blocking = CompletableFuture.runAsync(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, executor);
        CompletableFuture<String> queued = CompletableFuture.supplyAsync(() -> "queued", executor);
        CompletableFuture<String> overflow = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor);

        assertEquals(Thread.currentThread().getName(), overflow.get(1, TimeUnit.SECONDS));
        release.countDown();
        blocking.get(5, TimeUnit.SECONDS);
        assertEquals("queued", queued.get(5, TimeUnit.SECONDS));
    }
}
