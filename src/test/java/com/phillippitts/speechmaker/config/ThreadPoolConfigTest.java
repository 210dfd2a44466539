package com.phillippitts.speechmaker.config;

import com.phillippitts.speechmaker.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void createsPoolsFromDefaultProperties() {
        ThreadPoolTaskExecutor conversion = config.conversionExecutor();
        ThreadPoolTaskExecutor session = (ThreadPoolTaskExecutor) config.sessionExecutor();
        ThreadPoolTaskExecutor resource = (ThreadPoolTaskExecutor) config.resourceExecutor();
        try {
            assertThat(conversion.getCorePoolSize()).isEqualTo(3);
            assertThat(conversion.getMaxPoolSize()).isEqualTo(4);
            assertThat(conversion.getThreadNamePrefix()).isEqualTo("conversion-pool-");
            assertThat(session.getThreadNamePrefix()).isEqualTo("session-pool-");
            assertThat(resource.getMaxPoolSize()).isEqualTo(2);
        } finally {
            conversion.shutdown();
            session.shutdown();
            resource.shutdown();
        }
    }

    @Test
    void handlesConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.conversionExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void callerRunsWhenPoolAndQueueAreFull() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getResource().setCorePoolSize(1);
        props.getResource().setMaxPoolSize(1);
        props.getResource().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).resourceExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();
        try {
            executor.execute(() -> awaitQuietly(release));
            executor.execute(() -> awaitQuietly(release));

            executor.execute(() -> ranOn.set(Thread.currentThread().getName()));

            assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void rejectsInsteadOfDroppingOnceShutDown() {
        ThreadPoolTaskExecutor executor = config.conversionExecutor();
        executor.shutdown();
        AtomicInteger ran = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(ran::incrementAndGet))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(ran.get()).isZero();
    }

    @Test
    void propagatesThreadContextToWorkers() throws InterruptedException {
        Executor executor = config.sessionExecutor();
        ThreadContext.put("requestId", "req-42");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(
                () -> assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("sessionId", "worker-own");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("sessionId")).isEqualTo("worker-own");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
