package io.github.drompincen.clarity.runtime.analysis;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerialTaskQueueTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tasksRunOneAtATimeInSubmissionOrder() throws Exception {
        SerialTaskQueue queue = new SerialTaskQueue(executor);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            futures.add(queue.submit(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(2);
                order.add(n);
                running.decrementAndGet();
                return n;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(order).containsExactlyElementsOf(java.util.stream.IntStream.range(0, 20).boxed().toList());
        assertThat(queue.pendingCount()).isZero();
    }

    @Test
    void failureCompletesOnlyThatTask() throws Exception {
        SerialTaskQueue queue = new SerialTaskQueue(executor);

        CompletableFuture<String> failing = queue.submit(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = queue.submit(() -> "after");

        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("after");
        assertThat(failing).isCompletedExceptionally();
    }

    @Test
    void errorInTaskDoesNotStopLaterTasks() throws Exception {
        SerialTaskQueue queue = new SerialTaskQueue(executor);

        CompletableFuture<String> failing = queue.submit(() -> {
            throw new AssertionError("broken task");
        });
        CompletableFuture<String> next = queue.submit(() -> "after");

        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("after");
        assertThat(failing).isCompletedExceptionally();
        assertThat(queue.submit(() -> "later").get(5, TimeUnit.SECONDS)).isEqualTo("later");
    }

    @Test
    void clearCancelsQueuedTasksAndBumpsGeneration() throws Exception {
        SerialTaskQueue queue = new SerialTaskQueue(executor);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> blocking = queue.submit(() -> {
            started.countDown();
            await(release);
            return "first";
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> queued = queue.submit(() -> "second");
        long before = queue.generation();

        queue.clear();
        release.countDown();

        assertThat(queued).isCancelled();
        assertThat(queue.generation()).isEqualTo(before + 1);
        assertThat(blocking.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(queue.submit(() -> "third").get(5, TimeUnit.SECONDS)).isEqualTo("third");
    }

    @Test
    void rejectedExecutorFailsTheTask() {
        SerialTaskQueue queue = new SerialTaskQueue(command -> {
            throw new RejectedExecutionException("shut down");
        });

        CompletableFuture<String> future = queue.submit(() -> "never");

        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(queue.pendingCount()).isZero();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
