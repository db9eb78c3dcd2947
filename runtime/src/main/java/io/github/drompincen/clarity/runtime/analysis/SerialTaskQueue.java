package io.github.drompincen.clarity.runtime.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Single-consumer FIFO queue: submitted tasks run one at a time, in submission order, on the
 * given executor. At most one drain loop is active at any moment.
 */
public class SerialTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(SerialTaskQueue.class);

    private final Executor executor;
    private final Deque<Task<?>> pending = new ArrayDeque<>();
    private boolean draining;
    private long generation;

    public SerialTaskQueue(Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        Task<T> task = new Task<>(work);
        boolean startDrain;
        synchronized (this) {
            pending.addLast(task);
            startDrain = !draining;
            draining = true;
        }
        if (startDrain) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                log.warn("Executor rejected serial queue drain, failing queued tasks", e);
                failAll(e);
            }
        }
        return task.future;
    }

    /**
     * Cancels every queued task and bumps the generation. A task already running finishes, but
     * callers can compare {@link #generation()} to discard its result.
     */
    public void clear() {
        List<Task<?>> dropped;
        synchronized (this) {
            generation++;
            dropped = new ArrayList<>(pending);
            pending.clear();
        }
        dropped.forEach(task -> task.future.cancel(false));
    }

    public synchronized long generation() {
        return generation;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void drain() {
        while (true) {
            Task<?> task;
            synchronized (this) {
                task = pending.pollFirst();
                if (task == null) {
                    draining = false;
                    return;
                }
            }
            task.run();
        }
    }

    private void failAll(Throwable cause) {
        List<Task<?>> dropped;
        synchronized (this) {
            dropped = new ArrayList<>(pending);
            pending.clear();
            draining = false;
        }
        dropped.forEach(task -> task.future.completeExceptionally(cause));
    }

    private static final class Task<T> {
        private final Supplier<T> work;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        Task(Supplier<T> work) {
            this.work = work;
        }

        void run() {
            if (future.isDone()) return;
            try {
                future.complete(work.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } catch (Error e) {
                log.error("Serial task failed with an error", e);
                future.completeExceptionally(e);
            }
        }
    }
}
