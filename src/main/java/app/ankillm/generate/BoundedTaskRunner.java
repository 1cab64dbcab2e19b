package app.ankillm.generate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one task per item with at most {@code width} tasks in flight, admitted through a fair
 * semaphore. Results come back in item order. Items not finished before the deadline get the
 * {@code onFailure} result and their tasks are interrupted.
 */
class BoundedTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(BoundedTaskRunner.class);

    static final String CANCELLED = "Cancelled: batch timeout";

    private final String threadPrefix;

    BoundedTaskRunner(String threadPrefix) {
        this.threadPrefix = threadPrefix;
    }

    <T, R> List<R> runAll(List<T> items,
                          Function<T, R> task,
                          BiFunction<T, String, R> onFailure,
                          int width,
                          Duration timeout) {
        if (items.isEmpty()) {
            return List.of();
        }
        int slots = Math.max(width, 1);
        long deadline = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Long.MAX_VALUE
                : System.nanoTime() + timeout.toNanos();

        Semaphore semaphore = new Semaphore(slots, true);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(slots, items.size()), threadFactory());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<R>> futures = new ArrayList<>(items.size());
        try {
            for (T item : items) {
                if (!acquire(semaphore, deadline)) {
                    break;
                }
                try {
                    futures.add(executor.submit(() -> {
                        if (mdc != null) {
                            MDC.setContextMap(mdc);
                        }
                        try {
                            return task.apply(item);
                        } finally {
                            semaphore.release();
                            MDC.clear();
                        }
                    }));
                } catch (RejectedExecutionException ex) {
                    semaphore.release();
                    log.warn("Task executor rejected item error={}", ex.getMessage());
                    break;
                }
            }

            List<R> results = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                T item = items.get(i);
                if (i >= futures.size()) {
                    results.add(onFailure.apply(item, CANCELLED));
                    continue;
                }
                results.add(await(futures.get(i), item, onFailure, deadline));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private <T, R> R await(Future<R> future, T item, BiFunction<T, String, R> onFailure, long deadline) {
        try {
            if (deadline == Long.MAX_VALUE) {
                return future.get();
            }
            long remaining = Math.max(deadline - System.nanoTime(), 0);
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException ex) {
            future.cancel(true);
            return onFailure.apply(item, CANCELLED);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return onFailure.apply(item, CANCELLED);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return onFailure.apply(item, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private boolean acquire(Semaphore semaphore, long deadline) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        try {
            if (deadline == Long.MAX_VALUE) {
                semaphore.acquire();
                return true;
            }
            long remaining = deadline - System.nanoTime();
            return remaining > 0 && semaphore.tryAcquire(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
