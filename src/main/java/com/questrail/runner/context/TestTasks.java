package com.questrail.runner.context;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TestTasks
 * -----------------------------------------------------------------------------
 * Concurrent work started from inside a test body.
 *
 * <ul>
 *   <li>{@link #spawn} carries the caller's {@link RunContext} into the new
 *       unit of work, so its reports are attributed to the calling test.</li>
 *   <li>{@link #detached} starts work with no context. Its reports reach the
 *       run through {@link ActiveRuns}.</li>
 * </ul>
 *
 * The runner does not track these units; a body that needs their outcome
 * waits on the returned future before it returns.
 */
public final class TestTasks
{
    private static final AtomicInteger THREAD_COUNT = new AtomicInteger();
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "test-task-" + THREAD_COUNT.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private TestTasks() {}

    public static <T> CompletableFuture<T> spawn(Callable<T> work) {
        Objects.requireNonNull(work, "work");
        return submit(RunContext.current().map(context -> context.wrap(work)).orElse(work));
    }

    public static <T> CompletableFuture<T> detached(Callable<T> work) {
        return submit(Objects.requireNonNull(work, "work"));
    }

    private static <T> CompletableFuture<T> submit(Callable<T> work) {
        CompletableFuture<T> future = new CompletableFuture<>();
        EXECUTOR.execute(() -> {
            try {
                future.complete(work.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }
}
