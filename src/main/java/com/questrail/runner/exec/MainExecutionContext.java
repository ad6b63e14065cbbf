package com.questrail.runner.exec;

import com.questrail.runner.context.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * MainExecutionContext
 * =============================================================================
 * The single, process-wide serial execution context that isolated test bodies
 * are bound to.
 *
 * <h2>Threading model</h2>
 * A dedicated daemon thread drains a queue of submitted work in submission
 * order; at most one unit runs at any time. The thread is started on first
 * use and lives for the rest of the process.
 *
 * <h2>Context propagation</h2>
 * The caller's {@link RunContext}, if any, is attached on the main context for
 * the duration of the submitted work.
 */
public final class MainExecutionContext
{
    private static final Logger log = LoggerFactory.getLogger(MainExecutionContext.class);

    private static final MainExecutionContext SHARED = new MainExecutionContext("main-execution-context");

    private final String threadName;
    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private volatile Thread thread;

    private MainExecutionContext(String threadName) {
        this.threadName = threadName;
    }

    public static MainExecutionContext shared() {
        return SHARED;
    }

    /**
     * Whether the calling thread is the main execution context.
     */
    public static boolean isCurrent() {
        return Thread.currentThread() == SHARED.thread;
    }

    /**
     * Runs {@code work} on this context and waits for its result.
     *
     * Called from the main context itself, the work runs inline. Exceptions
     * thrown by the work are rethrown unchanged. An interrupt of the caller
     * does not abandon the work: the call still waits for it and returns with
     * the interrupt flag set.
     */
    public <T> T call(Callable<T> work) throws Exception {
        Objects.requireNonNull(work, "work");
        if (Thread.currentThread() == thread) {
            return work.call();
        }

        Callable<T> bound = RunContext.current().map(context -> context.wrap(work)).orElse(work);
        FutureTask<T> task = new FutureTask<>(bound);
        ensureStarted();
        queue.add(task);

        try {
            return awaitUninterruptibly(task);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Waits for {@code task} through interrupts and restores the flag afterwards.
     */
    private static <T> T awaitUninterruptibly(FutureTask<T> task) throws ExecutionException {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return task.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void ensureStarted() {
        if (thread != null) {
            return;
        }
        synchronized (this) {
            if (thread == null) {
                Thread loop = new Thread(this::runLoop, threadName);
                loop.setDaemon(true);
                thread = loop;
                loop.start();
                log.debug("Started {}", threadName);
            }
        }
    }

    private void runLoop() {
        while (true) {
            try {
                queue.take().run();
            } catch (InterruptedException e) {
                log.debug("{} ignoring interrupt", threadName);
            } catch (RuntimeException e) {
                // FutureTask captures work failures; anything here is a loop defect
                log.error("Unexpected failure on {}", threadName, e);
            }
        }
    }
}
