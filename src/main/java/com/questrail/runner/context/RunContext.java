package com.questrail.runner.context;

import com.questrail.runner.api.Test;
import com.questrail.runner.config.Configuration;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * RunContext
 * -----------------------------------------------------------------------------
 * Ambient state of the code currently executing on behalf of a run: the run's
 * {@link EventBus} (and so its {@link Configuration}) and the test and test
 * case being executed.
 *
 * <h2>Propagation</h2>
 * The runner attaches a context to the thread invoking a test body. Work the
 * body hands to other threads sees that context only if it is explicitly
 * carried over, via {@link #wrap(Callable)} or {@link TestTasks#spawn}.
 * Work started without it (see {@link TestTasks#detached}) finds the run
 * through {@link ActiveRuns} instead.
 */
public final class RunContext
{
    private static final ThreadLocal<RunContext[]> CURRENT_HOLDER =
            ThreadLocal.withInitial(() -> new RunContext[1]);

    private final EventBus eventBus;
    private final EventContext eventContext;

    public RunContext(EventBus eventBus, EventContext eventContext) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.eventContext = Objects.requireNonNull(eventContext, "eventContext");
    }

    /**
     * The context attached to the calling thread, if any.
     */
    public static Optional<RunContext> current() {
        return Optional.ofNullable(CURRENT_HOLDER.get()[0]);
    }

    /**
     * The test the calling thread is executing on behalf of, if any.
     */
    public static Optional<Test> currentTest() {
        return current().flatMap(context -> context.eventContext().test());
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public Configuration configuration() {
        return eventBus.configuration();
    }

    public EventContext eventContext() {
        return eventContext;
    }

    /**
     * Attaches this context to the calling thread until the returned scope is
     * closed.
     */
    public ContextScope attach() {
        RunContext[] holder = CURRENT_HOLDER.get();
        RunContext previous = holder[0];
        holder[0] = this;
        return new ContextScope() {
            private boolean closed;

            @Override
            public RunContext context() {
                return RunContext.this;
            }

            @Override
            public void close() {
                if (!closed && holder[0] == RunContext.this) {
                    holder[0] = previous;
                    closed = true;
                }
            }
        };
    }

    /**
     * Returns {@code work} bound to this context: whichever thread calls it
     * sees this context for the duration of the call.
     */
    public <T> Callable<T> wrap(Callable<T> work) {
        Objects.requireNonNull(work, "work");
        return () -> {
            try (ContextScope ignored = attach()) {
                return work.call();
            }
        };
    }

    @Override
    public String toString() {
        return "RunContext{" + eventContext + "}";
    }
}
