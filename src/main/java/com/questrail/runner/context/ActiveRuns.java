package com.questrail.runner.context;

import com.questrail.runner.api.TestId;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveRuns
 * -----------------------------------------------------------------------------
 * Process-wide registry of runs currently in progress.
 *
 * This is the fallback for code that reports issues or expectations without
 * an attached {@link RunContext}, typically work a test body started detached
 * from its context. It is consulted only when no context is attached; code
 * running inside a test body always reports through its own context.
 *
 * <h2>Attribution</h2>
 * A fallback report goes to every active run. Within a run it is attributed to
 * the run's in-flight test when exactly one test is executing, and to no test
 * otherwise.
 */
public final class ActiveRuns
{
    private static final Set<ActiveRun> RUNS = ConcurrentHashMap.newKeySet();

    private ActiveRuns() {}

    /**
     * Registers a run. Close the returned handle when the run ends.
     */
    public static ActiveRun register(EventBus eventBus) {
        ActiveRun run = new ActiveRun(Objects.requireNonNull(eventBus, "eventBus"));
        RUNS.add(run);
        return run;
    }

    /**
     * One context per active run, for reports made with no attached context.
     */
    public static List<RunContext> fallbackContexts() {
        List<RunContext> contexts = new ArrayList<>();
        for (ActiveRun run : RUNS) {
            contexts.add(run.fallbackContext());
        }
        return contexts;
    }

    public static final class ActiveRun implements AutoCloseable
    {
        private final EventBus eventBus;
        private final Map<TestId, EventContext> inFlight = new LinkedHashMap<>();

        private ActiveRun(EventBus eventBus) {
            this.eventBus = eventBus;
        }

        /**
         * Records that a test (or one of its cases) is executing under
         * {@code context}.
         */
        public synchronized void enter(EventContext context) {
            TestId id = context.test()
                    .orElseThrow(() -> new IllegalArgumentException("context has no test"))
                    .id();
            inFlight.put(id, context);
        }

        public synchronized void exit(EventContext context) {
            context.test().ifPresent(test -> inFlight.remove(test.id()));
        }

        synchronized RunContext fallbackContext() {
            EventContext context = inFlight.size() == 1
                    ? inFlight.values().iterator().next()
                    : EventContext.empty();
            return new RunContext(eventBus, context);
        }

        @Override
        public void close() {
            RUNS.remove(this);
        }
    }
}
