package com.questrail.runner;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;
import com.questrail.runner.catalog.TestCatalog;
import com.questrail.runner.config.Configuration;
import com.questrail.runner.config.TestSelection;
import com.questrail.runner.context.ActiveRuns;
import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;
import com.questrail.runner.exec.StepExecutor;
import com.questrail.runner.plan.Plan;
import com.questrail.runner.plan.PlanBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runner
 * =============================================================================
 * Executes a {@link Plan} and reports its progress as events to the handler of
 * a {@link Configuration}.
 *
 * <h2>Event stream</h2>
 * A run is bracketed by {@code planStarted} and {@code planEnded}. Every step
 * between them is bracketed by {@code planStepStarted} and
 * {@code planStepEnded} (see {@link StepExecutor} for the events inside a
 * step). {@code planEnded} is posted only after every step has ended.
 *
 * <h2>Scheduling</h2>
 * <ul>
 *   <li>Serial: steps execute one after another on the calling thread, in plan
 *       order.</li>
 *   <li>Parallel: every step is submitted to a worker pool at once; the
 *       ordering of events across steps is unspecified. Events of one step
 *       keep their order.</li>
 * </ul>
 *
 * A runner may be run more than once; each run re-executes the same plan.
 */
public final class Runner
{
    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    private final Plan plan;
    private final Configuration configuration;

    public Runner(Plan plan, Configuration configuration) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Runner(Plan plan) {
        this(plan, Configuration.defaults());
    }

    /**
     * Plans every test of {@code catalog} matched by the configuration's test
     * filter. An unfiltered configuration plans every non-hidden test.
     */
    public static Runner forCatalog(TestCatalog catalog, Configuration configuration) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(configuration, "configuration");
        TestSelection selection = configuration.testFilter().isUnfiltered()
                ? TestSelection.allVisible()
                : configuration.testFilter();
        return new Runner(new PlanBuilder(configuration).build(catalog, selection), configuration);
    }

    public static Runner forCatalog(TestCatalog catalog) {
        return forCatalog(catalog, Configuration.defaults());
    }

    /**
     * Plans exactly {@code tests}, hidden ones included, unless the
     * configuration carries a test filter of its own.
     */
    public static Runner forTests(List<Test> tests, Configuration configuration) {
        Objects.requireNonNull(tests, "tests");
        Objects.requireNonNull(configuration, "configuration");
        TestSelection selection = configuration.testFilter();
        if (selection.isUnfiltered()) {
            Set<TestId> ids = new LinkedHashSet<>();
            tests.forEach(test -> ids.add(test.id()));
            selection = TestSelection.of(ids, true);
        }
        return new Runner(new PlanBuilder(configuration).build(TestCatalog.of(tests), selection), configuration);
    }

    public static Runner forTests(Test... tests) {
        return forTests(List.of(tests), Configuration.defaults());
    }

    public Plan plan() {
        return plan;
    }

    public Configuration configuration() {
        return configuration;
    }

    /**
     * Tests of all steps, in plan order.
     */
    public List<Test> tests() {
        return plan.tests();
    }

    /**
     * Executes the plan and returns once {@code planEnded} has been delivered.
     */
    public void run() {
        EventBus eventBus = new EventBus(configuration);
        long startNanos = System.nanoTime();
        boolean parallel = configuration.isParallelizationEnabled() && plan.steps().size() > 1;

        log.debug("Starting run of {} ({})", plan, parallel ? "parallel" : "serial");

        try (ActiveRuns.ActiveRun activeRun = ActiveRuns.register(eventBus)) {
            eventBus.post(new Event.PlanStarted(plan), EventContext.empty());

            StepExecutor executor = new StepExecutor(eventBus, activeRun);
            if (parallel) {
                runParallel(executor);
            } else {
                plan.steps().forEach(executor::process);
            }

            eventBus.post(new Event.PlanEnded(plan), EventContext.empty());
        }

        long skipped = plan.steps().stream().filter(step -> !step.action().isRun()).count();
        log.info("Run finished: {} steps ({} skipped) in {} ms",
                plan.steps().size(), skipped, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private void runParallel(StepExecutor executor) {
        ExecutorService workers = newWorkerPool();
        try {
            List<CompletableFuture<Void>> pending = new ArrayList<>(plan.steps().size());
            for (Plan.Step step : plan.steps()) {
                pending.add(CompletableFuture.runAsync(() -> executor.process(step), workers));
            }
            awaitAll(CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])));
        } finally {
            workers.shutdown();
        }
    }

    private ExecutorService newWorkerPool() {
        AtomicInteger count = new AtomicInteger();
        ThreadFactory factory = task -> {
            Thread thread = new Thread(task, "runner-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        int maxParallelism = configuration.maxParallelism();
        return maxParallelism > 0
                ? Executors.newFixedThreadPool(maxParallelism, factory)
                : Executors.newCachedThreadPool(factory);
    }

    private static void awaitAll(CompletableFuture<Void> all) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    all.get();
                    return;
                } catch (InterruptedException e) {
                    // steps are not cancellable; keep waiting and restore the flag afterwards
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new IllegalStateException("Plan step failed outside its test boundary", cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
