package com.questrail.runner.plan;

import com.questrail.runner.api.Issue;
import com.questrail.runner.api.SkipInfo;
import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Plan
 * -----------------------------------------------------------------------------
 * Ordered, immutable sequence of {@link Step}s for one run.
 *
 * Plans normally come from {@link PlanBuilder}, but may be assembled by hand
 * from explicit steps (embedding, tooling, tests). The steps are enumerable
 * without running anything.
 */
public final class Plan
{
    private final List<Step> steps;

    public Plan(List<Step> steps) {
        Objects.requireNonNull(steps, "steps");
        steps.forEach(step -> Objects.requireNonNull(step, "step"));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static Plan empty() {
        return new Plan(List.of());
    }

    public List<Step> steps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Tests of all steps, in plan order.
     */
    public List<Test> tests() {
        List<Test> tests = new ArrayList<>(steps.size());
        for (Step step : steps) {
            tests.add(step.test());
        }
        return Collections.unmodifiableList(tests);
    }

    /**
     * IDs of all planned tests. Selecting exactly these IDs again from the same
     * catalog yields the same set.
     */
    public Set<TestId> testIds() {
        Set<TestId> ids = new LinkedHashSet<>();
        for (Step step : steps) {
            ids.add(step.test().id());
        }
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public String toString() {
        return "Plan{" + steps.size() + " steps}";
    }

    // ---------------------------------------------------------------------
    // Step
    // ---------------------------------------------------------------------

    /**
     * One scheduled unit: a test and what to do with it. The action is decided
     * once, when the step is built.
     */
    public static final class Step
    {
        private final List<Test> testChain;
        private final Action action;
        private final DeferredIssue deferredIssue;

        public Step(Test test, Action action) {
            this(List.of(Objects.requireNonNull(test, "test")), action, null);
        }

        /**
         * @param testChain the step's test preceded by its enclosing suites,
         *                  outermost first
         */
        Step(List<Test> testChain, Action action, DeferredIssue deferredIssue) {
            this.testChain = List.copyOf(testChain);
            if (this.testChain.isEmpty()) {
                throw new IllegalArgumentException("testChain must not be empty");
            }
            this.action = Objects.requireNonNull(action, "action");
            this.deferredIssue = deferredIssue;
        }

        public Test test() {
            return testChain.get(testChain.size() - 1);
        }

        /**
         * The test preceded by the enclosing suites known when the step was
         * built, outermost first. Hand-built steps know only their test.
         */
        public List<Test> testChain() {
            return testChain;
        }

        public Action action() {
            return action;
        }

        /**
         * An issue raised while deciding this step that has not been delivered
         * yet. The runner posts it when it processes the step.
         */
        public Optional<DeferredIssue> deferredIssue() {
            return Optional.ofNullable(deferredIssue);
        }

        @Override
        public String toString() {
            return "Step{" + test().id() + ", " + action + "}";
        }
    }

    /**
     * Issue awaiting delivery, with the test or suite it is attributed to (and
     * that owner's enclosing suites, outermost first).
     */
    public record DeferredIssue(Issue issue, List<Test> ownerChain) {
        public DeferredIssue {
            Objects.requireNonNull(issue, "issue");
            ownerChain = List.copyOf(ownerChain);
            if (ownerChain.isEmpty()) {
                throw new IllegalArgumentException("ownerChain must not be empty");
            }
        }
    }

    // ---------------------------------------------------------------------
    // Action
    // ---------------------------------------------------------------------

    /**
     * What the runner does with a step.
     */
    public sealed interface Action permits Run, Skip
    {
        static Action run() {
            return Run.INSTANCE;
        }

        static Action skip() {
            return new Skip(SkipInfo.unattributed());
        }

        static Action skip(SkipInfo skipInfo) {
            return new Skip(skipInfo);
        }

        default boolean isRun() {
            return this instanceof Run;
        }
    }

    /** Invoke the test body. */
    public static final class Run implements Action {
        private static final Run INSTANCE = new Run();

        private Run() {}

        @Override
        public String toString() {
            return "run";
        }
    }

    /** Report the test as skipped without invoking it. */
    public record Skip(SkipInfo skipInfo) implements Action {
        public Skip {
            Objects.requireNonNull(skipInfo, "skipInfo");
        }
    }
}
