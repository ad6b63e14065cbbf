package com.questrail.runner.event;

import com.questrail.runner.api.Expectation;
import com.questrail.runner.api.Issue;
import com.questrail.runner.api.SkipInfo;
import com.questrail.runner.plan.Plan;

import java.time.Instant;
import java.util.Objects;

/**
 * Event
 * -----------------------------------------------------------------------------
 * One lifecycle or diagnostic occurrence delivered to the configured
 * {@link EventHandler}, together with an {@link EventContext}.
 *
 * <h2>Ordering</h2>
 * For every step of a plan:
 * <pre>
 *   planStepStarted
 *     testSkipped                                        (skip steps)
 *   | testStarted
 *       ( testCaseStarted (issueRecorded | expectationChecked)* testCaseEnded )*
 *     testEnded                                          (run steps)
 *   planStepEnded
 * </pre>
 * bracketed by a single {@code planStarted} / {@code planEnded} pair. Events are
 * constructed at delivery time and not retained by the runner.
 */
public record Event(Instant timestamp, Kind kind)
{
    public Event {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }

    public Type type() {
        return kind.type();
    }

    public enum Type {
        PLAN_STARTED,
        PLAN_STEP_STARTED,
        TEST_STARTED,
        TEST_CASE_STARTED,
        TEST_SKIPPED,
        ISSUE_RECORDED,
        EXPECTATION_CHECKED,
        TEST_CASE_ENDED,
        TEST_ENDED,
        PLAN_STEP_ENDED,
        PLAN_ENDED
    }

    /**
     * Payload-carrying event kind. Match with {@code instanceof}.
     */
    public sealed interface Kind
            permits PlanStarted, PlanStepStarted, TestStarted, TestCaseStarted, TestSkipped,
                    IssueRecorded, ExpectationChecked, TestCaseEnded, TestEnded, PlanStepEnded, PlanEnded
    {
        Type type();
    }

    public record PlanStarted(Plan plan) implements Kind {
        @Override public Type type() { return Type.PLAN_STARTED; }
    }

    public record PlanStepStarted(Plan.Step step) implements Kind {
        @Override public Type type() { return Type.PLAN_STEP_STARTED; }
    }

    public record TestStarted() implements Kind {
        @Override public Type type() { return Type.TEST_STARTED; }
    }

    public record TestCaseStarted() implements Kind {
        @Override public Type type() { return Type.TEST_CASE_STARTED; }
    }

    public record TestSkipped(SkipInfo skipInfo) implements Kind {
        public TestSkipped {
            Objects.requireNonNull(skipInfo, "skipInfo");
        }

        @Override public Type type() { return Type.TEST_SKIPPED; }
    }

    public record IssueRecorded(Issue issue) implements Kind {
        public IssueRecorded {
            Objects.requireNonNull(issue, "issue");
        }

        @Override public Type type() { return Type.ISSUE_RECORDED; }
    }

    public record ExpectationChecked(Expectation expectation) implements Kind {
        public ExpectationChecked {
            Objects.requireNonNull(expectation, "expectation");
        }

        @Override public Type type() { return Type.EXPECTATION_CHECKED; }
    }

    public record TestCaseEnded() implements Kind {
        @Override public Type type() { return Type.TEST_CASE_ENDED; }
    }

    public record TestEnded() implements Kind {
        @Override public Type type() { return Type.TEST_ENDED; }
    }

    public record PlanStepEnded(Plan.Step step) implements Kind {
        @Override public Type type() { return Type.PLAN_STEP_ENDED; }
    }

    public record PlanEnded(Plan plan) implements Kind {
        @Override public Type type() { return Type.PLAN_ENDED; }
    }
}
