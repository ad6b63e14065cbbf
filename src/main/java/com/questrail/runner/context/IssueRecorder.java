package com.questrail.runner.context;

import com.questrail.runner.api.Expectation;
import com.questrail.runner.api.Issue;
import com.questrail.runner.api.SourceContext;
import com.questrail.runner.api.SourceLocation;
import com.questrail.runner.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * IssueRecorder
 * -----------------------------------------------------------------------------
 * Entry point for test code (and the assertion layer) to report issues and
 * checked expectations to the run it executes in.
 *
 * The target run is the attached {@link RunContext}; without one, every
 * {@link ActiveRuns active run} is used. A report with neither is logged,
 * never silently discarded.
 *
 * Failing expectations always record an {@code expectationFailed} issue.
 * The {@code expectationChecked} event itself is delivered only when the
 * target run's configuration asks for it.
 */
public final class IssueRecorder
{
    private static final Logger log = LoggerFactory.getLogger(IssueRecorder.class);

    private IssueRecorder() {}

    public static void record(Issue issue) {
        Objects.requireNonNull(issue, "issue");
        List<RunContext> targets = targets();
        if (targets.isEmpty()) {
            log.warn("Issue recorded outside of any run: {}", issue, issue.error().orElse(null));
            return;
        }
        for (RunContext target : targets) {
            target.eventBus().post(new Event.IssueRecorded(issue), target.eventContext());
        }
    }

    public static void record(Throwable error) {
        record(Issue.errorCaught(error));
    }

    /**
     * Records an issue with no underlying error, attributed to the caller.
     */
    public static void record(String comment) {
        record(Issue.unconditional(comment,
                SourceContext.of(SourceLocation.capture(IssueRecorder.class))));
    }

    /**
     * Reports the outcome of one checked expectation.
     */
    public static void reportCheckedExpectation(boolean passed, SourceContext sourceContext) {
        Expectation expectation = new Expectation(passed, Objects.requireNonNull(sourceContext, "sourceContext"));
        List<RunContext> targets = targets();
        if (targets.isEmpty()) {
            if (!passed) {
                log.warn("Expectation failed outside of any run at {}", sourceContext);
            }
            return;
        }
        for (RunContext target : targets) {
            target.eventBus().post(new Event.ExpectationChecked(expectation), target.eventContext());
            if (!passed) {
                target.eventBus().post(new Event.IssueRecorded(Issue.expectationFailed(expectation)),
                        target.eventContext());
            }
        }
    }

    /**
     * Reports the outcome of one checked expectation, attributed to the caller.
     */
    public static void reportCheckedExpectation(boolean passed) {
        reportCheckedExpectation(passed, SourceContext.of(SourceLocation.capture(IssueRecorder.class)));
    }

    private static List<RunContext> targets() {
        return RunContext.current()
                .map(List::of)
                .orElseGet(ActiveRuns::fallbackContexts);
    }
}
