package com.questrail.runner.exec;

import com.questrail.runner.api.ExecutionAffinity;
import com.questrail.runner.api.Issue;
import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestCase;
import com.questrail.runner.context.ActiveRuns;
import com.questrail.runner.context.RunContext;
import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;
import com.questrail.runner.plan.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * StepExecutor
 * -----------------------------------------------------------------------------
 * Processes a single {@link Plan.Step} and posts its events.
 *
 * <h2>Event shape</h2>
 * <pre>
 *   planStepStarted
 *     [issueRecorded]              buffered plan-time issue, if any
 *     testSkipped                  skip steps
 *   | testStarted
 *       ( testCaseStarted
 *           [issueRecorded ...]    body failures and reported issues
 *         testCaseEnded )*
 *     testEnded                    run steps
 *   planStepEnded
 * </pre>
 *
 * A failing body changes what is recorded, never the shape: every started
 * case, test and step is ended.
 */
public final class StepExecutor
{
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final EventBus eventBus;
    private final ActiveRuns.ActiveRun activeRun;

    public StepExecutor(EventBus eventBus, ActiveRuns.ActiveRun activeRun) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.activeRun = Objects.requireNonNull(activeRun, "activeRun");
    }

    public void process(Plan.Step step) {
        Objects.requireNonNull(step, "step");
        EventContext testContext = EventContext.forTest(step.testChain());

        eventBus.post(new Event.PlanStepStarted(step), testContext);

        step.deferredIssue().ifPresent(deferred ->
                eventBus.post(new Event.IssueRecorded(deferred.issue()),
                        EventContext.forTest(deferred.ownerChain())));

        if (step.action() instanceof Plan.Skip skip) {
            log.debug("Skipping {}: {}", step.test().id(), skip.skipInfo());
            eventBus.post(new Event.TestSkipped(skip.skipInfo()), testContext);
        } else {
            runTest(step.test(), testContext);
        }

        eventBus.post(new Event.PlanStepEnded(step), testContext);
    }

    private void runTest(Test test, EventContext testContext) {
        eventBus.post(new Event.TestStarted(), testContext);
        for (TestCase testCase : test.testCases()) {
            runTestCase(test, testCase, testContext.withTestCase(testCase));
        }
        eventBus.post(new Event.TestEnded(), testContext);
    }

    private void runTestCase(Test test, TestCase testCase, EventContext caseContext) {
        eventBus.post(new Event.TestCaseStarted(), caseContext);
        activeRun.enter(caseContext);
        try {
            invoke(test, testCase, caseContext);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable t) {
            log.debug("{} threw {}", caseContext, t.toString());
            eventBus.post(new Event.IssueRecorded(Issue.errorCaught(t)), caseContext);
        } finally {
            activeRun.exit(caseContext);
        }
        eventBus.post(new Event.TestCaseEnded(), caseContext);
    }

    private void invoke(Test test, TestCase testCase, EventContext caseContext) throws Exception {
        Callable<Void> body = new RunContext(eventBus, caseContext).wrap(() -> {
            testCase.invoke();
            return null;
        });

        if (bindsToMainContext(test.affinity())) {
            MainExecutionContext.shared().call(body);
        } else {
            body.call();
        }
    }

    boolean bindsToMainContext(ExecutionAffinity affinity) {
        switch (affinity) {
            case MAIN_CONTEXT:
                return true;
            case NONISOLATED:
                return false;
            default:
                return eventBus.configuration().isMainContextIsolationEnforced();
        }
    }
}
