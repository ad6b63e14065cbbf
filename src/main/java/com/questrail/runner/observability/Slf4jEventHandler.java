package com.questrail.runner.observability;

import com.questrail.runner.api.Issue;
import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventContext;
import com.questrail.runner.event.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observer that renders the event stream via SLF4J.
 *
 * Plan brackets and skips log at info, issues at warn (errors with
 * their stack trace), expectations at trace, everything else at debug.
 */
public final class Slf4jEventHandler implements EventHandler {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEventHandler.class);

    @Override
    public void handle(Event event, EventContext context) {
        String subject = context.test().map(t -> t.id().toString()).orElse("<plan>");
        Event.Kind kind = event.kind();

        if (kind instanceof Event.PlanStarted e) {
            log.info("Plan started: {} steps", e.plan().steps().size());
        } else if (kind instanceof Event.PlanEnded e) {
            log.info("Plan ended: {} steps", e.plan().steps().size());
        } else if (kind instanceof Event.TestSkipped e) {
            log.info("Skipped {}: {}", subject, e.skipInfo().comment().orElse("<no comment>"));
        } else if (kind instanceof Event.IssueRecorded e) {
            Issue issue = e.issue();
            if (issue.error().isPresent()) {
                log.warn("Issue in {}: {}", subject, issue, issue.error().get());
            } else {
                log.warn("Issue in {}: {}", subject, issue);
            }
        } else if (kind instanceof Event.ExpectationChecked e) {
            log.trace("Expectation in {} {}", subject, e.expectation().isPassing() ? "passed" : "failed");
        } else {
            log.debug("{} {}", event.type(), subject);
        }
    }
}
