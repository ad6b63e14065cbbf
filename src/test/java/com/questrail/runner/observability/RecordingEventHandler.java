package com.questrail.runner.observability;

import com.questrail.runner.api.Issue;
import com.questrail.runner.api.TestId;
import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventContext;
import com.questrail.runner.event.EventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test handler that records events with their context for assertions.
 */
public final class RecordingEventHandler implements EventHandler {

    public record Recorded(Event event, EventContext context) {
        public Event.Type type() {
            return event.type();
        }

        public String testName() {
            return context.test().map(t -> t.name()).orElse(null);
        }

        public TestId testId() {
            return context.test().map(t -> t.id()).orElse(null);
        }
    }

    private final List<Recorded> events = new ArrayList<>();

    @Override
    public synchronized void handle(Event event, EventContext context) {
        events.add(new Recorded(event, context));
    }

    public synchronized List<Recorded> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<Event.Type> types() {
        return events.stream().map(Recorded::type).collect(Collectors.toList());
    }

    public synchronized List<Recorded> ofType(Event.Type type) {
        return events.stream().filter(r -> r.type() == type).collect(Collectors.toList());
    }

    /**
     * Types of the events attributed to the test named {@code testName}, in
     * delivery order.
     */
    public synchronized List<Event.Type> typesFor(String testName) {
        return events.stream()
            .filter(r -> testName.equals(r.testName()))
            .map(Recorded::type)
            .collect(Collectors.toList());
    }

    public synchronized List<Issue> issues() {
        return events.stream()
            .filter(r -> r.event().kind() instanceof Event.IssueRecorded)
            .map(r -> ((Event.IssueRecorded) r.event().kind()).issue())
            .collect(Collectors.toList());
    }

    public synchronized long count(Event.Type type) {
        return events.stream().filter(r -> r.type() == type).count();
    }
}
