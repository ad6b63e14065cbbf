package com.questrail.runner.event;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity of the test (with its enclosing suites) and test case an event
 * belongs to. Empty for plan-level events.
 */
public final class EventContext
{
    private static final EventContext EMPTY = new EventContext(List.of(), null);

    private final List<Test> testChain;
    private final TestCase testCase;

    private EventContext(List<Test> testChain, TestCase testCase) {
        this.testChain = testChain;
        this.testCase = testCase;
    }

    public static EventContext empty() {
        return EMPTY;
    }

    /**
     * Context for the last test of {@code testChain}; the chain lists its
     * enclosing suites outermost first.
     */
    public static EventContext forTest(List<Test> testChain) {
        Objects.requireNonNull(testChain, "testChain");
        if (testChain.isEmpty()) {
            throw new IllegalArgumentException("testChain must not be empty");
        }
        return new EventContext(Collections.unmodifiableList(new ArrayList<>(testChain)), null);
    }

    public EventContext withTestCase(TestCase testCase) {
        if (testChain.isEmpty()) {
            throw new IllegalStateException("A test case requires a test");
        }
        return new EventContext(testChain, Objects.requireNonNull(testCase, "testCase"));
    }

    public Optional<Test> test() {
        return testChain.isEmpty() ? Optional.empty() : Optional.of(testChain.get(testChain.size() - 1));
    }

    /**
     * The test and its enclosing suites, outermost first.
     */
    public List<Test> testChain() {
        return testChain;
    }

    public Optional<TestCase> testCase() {
        return Optional.ofNullable(testCase);
    }

    @Override
    public String toString() {
        return test().map(t -> "EventContext{" + t.id() + (testCase != null ? ", " + testCase : "") + "}")
                .orElse("EventContext{}");
    }
}
