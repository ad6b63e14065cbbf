package com.questrail.runner.api;

import java.util.Objects;
import java.util.Optional;

/**
 * One invocation of a test body: the single case of a plain test, or one
 * argument of a parameterized test.
 */
public final class TestCase
{
    private final int index;
    private final Object argument;
    private final boolean parameterized;
    private final TestFunction body;

    TestCase(int index, Object argument, boolean parameterized, TestFunction body) {
        this.index = index;
        this.argument = argument;
        this.parameterized = parameterized;
        this.body = Objects.requireNonNull(body, "body");
    }

    public int index() {
        return index;
    }

    public boolean isParameterized() {
        return parameterized;
    }

    /**
     * The argument this case was invoked with; empty for non-parameterized
     * tests (and for a {@code null} argument).
     */
    public Optional<Object> argument() {
        return Optional.ofNullable(argument);
    }

    public void invoke() throws Exception {
        body.invoke();
    }

    @Override
    public String toString() {
        return parameterized ? "TestCase[" + index + "](" + argument + ")" : "TestCase";
    }
}
