package com.questrail.runner.api;

import java.util.Objects;

/**
 * Outcome of one checked expectation, as reported by the assertion layer.
 */
public record Expectation(boolean isPassing, SourceContext sourceContext)
{
    public Expectation {
        Objects.requireNonNull(sourceContext, "sourceContext");
    }
}
