package com.questrail.runner.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SourceContext
 * -----------------------------------------------------------------------------
 * Where something happened: an optional source location and an optional
 * backtrace. Both parts may be absent (e.g. a skip decided by a hand-built
 * plan has neither).
 */
public final class SourceContext
{
    private static final SourceContext EMPTY = new SourceContext(null, null);

    private final SourceLocation sourceLocation;
    private final List<StackTraceElement> backtrace;

    private SourceContext(SourceLocation sourceLocation, List<StackTraceElement> backtrace) {
        this.sourceLocation = sourceLocation;
        this.backtrace = backtrace == null ? null : Collections.unmodifiableList(backtrace);
    }

    public static SourceContext empty() {
        return EMPTY;
    }

    public static SourceContext at(SourceLocation sourceLocation) {
        return new SourceContext(Objects.requireNonNull(sourceLocation, "sourceLocation"), null);
    }

    public static SourceContext of(Optional<SourceLocation> sourceLocation) {
        return sourceLocation.map(SourceContext::at).orElse(EMPTY);
    }

    /**
     * Context for a caught error: its stack trace becomes the backtrace and its
     * top frame (if any) the source location.
     */
    public static SourceContext of(Throwable error) {
        Objects.requireNonNull(error, "error");
        StackTraceElement[] trace = error.getStackTrace();
        SourceLocation location = null;
        if (trace.length > 0 && trace[0].getFileName() != null) {
            location = new SourceLocation(trace[0].getFileName(),
                    Math.max(0, trace[0].getLineNumber()), trace[0].getClassName());
        }
        return new SourceContext(location, Arrays.asList(trace));
    }

    public Optional<SourceLocation> sourceLocation() {
        return Optional.ofNullable(sourceLocation);
    }

    public Optional<List<StackTraceElement>> backtrace() {
        return Optional.ofNullable(backtrace);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceContext that)) return false;
        return Objects.equals(sourceLocation, that.sourceLocation)
                && Objects.equals(backtrace, that.backtrace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceLocation, backtrace);
    }

    @Override
    public String toString() {
        return "SourceContext{" + (sourceLocation != null ? sourceLocation : "<no location>") + "}";
    }
}
