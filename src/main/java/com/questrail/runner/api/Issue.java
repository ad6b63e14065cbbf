package com.questrail.runner.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Issue
 * -----------------------------------------------------------------------------
 * One recorded failure. A test may record any number of issues before it ends;
 * recording an issue never stops the test or any other test.
 */
public final class Issue
{
    public enum Kind {
        /** An error was thrown by a test body or a condition predicate. */
        ERROR_CAUGHT,

        /** A checked expectation did not pass. */
        EXPECTATION_FAILED,

        /** Recorded explicitly by test code, with no underlying error. */
        UNCONDITIONAL
    }

    private final Kind kind;
    private final Throwable error;
    private final Expectation expectation;
    private final String comment;
    private final SourceContext sourceContext;

    private Issue(Kind kind, Throwable error, Expectation expectation, String comment, SourceContext sourceContext) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.error = error;
        this.expectation = expectation;
        this.comment = comment;
        this.sourceContext = Objects.requireNonNull(sourceContext, "sourceContext");
    }

    public static Issue errorCaught(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new Issue(Kind.ERROR_CAUGHT, error, null, null, SourceContext.of(error));
    }

    public static Issue expectationFailed(Expectation expectation) {
        Objects.requireNonNull(expectation, "expectation");
        if (expectation.isPassing()) {
            throw new IllegalArgumentException("expectation passed");
        }
        return new Issue(Kind.EXPECTATION_FAILED, null, expectation, null, expectation.sourceContext());
    }

    public static Issue unconditional(String comment, SourceContext sourceContext) {
        return new Issue(Kind.UNCONDITIONAL, null, null, comment, sourceContext);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The caught error, present iff {@link #kind()} is {@link Kind#ERROR_CAUGHT}.
     */
    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public Optional<Expectation> expectation() {
        return Optional.ofNullable(expectation);
    }

    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    public SourceContext sourceContext() {
        return sourceContext;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Issue{").append(kind);
        if (error != null) {
            sb.append(", error=").append(error);
        }
        if (comment != null) {
            sb.append(", comment=").append(comment);
        }
        return sb.append(", ").append(sourceContext).append('}').toString();
    }
}
