package com.questrail.runner.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a test was skipped, and where the deciding trait was declared.
 */
public final class SkipInfo
{
    private final String comment;
    private final SourceContext sourceContext;

    public SkipInfo(String comment, SourceContext sourceContext) {
        this.comment = comment;
        this.sourceContext = Objects.requireNonNull(sourceContext, "sourceContext");
    }

    /**
     * Skip with no comment and no source attribution (hand-built plans).
     */
    public static SkipInfo unattributed() {
        return new SkipInfo(null, SourceContext.empty());
    }

    /**
     * Skip derived from an issue raised while deciding whether to run.
     */
    public static SkipInfo from(Issue issue) {
        Objects.requireNonNull(issue, "issue");
        String comment = issue.comment()
                .or(() -> issue.error().map(e -> e.getMessage() != null ? e.getMessage() : e.getClass().getName()))
                .orElse(null);
        return new SkipInfo(comment, issue.sourceContext());
    }

    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    public SourceContext sourceContext() {
        return sourceContext;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkipInfo that)) return false;
        return Objects.equals(comment, that.comment) && sourceContext.equals(that.sourceContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(comment, sourceContext);
    }

    @Override
    public String toString() {
        return "SkipInfo{comment=" + comment + ", " + sourceContext + "}";
    }
}
