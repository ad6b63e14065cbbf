package com.questrail.runner.api;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Position in source code a trait, issue or expectation is attributed to.
 */
public record SourceLocation(String fileName, int line, String className)
{
    private static final StackWalker WALKER = StackWalker.getInstance();

    public SourceLocation {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(className, "className");
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0");
        }
    }

    /**
     * Captures the location of the first stack frame that does not belong to
     * one of {@code skipping} (or their nested classes), i.e. the code that
     * declared a trait or reported a check.
     */
    public static Optional<SourceLocation> capture(Class<?>... skipping) {
        Set<String> skipped = Arrays.stream(skipping).map(Class::getName).collect(Collectors.toCollection(HashSet::new));
        skipped.add(SourceLocation.class.getName());
        return WALKER.walk(frames -> frames
                .filter(frame -> !isSkipped(frame.getClassName(), skipped))
                .findFirst()
                .map(frame -> new SourceLocation(
                        frame.getFileName() != null ? frame.getFileName() : "<unknown>",
                        Math.max(0, frame.getLineNumber()),
                        frame.getClassName())));
    }

    private static boolean isSkipped(String className, Set<String> skipped) {
        int nested = className.indexOf('$');
        return skipped.contains(nested < 0 ? className : className.substring(0, nested));
    }

    @Override
    public String toString() {
        return fileName + ":" + line;
    }
}
