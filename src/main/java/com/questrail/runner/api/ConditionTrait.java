package com.questrail.runner.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * ConditionTrait
 * -----------------------------------------------------------------------------
 * Eligibility condition deciding whether a test (or every test in a suite)
 * runs.
 *
 * <h2>Outcome</h2>
 * A condition is either <b>constant</b> (a boolean fixed at declaration time)
 * or <b>dynamic</b> (a predicate invoked while the plan is built). Reading a
 * constant condition never runs user code, so it cannot fail or have side
 * effects.
 *
 * <h2>Polarity</h2>
 * {@code enabled(...)} conditions let the test run when the outcome is
 * {@code true}; {@code disabled(...)} conditions skip it when the outcome is
 * {@code true}. {@link #evaluate()} folds the polarity in and always answers
 * "may this test run?".
 */
public final class ConditionTrait implements Trait
{
    private enum Polarity { ENABLE_WHEN_TRUE, DISABLE_WHEN_TRUE }

    private final Polarity polarity;
    private final Boolean constant;
    private final Callable<Boolean> predicate;
    private final String comment;
    private final SourceLocation sourceLocation;

    private ConditionTrait(Polarity polarity,
                           Boolean constant,
                           Callable<Boolean> predicate,
                           String comment,
                           SourceLocation sourceLocation)
    {
        this.polarity = polarity;
        this.constant = constant;
        this.predicate = predicate;
        this.comment = comment;
        this.sourceLocation = sourceLocation;
    }

    private static ConditionTrait constant(Polarity polarity, boolean value, String comment) {
        return new ConditionTrait(polarity, value, null, comment,
                SourceLocation.capture(ConditionTrait.class).orElse(null));
    }

    private static ConditionTrait dynamic(Polarity polarity, Callable<Boolean> predicate, String comment) {
        Objects.requireNonNull(predicate, "predicate");
        return new ConditionTrait(polarity, null, predicate, comment,
                SourceLocation.capture(ConditionTrait.class).orElse(null));
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static ConditionTrait enabled(boolean condition) {
        return constant(Polarity.ENABLE_WHEN_TRUE, condition, null);
    }

    public static ConditionTrait enabled(boolean condition, String comment) {
        return constant(Polarity.ENABLE_WHEN_TRUE, condition, comment);
    }

    public static ConditionTrait enabledWhen(Callable<Boolean> predicate) {
        return dynamic(Polarity.ENABLE_WHEN_TRUE, predicate, null);
    }

    public static ConditionTrait enabledWhen(String comment, Callable<Boolean> predicate) {
        return dynamic(Polarity.ENABLE_WHEN_TRUE, predicate, comment);
    }

    /**
     * Unconditionally disabled.
     */
    public static ConditionTrait disabled() {
        return constant(Polarity.DISABLE_WHEN_TRUE, true, null);
    }

    public static ConditionTrait disabled(String comment) {
        return constant(Polarity.DISABLE_WHEN_TRUE, true, comment);
    }

    public static ConditionTrait disabled(boolean condition, String comment) {
        return constant(Polarity.DISABLE_WHEN_TRUE, condition, comment);
    }

    public static ConditionTrait disabledWhen(Callable<Boolean> predicate) {
        return dynamic(Polarity.DISABLE_WHEN_TRUE, predicate, null);
    }

    public static ConditionTrait disabledWhen(String comment, Callable<Boolean> predicate) {
        return dynamic(Polarity.DISABLE_WHEN_TRUE, predicate, comment);
    }

    /**
     * Constant condition emitted by discovery for declarations that are not
     * available in the running environment. The message becomes the skip
     * comment.
     */
    public static ConditionTrait unavailable(String message) {
        return constant(Polarity.DISABLE_WHEN_TRUE, true, message);
    }

    /**
     * Returns a copy attributed to {@code location} instead of the captured
     * declaration site.
     */
    public ConditionTrait at(SourceLocation location) {
        return new ConditionTrait(polarity, constant, predicate, comment,
                Objects.requireNonNull(location, "location"));
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    /**
     * True iff the outcome is fixed and reading it never invokes a predicate.
     */
    public boolean isConstant() {
        return constant != null;
    }

    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    public Optional<SourceLocation> sourceLocation() {
        return Optional.ofNullable(sourceLocation);
    }

    @Override
    public List<String> comments() {
        return comment == null ? List.of() : List.of(comment);
    }

    /**
     * Resolves this condition.
     *
     * @return {@code true} if the test may run, {@code false} if it must be skipped
     * @throws Exception anything the predicate throws, or {@link IllegalStateException} if it
     *                   returns {@code null}; never thrown for constant conditions
     */
    public boolean evaluate() throws Exception {
        boolean value;
        if (constant != null) {
            value = constant;
        } else {
            Boolean result = predicate.call();
            if (result == null) {
                throw new IllegalStateException("Condition predicate returned null");
            }
            value = result;
        }
        return polarity == Polarity.ENABLE_WHEN_TRUE ? value : !value;
    }

    /**
     * Skip attribution for this condition.
     */
    public SkipInfo skipInfo() {
        return new SkipInfo(comment, SourceContext.of(sourceLocation()));
    }

    @Override
    public String toString() {
        return "ConditionTrait{" + polarity
                + (isConstant() ? ", constant=" + constant : ", dynamic")
                + (comment != null ? ", comment=" + comment : "")
                + "}";
    }
}
