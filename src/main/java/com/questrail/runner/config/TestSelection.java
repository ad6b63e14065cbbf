package com.questrail.runner.config;

import com.questrail.runner.api.TestId;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * TestSelection
 * -----------------------------------------------------------------------------
 * Which tests of a catalog a plan should contain.
 *
 * <h2>Matching</h2>
 * A test is selected when its ID equals, or is nested under, one of the
 * selected IDs; naming a suite therefore selects all of its descendants. A
 * selection without an ID set selects every test.
 *
 * <h2>Hidden tests</h2>
 * Hidden tests (and tests nested in hidden suites) are excluded unless
 * {@link #includesHidden()} is true, even when their ID is named explicitly.
 *
 * <h2>Unfiltered</h2>
 * {@link #unfiltered()} is the configuration default meaning "no filter was
 * configured". It selects everything, hidden tests included, and lets the
 * runner fall back to its own default for the catalog being run.
 */
public final class TestSelection
{
    private static final TestSelection UNFILTERED = new TestSelection(null, true, true);
    private static final TestSelection ALL_VISIBLE = new TestSelection(null, false, false);

    private final Set<TestId> testIds;
    private final boolean includeHidden;
    private final boolean unfiltered;

    private TestSelection(Set<TestId> testIds, boolean includeHidden, boolean unfiltered) {
        this.testIds = testIds == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(testIds));
        this.includeHidden = includeHidden;
        this.unfiltered = unfiltered;
    }

    public static TestSelection unfiltered() {
        return UNFILTERED;
    }

    /**
     * Every test that is not hidden.
     */
    public static TestSelection allVisible() {
        return ALL_VISIBLE;
    }

    public static TestSelection of(Set<TestId> testIds, boolean includeHidden) {
        Objects.requireNonNull(testIds, "testIds");
        testIds.forEach(id -> Objects.requireNonNull(id, "testId"));
        return new TestSelection(testIds, includeHidden, false);
    }

    public static TestSelection of(TestId... testIds) {
        return of(new LinkedHashSet<>(Arrays.asList(testIds)), false);
    }

    /**
     * Selection of slash-separated IDs, e.g. {@code parse("Suite/test()")}.
     */
    public static TestSelection parse(String... testIds) {
        return of(Arrays.stream(testIds)
                .map(TestId::parse)
                .collect(Collectors.toCollection(LinkedHashSet::new)), false);
    }

    public TestSelection includingHidden(boolean includeHidden) {
        return new TestSelection(testIds, includeHidden, false);
    }

    public boolean isUnfiltered() {
        return unfiltered;
    }

    /**
     * The explicitly selected IDs; empty when every test is selected.
     */
    public Optional<Set<TestId>> testIds() {
        return Optional.ofNullable(testIds);
    }

    public boolean includesHidden() {
        return includeHidden;
    }

    /**
     * True if {@code id} is selected by ID (hidden-ness is not considered).
     */
    public boolean selects(TestId id) {
        Objects.requireNonNull(id, "id");
        if (testIds == null) {
            return true;
        }
        for (TestId selected : testIds) {
            if (selected.contains(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if {@code id} itself was named, rather than selected through an
     * enclosing suite. Every ID is directly selected when no ID set is given.
     */
    public boolean selectsDirectly(TestId id) {
        return testIds == null || testIds.contains(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestSelection that)) return false;
        return includeHidden == that.includeHidden
                && unfiltered == that.unfiltered
                && Objects.equals(testIds, that.testIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testIds, includeHidden, unfiltered);
    }

    @Override
    public String toString() {
        if (unfiltered) {
            return "TestSelection{unfiltered}";
        }
        return "TestSelection{" + (testIds == null ? "all" : testIds) + ", includeHidden=" + includeHidden + "}";
    }
}
