package com.questrail.runner.catalog;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ListTestCatalog
 * -----------------------------------------------------------------------------
 * {@link TestCatalog} backed by:
 *
 * <ul>
 *   <li>a list for discovery order</li>
 *   <li>a map for id -> test</li>
 * </ul>
 *
 * Parents may be absent (a catalog can hold an ad hoc subset of a larger
 * one), but a parent that is present must be a suite.
 */
public final class ListTestCatalog implements TestCatalog
{
    private final List<Test> tests;
    private final Map<TestId, Test> testsById;

    public ListTestCatalog(List<Test> testsInDiscoveryOrder) {
        Objects.requireNonNull(testsInDiscoveryOrder, "testsInDiscoveryOrder");

        Map<TestId, Test> tmp = new HashMap<>(testsInDiscoveryOrder.size() * 2);
        for (Test test : testsInDiscoveryOrder) {
            Objects.requireNonNull(test, "test");
            Test prev = tmp.put(test.id(), test);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate test ID in catalog: " + test.id());
            }
        }
        for (Test test : testsInDiscoveryOrder) {
            test.parentId().map(tmp::get).ifPresent(parent -> {
                if (!parent.isSuite()) {
                    throw new IllegalArgumentException(
                            "Parent " + parent.id() + " of " + test.id() + " is not a suite");
                }
            });
        }

        this.tests = Collections.unmodifiableList(new ArrayList<>(testsInDiscoveryOrder));
        this.testsById = Collections.unmodifiableMap(tmp);
    }

    @Override
    public List<Test> tests() {
        return tests;
    }

    @Override
    public Optional<Test> find(TestId id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(testsById.get(id));
    }

    @Override
    public String toString() {
        return "ListTestCatalog{" + tests.size() + " tests}";
    }
}
