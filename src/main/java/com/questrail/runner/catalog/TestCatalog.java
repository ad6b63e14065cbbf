package com.questrail.runner.catalog;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TestCatalog
 * -----------------------------------------------------------------------------
 * Immutable set of discovered tests, as produced by the discovery layer.
 *
 * The catalog is the only place parent/child relationships are resolved:
 * tests refer to their suite by ID and the catalog answers lookups.
 *
 * <h2>Ordering</h2>
 * {@link #tests()} returns tests in discovery order. Plans preserve this order.
 */
public interface TestCatalog
{
    /**
     * All tests and suites in discovery order.
     */
    List<Test> tests();

    /**
     * Looks up a test by ID.
     *
     * @return the test, or empty if this catalog does not contain it
     */
    Optional<Test> find(TestId id);

    /**
     * Returns the ancestor chain of {@code test}, outermost first, ending with
     * {@code test} itself. Ancestors missing from this catalog end the chain.
     */
    default List<Test> ancestry(Test test) {
        Objects.requireNonNull(test, "test");
        List<Test> chain = new ArrayList<>();
        chain.add(test);
        Optional<TestId> parentId = test.parentId();
        while (parentId.isPresent()) {
            Optional<Test> parent = find(parentId.get());
            if (parent.isEmpty()) {
                break;
            }
            chain.add(parent.get());
            parentId = parent.get().parentId();
        }
        Collections.reverse(chain);
        return chain;
    }

    static TestCatalog of(List<Test> tests) {
        return new ListTestCatalog(tests);
    }

    static TestCatalog of(Test... tests) {
        return new ListTestCatalog(List.of(tests));
    }
}
