package com.questrail.runner.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TestId
 * -----------------------------------------------------------------------------
 * Stable, hierarchical identity of a {@link Test}.
 *
 * An ID is an ordered list of path components: the enclosing suite path
 * followed (for test functions) by the function signature, e.g.
 * {@code Signals/Interlocking/routeLocksSwitch()}.
 *
 * <h2>Equality</h2>
 * Two IDs are equal iff their component lists are equal. Display names play no
 * part in identity.
 */
public final class TestId
{
    private static final String SEPARATOR = "/";

    private final List<String> components;

    private TestId(List<String> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("TestId requires at least one component");
        }
        for (String component : components) {
            Objects.requireNonNull(component, "component");
            if (component.isEmpty()) {
                throw new IllegalArgumentException("TestId components must not be empty");
            }
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public static TestId of(String first, String... rest) {
        List<String> components = new ArrayList<>();
        components.add(first);
        components.addAll(Arrays.asList(rest));
        return new TestId(components);
    }

    public static TestId of(List<String> components) {
        return new TestId(components);
    }

    /**
     * Parses a slash-separated ID such as {@code "Suite/Nested/test()"}.
     */
    public static TestId parse(String text) {
        Objects.requireNonNull(text, "text");
        return new TestId(Arrays.asList(text.split(SEPARATOR, -1)));
    }

    public List<String> components() {
        return components;
    }

    /**
     * Returns the ID of a child of this ID named {@code name}.
     */
    public TestId child(String name) {
        List<String> childComponents = new ArrayList<>(components);
        childComponents.add(name);
        return new TestId(childComponents);
    }

    public Optional<TestId> parent() {
        if (components.size() == 1) {
            return Optional.empty();
        }
        return Optional.of(new TestId(components.subList(0, components.size() - 1)));
    }

    /**
     * Last path component (usually the display name of the test).
     */
    public String name() {
        return components.get(components.size() - 1);
    }

    /**
     * Returns true if this ID equals {@code other} or is one of its ancestors.
     */
    public boolean contains(TestId other) {
        return other.components.size() >= components.size()
                && other.components.subList(0, components.size()).equals(components);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestId that)) return false;
        return components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, components);
    }
}
