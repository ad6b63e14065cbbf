package com.questrail.runner.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test
 * -----------------------------------------------------------------------------
 * A discovered test function or suite. Immutable once built.
 *
 * <h2>Hierarchy</h2>
 * Suites contain test functions and nested suites. A test refers to its
 * enclosing suite by {@link #parentId()} only; resolving the parent is a
 * lookup against the {@code TestCatalog} that holds both, never an owning
 * reference.
 *
 * <h2>Identity</h2>
 * Equality and hash code are based on {@link #id()} alone.
 */
public final class Test
{
    private static final AtomicLong ANONYMOUS = new AtomicLong();

    private final TestId id;
    private final String name;
    private final boolean suite;
    private final boolean hidden;
    private final List<Trait> traits;
    private final TestId parentId;
    private final ExecutionAffinity affinity;
    private final List<TestCase> testCases;

    private Test(Builder builder, List<TestCase> testCases) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id.name();
        this.suite = builder.suite;
        this.hidden = builder.hidden;
        this.traits = Collections.unmodifiableList(new ArrayList<>(builder.traits));
        this.parentId = builder.parentId;
        this.affinity = builder.affinity;
        this.testCases = Collections.unmodifiableList(testCases);
    }

    public static Builder builder(TestId id) {
        return new Builder(id);
    }

    /**
     * Ad hoc test function with a generated, unique ID.
     */
    public static Test of(TestFunction body, Trait... traits) {
        return of("anonymous()", body, traits);
    }

    /**
     * Ad hoc test function named {@code name} with a generated, unique ID.
     */
    public static Test of(String name, TestFunction body, Trait... traits) {
        TestId id = TestId.of("adhoc-" + ANONYMOUS.incrementAndGet(), name);
        return builder(id).name(name).traits(traits).body(body).build();
    }

    public TestId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public boolean isSuite() {
        return suite;
    }

    public boolean isHidden() {
        return hidden;
    }

    public List<Trait> traits() {
        return traits;
    }

    public Optional<TestId> parentId() {
        return Optional.ofNullable(parentId);
    }

    public ExecutionAffinity affinity() {
        return affinity;
    }

    /**
     * The cases to invoke when this test runs, in argument order. Empty for
     * suites, exactly one for a plain test function.
     */
    public List<TestCase> testCases() {
        return testCases;
    }

    public boolean isParameterized() {
        return !testCases.isEmpty() && testCases.get(0).isParameterized();
    }

    /**
     * Comments contributed by this test's traits of the given kind, in
     * declaration order.
     */
    public List<String> comments(Class<? extends Trait> traitType) {
        List<String> comments = new ArrayList<>();
        for (Trait trait : traits) {
            if (traitType.isInstance(trait)) {
                comments.addAll(trait.comments());
            }
        }
        return comments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Test that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return (suite ? "Suite(" : "Test(") + id + ")";
    }

    public static final class Builder {
        private final TestId id;
        private String name;
        private boolean suite;
        private boolean hidden;
        private final List<Trait> traits = new ArrayList<>();
        private TestId parentId;
        private ExecutionAffinity affinity = ExecutionAffinity.DEFAULT;
        private TestFunction body;
        private List<?> arguments;
        private ParameterizedTestFunction<Object> parameterizedBody;

        private Builder(TestId id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder suite() {
            this.suite = true;
            return this;
        }

        public Builder hidden() {
            this.hidden = true;
            return this;
        }

        public Builder traits(Trait... traits) {
            for (Trait trait : traits) {
                this.traits.add(Objects.requireNonNull(trait, "trait"));
            }
            return this;
        }

        /**
         * Places this test in {@code suite}. The suite is referenced by ID only.
         */
        public Builder parent(TestId suiteId) {
            this.parentId = Objects.requireNonNull(suiteId, "suiteId");
            return this;
        }

        public Builder affinity(ExecutionAffinity affinity) {
            this.affinity = Objects.requireNonNull(affinity, "affinity");
            return this;
        }

        public Builder body(TestFunction body) {
            this.body = Objects.requireNonNull(body, "body");
            this.arguments = null;
            this.parameterizedBody = null;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <A> Builder arguments(List<A> arguments, ParameterizedTestFunction<? super A> body) {
            Objects.requireNonNull(arguments, "arguments");
            Objects.requireNonNull(body, "body");
            this.arguments = new ArrayList<>(arguments);
            this.parameterizedBody = (ParameterizedTestFunction<Object>) body;
            this.body = null;
            return this;
        }

        public Test build() {
            boolean hasBody = body != null || parameterizedBody != null;
            if (suite && hasBody) {
                throw new IllegalStateException("Suite " + id + " must not have a body");
            }
            if (!suite && !hasBody) {
                throw new IllegalStateException("Test function " + id + " requires a body");
            }
            if (parentId != null && (parentId.equals(id) || !parentId.contains(id))) {
                throw new IllegalStateException("Test " + id + " is not nested under parent " + parentId);
            }

            List<TestCase> cases = new ArrayList<>();
            if (body != null) {
                cases.add(new TestCase(0, null, false, body));
            } else if (parameterizedBody != null) {
                ParameterizedTestFunction<Object> fn = parameterizedBody;
                for (int i = 0; i < arguments.size(); i++) {
                    Object argument = arguments.get(i);
                    cases.add(new TestCase(i, argument, true, () -> fn.invoke(argument)));
                }
            }
            return new Test(this, cases);
        }
    }
}
