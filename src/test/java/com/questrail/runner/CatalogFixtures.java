package com.questrail.runner;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestFunction;
import com.questrail.runner.api.TestId;
import com.questrail.runner.api.Trait;

/**
 * Shorthand for building catalog entries from slash-separated IDs. The parent
 * of each entry is derived from its ID.
 */
public final class CatalogFixtures {

    public static final TestFunction NOOP = () -> {};

    private CatalogFixtures() {}

    public static Test suite(String path, Trait... traits) {
        return builder(path).suite().traits(traits).build();
    }

    public static Test hiddenSuite(String path, Trait... traits) {
        return builder(path).suite().hidden().traits(traits).build();
    }

    public static Test test(String path, TestFunction body, Trait... traits) {
        return builder(path).traits(traits).body(body).build();
    }

    public static Test test(String path, Trait... traits) {
        return test(path, NOOP, traits);
    }

    public static Test hiddenTest(String path, Trait... traits) {
        return builder(path).hidden().traits(traits).body(NOOP).build();
    }

    public static Test.Builder builder(String path) {
        TestId id = TestId.parse(path);
        Test.Builder builder = Test.builder(id);
        id.parent().ifPresent(builder::parent);
        return builder;
    }
}
