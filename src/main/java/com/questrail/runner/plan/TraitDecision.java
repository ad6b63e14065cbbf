package com.questrail.runner.plan;

import com.questrail.runner.api.Issue;
import com.questrail.runner.api.SkipInfo;
import com.questrail.runner.api.Test;

import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating the condition traits on a test's ancestor chain.
 */
public sealed interface TraitDecision
        permits TraitDecision.Enabled, TraitDecision.Disabled, TraitDecision.Errored
{
    static TraitDecision enabled() {
        return Enabled.INSTANCE;
    }

    default boolean isEnabled() {
        return this instanceof Enabled;
    }

    /** Every condition at every scope allowed the test to run. */
    final class Enabled implements TraitDecision {
        private static final Enabled INSTANCE = new Enabled();

        private Enabled() {}

        @Override
        public String toString() {
            return "Enabled";
        }
    }

    /**
     * A condition resolved to "skip".
     *
     * @param ownerChain the test or suite declaring the condition, with its
     *                   enclosing suites, outermost first
     */
    record Disabled(SkipInfo skipInfo, List<Test> ownerChain) implements TraitDecision {
        public Disabled {
            Objects.requireNonNull(skipInfo, "skipInfo");
            ownerChain = List.copyOf(ownerChain);
        }
    }

    /**
     * A condition predicate threw. The test is skipped and {@code issue} is
     * reported against the owner of the condition.
     */
    record Errored(Issue issue, SkipInfo skipInfo, List<Test> ownerChain) implements TraitDecision {
        public Errored {
            Objects.requireNonNull(issue, "issue");
            Objects.requireNonNull(skipInfo, "skipInfo");
            ownerChain = List.copyOf(ownerChain);
        }
    }
}
