package com.questrail.runner.config;

import com.questrail.runner.event.EventHandler;
import com.questrail.runner.observability.NullEventHandler;

import java.util.Objects;

/**
 * Configuration
 * -----------------------------------------------------------------------------
 * Settings for one run. Passed explicitly to the plan builder and runner;
 * there is no process-wide default instance.
 *
 * <ul>
 *   <li><b>eventHandler</b>: observer receiving every delivered event.</li>
 *   <li><b>parallelizationEnabled</b>: dispatch runnable steps concurrently
 *       instead of one at a time.</li>
 *   <li><b>testFilter</b>: which tests of a catalog to plan.</li>
 *   <li><b>deliverExpectationCheckedEvents</b>: forward per-expectation
 *       events to the handler; dropped before delivery otherwise.</li>
 *   <li><b>mainContextIsolationEnforced</b>: run synchronous test bodies on
 *       the single main execution context.</li>
 *   <li><b>maxParallelism</b>: worker pool bound in parallel mode;
 *       {@code 0} means unbounded.</li>
 * </ul>
 */
public record Configuration(
        EventHandler eventHandler,
        boolean isParallelizationEnabled,
        TestSelection testFilter,
        boolean deliverExpectationCheckedEvents,
        boolean isMainContextIsolationEnforced,
        int maxParallelism
) {
    public Configuration {
        Objects.requireNonNull(eventHandler, "eventHandler");
        Objects.requireNonNull(testFilter, "testFilter");
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("maxParallelism must be >= 0");
        }
    }

    /**
     * Parallel, unfiltered, expectation events off, isolation not enforced,
     * events discarded.
     */
    public static Configuration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withEventHandler(eventHandler)
                .withParallelizationEnabled(isParallelizationEnabled)
                .withTestFilter(testFilter)
                .withDeliverExpectationCheckedEvents(deliverExpectationCheckedEvents)
                .withMainContextIsolationEnforced(isMainContextIsolationEnforced)
                .withMaxParallelism(maxParallelism);
    }

    public static final class Builder {
        private EventHandler eventHandler = NullEventHandler.INSTANCE;
        private boolean parallelizationEnabled = true;
        private TestSelection testFilter = TestSelection.unfiltered();
        private boolean deliverExpectationCheckedEvents;
        private boolean mainContextIsolationEnforced;
        private int maxParallelism;

        public Builder withEventHandler(EventHandler eventHandler) {
            this.eventHandler = eventHandler;
            return this;
        }

        public Builder withParallelizationEnabled(boolean enabled) {
            this.parallelizationEnabled = enabled;
            return this;
        }

        public Builder withTestFilter(TestSelection testFilter) {
            this.testFilter = testFilter;
            return this;
        }

        public Builder withDeliverExpectationCheckedEvents(boolean deliver) {
            this.deliverExpectationCheckedEvents = deliver;
            return this;
        }

        public Builder withMainContextIsolationEnforced(boolean enforced) {
            this.mainContextIsolationEnforced = enforced;
            return this;
        }

        public Builder withMaxParallelism(int maxParallelism) {
            this.maxParallelism = maxParallelism;
            return this;
        }

        public Configuration build() {
            return new Configuration(
                    eventHandler,
                    parallelizationEnabled,
                    testFilter,
                    deliverExpectationCheckedEvents,
                    mainContextIsolationEnforced,
                    maxParallelism);
        }
    }
}
