package com.questrail.runner.plan;

import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;
import com.questrail.runner.catalog.TestCatalog;
import com.questrail.runner.config.Configuration;
import com.questrail.runner.config.TestSelection;
import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PlanBuilder
 * -----------------------------------------------------------------------------
 * Turns a {@link TestCatalog} and a {@link TestSelection} into a {@link Plan}.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Keep the tests the selection names (directly or through an enclosing
 *       suite). Hidden tests, and tests inside hidden suites, are dropped
 *       unless the selection includes hidden tests.</li>
 *   <li>Every kept test function gets a step. A kept suite gets a step only if
 *       it was named directly and none of its descendants were kept.</li>
 *   <li>Each step's action comes from the {@link TraitEvaluator}: enabled runs,
 *       disabled or errored skips.</li>
 *   <li>Steps follow catalog discovery order.</li>
 * </ol>
 *
 * <h2>Condition errors</h2>
 * A condition whose predicate throws produces exactly one
 * {@code issueRecorded} event, attributed to the test or suite declaring it.
 * A builder created with a {@link Configuration} (or {@link EventBus}) posts
 * it while building. A builder created without one attaches it to the first
 * affected step as a {@link Plan.DeferredIssue} for the runner to post.
 */
public final class PlanBuilder
{
    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final EventBus issueBus;

    /**
     * Builder that defers condition issues to the runner.
     */
    public PlanBuilder() {
        this.issueBus = null;
    }

    /**
     * Builder that reports condition issues to {@code configuration}'s handler
     * as they occur.
     */
    public PlanBuilder(Configuration configuration) {
        this(new EventBus(configuration));
    }

    public PlanBuilder(EventBus issueBus) {
        this.issueBus = Objects.requireNonNull(issueBus, "issueBus");
    }

    /**
     * Plans every test in {@code catalog} that is not hidden.
     */
    public Plan build(TestCatalog catalog) {
        return build(catalog, TestSelection.allVisible());
    }

    public Plan build(TestCatalog catalog, TestSelection selection) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(selection, "selection");

        List<List<Test>> selectedChains = new ArrayList<>();
        Set<TestId> enclosingSelected = new HashSet<>();
        for (Test test : catalog.tests()) {
            List<Test> chain = catalog.ancestry(test);
            if (isSelected(chain, selection)) {
                selectedChains.add(chain);
                Optional<TestId> parent = test.id().parent();
                while (parent.isPresent()) {
                    enclosingSelected.add(parent.get());
                    parent = parent.get().parent();
                }
            }
        }

        TraitEvaluator evaluator = new TraitEvaluator();
        Set<TraitDecision> reported = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Plan.Step> steps = new ArrayList<>();
        int skipped = 0;

        for (List<Test> chain : selectedChains) {
            Test test = chain.get(chain.size() - 1);
            if (test.isSuite()
                    && (enclosingSelected.contains(test.id()) || !selection.selectsDirectly(test.id()))) {
                continue;
            }

            Plan.Step step = toStep(chain, evaluator.evaluate(chain), reported);
            if (!step.action().isRun()) {
                skipped++;
            }
            steps.add(step);
        }

        log.debug("Built plan of {} steps ({} skipped) from {} catalog entries with {}",
                steps.size(), skipped, catalog.tests().size(), selection);
        return new Plan(steps);
    }

    private static boolean isSelected(List<Test> chain, TestSelection selection) {
        Test test = chain.get(chain.size() - 1);
        if (!selection.selects(test.id())) {
            return false;
        }
        if (selection.includesHidden()) {
            return true;
        }
        for (Test scope : chain) {
            if (scope.isHidden()) {
                return false;
            }
        }
        return true;
    }

    private Plan.Step toStep(List<Test> chain, TraitDecision decision, Set<TraitDecision> reported) {
        if (decision instanceof TraitDecision.Disabled disabled) {
            return new Plan.Step(chain, Plan.Action.skip(disabled.skipInfo()), null);
        }
        if (decision instanceof TraitDecision.Errored errored) {
            Plan.DeferredIssue deferred = null;
            if (reported.add(errored)) {
                if (issueBus != null) {
                    issueBus.post(new Event.IssueRecorded(errored.issue()),
                            EventContext.forTest(errored.ownerChain()));
                } else {
                    deferred = new Plan.DeferredIssue(errored.issue(), errored.ownerChain());
                }
            }
            return new Plan.Step(chain, Plan.Action.skip(errored.skipInfo()), deferred);
        }
        return new Plan.Step(chain, Plan.Action.run(), null);
    }
}
