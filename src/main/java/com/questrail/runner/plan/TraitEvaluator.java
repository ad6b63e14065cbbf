package com.questrail.runner.plan;

import com.questrail.runner.api.ConditionTrait;
import com.questrail.runner.api.Issue;
import com.questrail.runner.api.SkipInfo;
import com.questrail.runner.api.Test;
import com.questrail.runner.api.TestId;
import com.questrail.runner.api.Trait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TraitEvaluator
 * -----------------------------------------------------------------------------
 * Decides whether a test may run by evaluating the {@link ConditionTrait}s on
 * its ancestor chain.
 *
 * <h2>Evaluation order</h2>
 * Scopes are visited outermost (top-level suite) to innermost (the test);
 * within a scope, conditions are visited in declaration order. The first
 * condition that disables the test, or whose predicate throws, ends the
 * evaluation: no later condition at that scope or any inner scope is
 * evaluated. Constant conditions are read without invoking anything.
 *
 * <h2>Suite memoization</h2>
 * A suite's own conditions are evaluated at most once per evaluator, and the
 * same {@link TraitDecision} instance is returned for every descendant. A
 * suite predicate with side effects therefore runs once per plan, and an
 * erroring suite condition yields one decision that callers can report once.
 *
 * <p>Instances are not thread-safe; create one per plan.</p>
 */
public final class TraitEvaluator
{
    private static final Logger log = LoggerFactory.getLogger(TraitEvaluator.class);

    private final Map<TestId, TraitDecision> suiteDecisions = new HashMap<>();

    /**
     * @param chain the test and its enclosing suites, outermost first
     */
    public TraitDecision evaluate(List<Test> chain) {
        Objects.requireNonNull(chain, "chain");
        for (int depth = 0; depth < chain.size(); depth++) {
            Test scope = chain.get(depth);
            List<Test> ownerChain = chain.subList(0, depth + 1);

            TraitDecision decision = suiteDecisions.get(scope.id());
            if (decision == null) {
                decision = evaluateScope(ownerChain);
                if (scope.isSuite()) {
                    suiteDecisions.put(scope.id(), decision);
                }
            }
            if (!decision.isEnabled()) {
                return decision;
            }
        }
        return TraitDecision.enabled();
    }

    /**
     * Evaluates the conditions declared directly on the last element of
     * {@code ownerChain}.
     */
    static TraitDecision evaluateScope(List<Test> ownerChain) {
        Test owner = ownerChain.get(ownerChain.size() - 1);
        for (Trait trait : owner.traits()) {
            if (!(trait instanceof ConditionTrait condition)) {
                continue;
            }
            try {
                if (!condition.evaluate()) {
                    log.debug("{} disabled by {}", owner.id(), condition);
                    return new TraitDecision.Disabled(condition.skipInfo(), ownerChain);
                }
            } catch (OutOfMemoryError e) {
                throw e;
            } catch (Throwable t) {
                log.warn("Condition on {} threw; skipping it", owner.id(), t);
                Issue issue = Issue.errorCaught(t);
                SkipInfo skipInfo = condition.comment()
                        .map(comment -> new SkipInfo(comment, issue.sourceContext()))
                        .orElseGet(() -> SkipInfo.from(issue));
                return new TraitDecision.Errored(issue, skipInfo, ownerChain);
            }
        }
        return TraitDecision.enabled();
    }
}
