package com.questrail.runner.api;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConditionTraitTests {

    @Test
    void constantConditionsResolveWithoutPredicate() throws Exception {
        assertTrue(ConditionTrait.enabled(true).isConstant());
        assertTrue(ConditionTrait.enabled(true).evaluate());
        assertFalse(ConditionTrait.enabled(false, "Some comment").evaluate());
        assertFalse(ConditionTrait.disabled().evaluate());
        assertFalse(ConditionTrait.disabled(true, "Some comment").evaluate());
        assertTrue(ConditionTrait.disabled(false, "Some comment").evaluate());
    }

    @Test
    void dynamicConditionsInvokeTheirPredicateOnEachEvaluation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ConditionTrait trait = ConditionTrait.enabledWhen(() -> calls.incrementAndGet() > 1);

        assertFalse(trait.isConstant());
        assertEquals(0, calls.get());
        assertFalse(trait.evaluate());
        assertTrue(trait.evaluate());
        assertEquals(2, calls.get());
    }

    @Test
    void disabledWhenInvertsThePredicate() throws Exception {
        assertFalse(ConditionTrait.disabledWhen(() -> true).evaluate());
        assertTrue(ConditionTrait.disabledWhen("never", () -> false).evaluate());
    }

    @Test
    void predicateFailuresPropagate() {
        ConditionTrait trait = ConditionTrait.enabledWhen(() -> {
            throw new IllegalStateException("boom");
        });

        assertThrows(IllegalStateException.class, trait::evaluate);
    }

    @Test
    void nullPredicateResultIsRejected() {
        assertThrows(IllegalStateException.class, ConditionTrait.enabledWhen(() -> null)::evaluate);
        assertThrows(IllegalStateException.class, ConditionTrait.disabledWhen(() -> null)::evaluate);
    }

    @Test
    void skipInfoCarriesCommentAndDeclarationSite() {
        ConditionTrait trait = ConditionTrait.disabled("Some comment");

        SkipInfo info = trait.skipInfo();
        assertEquals("Some comment", info.comment().orElseThrow());
        SourceLocation location = info.sourceContext().sourceLocation().orElseThrow();
        assertEquals(ConditionTraitTests.class.getName(), location.className());
    }

    @Test
    void unavailableUsesTheMessageAsComment() throws Exception {
        ConditionTrait trait = ConditionTrait.unavailable("Requires a newer platform");

        assertTrue(trait.isConstant());
        assertFalse(trait.evaluate());
        assertEquals("Requires a newer platform", trait.skipInfo().comment().orElseThrow());
    }

    @Test
    void atReplacesTheSourceLocation() {
        SourceLocation location = new SourceLocation("Suite.java", 42, "example.Suite");
        ConditionTrait trait = ConditionTrait.disabled("x").at(location);

        assertEquals(location, trait.sourceLocation().orElseThrow());
    }
}
