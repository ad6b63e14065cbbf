package com.questrail.runner.config;

import com.questrail.runner.api.TestId;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TestSelectionTests {

    @Test
    void unfilteredSelectsEverythingIncludingHidden() {
        TestSelection selection = TestSelection.unfiltered();

        assertTrue(selection.isUnfiltered());
        assertTrue(selection.includesHidden());
        assertTrue(selection.selects(TestId.parse("Any/thing()")));
        assertTrue(selection.testIds().isEmpty());
    }

    @Test
    void allVisibleExcludesHidden() {
        TestSelection selection = TestSelection.allVisible();

        assertFalse(selection.isUnfiltered());
        assertFalse(selection.includesHidden());
        assertTrue(selection.selects(TestId.parse("Any/thing()")));
    }

    @Test
    void suiteIdSelectsItsDescendants() {
        TestSelection selection = TestSelection.parse("Outer/Inner");

        assertTrue(selection.selects(TestId.parse("Outer/Inner")));
        assertTrue(selection.selects(TestId.parse("Outer/Inner/leaf()")));
        assertFalse(selection.selects(TestId.parse("Outer")));
        assertFalse(selection.selects(TestId.parse("Outer/other()")));

        assertTrue(selection.selectsDirectly(TestId.parse("Outer/Inner")));
        assertFalse(selection.selectsDirectly(TestId.parse("Outer/Inner/leaf()")));
    }

    @Test
    void includingHiddenKeepsTheIds() {
        TestSelection selection = TestSelection.of(TestId.parse("A/b()")).includingHidden(true);

        assertTrue(selection.includesHidden());
        assertEquals(Set.of(TestId.parse("A/b()")), selection.testIds().orElseThrow());
        assertEquals(TestSelection.of(Set.of(TestId.parse("A/b()")), true), selection);
    }

    @Test
    void emptySelectionSelectsNothing() {
        TestSelection selection = TestSelection.of(Set.of(), false);

        assertFalse(selection.selects(TestId.parse("A/b()")));
    }
}
