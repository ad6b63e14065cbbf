package com.questrail.runner.api;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestBuilderTests {

    @org.junit.jupiter.api.Test
    void plainTestHasOneCase() {
        Test test = Test.builder(TestId.parse("Suite/t()")).parent(TestId.parse("Suite")).body(() -> {}).build();

        assertEquals("t()", test.name());
        assertEquals(1, test.testCases().size());
        assertFalse(test.testCases().get(0).isParameterized());
        assertEquals(ExecutionAffinity.DEFAULT, test.affinity());
    }

    @org.junit.jupiter.api.Test
    void suiteHasNoCases() {
        Test suite = Test.builder(TestId.parse("Suite")).suite().build();

        assertTrue(suite.isSuite());
        assertTrue(suite.testCases().isEmpty());
    }

    @org.junit.jupiter.api.Test
    void argumentsProduceOneCasePerValue() {
        Test test = Test.builder(TestId.parse("Suite/p(_:)"))
                .arguments(List.of("a", "b"), (String s) -> {})
                .build();

        assertTrue(test.isParameterized());
        assertEquals(List.of(0, 1), test.testCases().stream().map(TestCase::index).toList());
        assertEquals("b", test.testCases().get(1).argument().orElseThrow());
    }

    @org.junit.jupiter.api.Test
    void rejectsInconsistentDeclarations() {
        assertThrows(IllegalStateException.class,
                () -> Test.builder(TestId.parse("Suite")).suite().body(() -> {}).build());
        assertThrows(IllegalStateException.class,
                () -> Test.builder(TestId.parse("Suite/t()")).build());
        assertThrows(IllegalStateException.class,
                () -> Test.builder(TestId.parse("Suite/t()")).parent(TestId.parse("Other")).body(() -> {}).build());
    }

    @org.junit.jupiter.api.Test
    void commentsAreCollectedByTraitType() {
        Test test = Test.builder(TestId.parse("Suite/t()"))
                .traits(new CommentTrait("first"), ConditionTrait.enabled(true, "condition"), new CommentTrait("second"))
                .body(() -> {})
                .build();

        assertEquals(List.of("first", "second"), test.comments(CommentTrait.class));
        assertEquals(List.of("condition"), test.comments(ConditionTrait.class));
    }

    @org.junit.jupiter.api.Test
    void adHocTestsGetUniqueIds() {
        Test a = Test.of("same()", () -> {});
        Test b = Test.of("same()", () -> {});

        assertNotEquals(a.id(), b.id());
        assertEquals("same()", a.name());
    }
}
