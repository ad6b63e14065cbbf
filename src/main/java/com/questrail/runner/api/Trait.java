package com.questrail.runner.api;

import java.util.List;

/**
 * Trait
 * -----------------------------------------------------------------------------
 * Annotation-like unit attached to a test or suite by the discovery layer.
 *
 * Variants are distinct classes implementing this interface. The plan layer
 * only acts on {@link ConditionTrait}s; every other variant is carried along
 * for reporting and introspection.
 */
public interface Trait
{
    /**
     * Human-readable comments this trait contributes, in declaration order.
     */
    default List<String> comments() {
        return List.of();
    }
}
