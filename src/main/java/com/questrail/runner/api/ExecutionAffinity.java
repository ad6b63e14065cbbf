package com.questrail.runner.api;

/**
 * Where a test body may execute relative to the main execution context.
 */
public enum ExecutionAffinity
{
    /**
     * Synchronous body. Bound to the main execution context when isolation is
     * enforced by the configuration, free otherwise.
     */
    DEFAULT,

    /** Always executes on the main execution context. */
    MAIN_CONTEXT,

    /**
     * Asynchronous-capable or explicitly exempted body. Never bound to the main
     * execution context.
     */
    NONISOLATED
}
