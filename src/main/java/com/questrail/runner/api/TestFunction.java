package com.questrail.runner.api;

/**
 * Body of a non-parameterized test.
 */
@FunctionalInterface
public interface TestFunction
{
    void invoke() throws Exception;
}
