package com.questrail.runner.api;

/**
 * Body of a parameterized test, invoked once per argument.
 *
 * @param <A> argument type
 */
@FunctionalInterface
public interface ParameterizedTestFunction<A>
{
    void invoke(A argument) throws Exception;
}
