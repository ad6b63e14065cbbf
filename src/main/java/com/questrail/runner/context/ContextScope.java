package com.questrail.runner.context;

/**
 * Controls how long a {@link RunContext} stays attached to the current thread.
 * Closing restores whatever context was attached before.
 */
public interface ContextScope extends AutoCloseable
{
    RunContext context();

    @Override
    void close();
}
