package com.questrail.runner.event;

/**
 * Observer of a run's event stream.
 *
 * Calls are serialized by the {@link EventBus}: an implementation is never
 * entered concurrently by the same run, even when steps execute in parallel.
 */
@FunctionalInterface
public interface EventHandler
{
    void handle(Event event, EventContext context);
}
