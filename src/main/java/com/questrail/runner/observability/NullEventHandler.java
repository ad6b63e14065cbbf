package com.questrail.runner.observability;

import com.questrail.runner.event.Event;
import com.questrail.runner.event.EventContext;
import com.questrail.runner.event.EventHandler;

/**
 * No-op implementation of EventHandler.
 */
public final class NullEventHandler implements EventHandler {
    public static final NullEventHandler INSTANCE = new NullEventHandler();

    private NullEventHandler() {}

    @Override
    public void handle(Event event, EventContext context) {}
}
