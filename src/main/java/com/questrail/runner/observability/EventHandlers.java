package com.questrail.runner.observability;

import com.questrail.runner.event.EventHandler;

import java.util.List;
import java.util.Objects;

/**
 * Composition helpers for {@link EventHandler}s.
 */
public final class EventHandlers {

    private EventHandlers() {}

    /**
     * Handler forwarding each event to every delegate, in order.
     */
    public static EventHandler compose(EventHandler... delegates) {
        List<EventHandler> all = List.of(delegates);
        all.forEach(d -> Objects.requireNonNull(d, "delegate"));
        return (event, context) -> {
            for (EventHandler delegate : all) {
                delegate.handle(event, context);
            }
        };
    }
}
