package com.questrail.runner.event;

import com.questrail.runner.config.Configuration;
import com.questrail.runner.internal.time.SystemWallClock;
import com.questrail.runner.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * EventBus
 * -----------------------------------------------------------------------------
 * Synchronous delivery of events to the handler of one {@link Configuration}.
 *
 * <h2>Delivery guarantees</h2>
 * <ul>
 *   <li>Each posted event reaches the handler exactly once, on the posting
 *       thread, before {@link #post} returns.</li>
 *   <li>Deliveries are serialized under a single lock; the handler is never
 *       entered concurrently.</li>
 *   <li>{@code expectationChecked} events are dropped before delivery unless
 *       the configuration asks for them.</li>
 *   <li>A handler that throws is logged; the failure never reaches the
 *       posting test or suppresses later events.</li>
 * </ul>
 */
public final class EventBus
{
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Configuration configuration;
    private final WallClock clock;
    private final Object deliveryLock = new Object();

    public EventBus(Configuration configuration) {
        this(configuration, SystemWallClock.INSTANCE);
    }

    public EventBus(Configuration configuration, WallClock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Configuration configuration() {
        return configuration;
    }

    public void post(Event.Kind kind, EventContext context) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(context, "context");

        if (kind instanceof Event.ExpectationChecked && !configuration.deliverExpectationCheckedEvents()) {
            return;
        }

        synchronized (deliveryLock) {
            Event event = new Event(clock.now(), kind);
            try {
                configuration.eventHandler().handle(event, context);
            } catch (RuntimeException e) {
                log.error("Event handler failed on {} for {}", kind.type(), context, e);
            }
        }
    }
}
