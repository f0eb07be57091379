package de.bsommerfeld.feedupdate.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} through which the updater
 * publishes its milestone notifications.
 *
 * <p>
 * Delivery is synchronous on the posting thread and best-effort: an
 * exception thrown by a subscriber is logged and swallowed by the bus, so a
 * misbehaving observer can never abort an update cycle.
 */
@Singleton
public class UpdateEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateEventBus.class);
    private final EventBus eventBus;

    public UpdateEventBus() {
        this.eventBus = new EventBus(UpdateEventBus::handleSubscriberException);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void handleSubscriberException(Throwable exception, SubscriberExceptionContext context) {
        LOG.warn("Subscriber {} failed to handle {}",
                context.getSubscriber().getClass().getName(),
                context.getEvent().getClass().getSimpleName(), exception);
    }
}
