package de.bsommerfeld.anchor.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Carries step lifecycle events from the orchestrator to observers of a pass
 * (the step log, tests). Delivery is synchronous on the posting thread.
 *
 * <p>
 * A listener that throws never reaches the orchestrator: Guava hands the
 * failure to {@link #onSubscriberFailure}, which logs it and counts it, and
 * the remaining listeners still receive the event.
 */
@Singleton
public class ExerciseEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ExerciseEventBus.class);

    private final EventBus eventBus;
    private final AtomicLong subscriberFailures = new AtomicLong();

    public ExerciseEventBus() {
        this.eventBus = new EventBus(this::onSubscriberFailure);
    }

    public void post(Object event) {
        LOG.trace("Step event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Step listener added: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Step listener removed: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    /** @return listener invocations that threw since this bus was created */
    public long subscriberFailures() {
        return subscriberFailures.get();
    }

    private void onSubscriberFailure(Throwable failure, SubscriberExceptionContext context) {
        subscriberFailures.incrementAndGet();
        LOG.warn("Listener {}#{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), failure);
    }
}
