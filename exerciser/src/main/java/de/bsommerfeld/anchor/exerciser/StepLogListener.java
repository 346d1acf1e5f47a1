package de.bsommerfeld.anchor.exerciser;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.anchor.core.event.StepEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes step lifecycle events to the log. */
public class StepLogListener {

    private static final Logger LOG = LoggerFactory.getLogger(StepLogListener.class);

    @Subscribe
    public void onStarted(StepEvents.StepStarted event) {
        LOG.debug("Step {} started", event.step());
    }

    @Subscribe
    public void onCompleted(StepEvents.StepCompleted event) {
        LOG.info("Step {} completed in {} ms: {}", event.step(), event.elapsed().toMillis(), event.summary());
    }

    @Subscribe
    public void onFailed(StepEvents.StepFailed event) {
        LOG.warn("Step {} failed after {} ms: {}", event.step(), event.elapsed().toMillis(),
                event.cause().toString());
    }
}
