package de.bsommerfeld.anchor.core.event;

import java.time.Duration;

/**
 * Lifecycle events of a single orchestrated step. Every started step is
 * followed by exactly one completed or failed event.
 */
public class StepEvents {

    public record StepStarted(String step) {
    }

    /**
     * @param summary discardable, human-readable outcome of the step
     */
    public record StepCompleted(String step, Duration elapsed, String summary) {
    }

    /**
     * Fired when a step let an exception escape. The orchestrator absorbs it
     * and continues with the next step.
     */
    public record StepFailed(String step, Duration elapsed, Throwable cause) {
    }

    /** Fired once after the last step, whatever the individual outcomes. */
    public record PassFinished(int steps, int failed) {
    }
}
