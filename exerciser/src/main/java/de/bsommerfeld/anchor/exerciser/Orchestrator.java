package de.bsommerfeld.anchor.exerciser;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.attempt.Attempt;
import de.bsommerfeld.anchor.core.event.ExerciseEventBus;
import de.bsommerfeld.anchor.core.event.StepEvents;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import de.bsommerfeld.anchor.generics.GenericInstantiator;
import de.bsommerfeld.anchor.subsystem.SubsystemAnchor;
import de.bsommerfeld.anchor.universe.TypeUniverseWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs one exercise pass: type universe walk, generic instantiation, then
 * every configured subsystem anchor.
 *
 * <h3>Sequencing</h3>
 * The sequence is fixed and unconditional. Steps share no state and no step
 * reads another's result; each one exists for its effect on reachability.
 *
 * <h3>Failure handling</h3>
 * Every step runs inside an {@link Attempt}. A step that lets an exception
 * escape is reported as {@link StepEvents.StepFailed} and the pass moves on,
 * so a broken anchor never skips the anchors after it.
 */
@Singleton
public class Orchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

    private final TypeUniverseWalker walker;
    private final GenericInstantiator instantiator;
    private final List<SubsystemAnchor> anchors;
    private final ExerciseEventBus eventBus;

    @Inject
    public Orchestrator(TypeUniverseWalker walker, GenericInstantiator instantiator,
            Set<SubsystemAnchor> anchors, ExerciseEventBus eventBus) {
        this.walker = walker;
        this.instantiator = instantiator;
        this.anchors = ImmutableList.copyOf(anchors);
        this.eventBus = eventBus;
    }

    public void run() {
        int steps = 0;
        int failed = 0;

        steps++;
        if (!runStep("type-universe", walker::walk))
            failed++;

        steps++;
        if (!runStep("generic-instantiation", instantiator::instantiate))
            failed++;

        for (SubsystemAnchor anchor : anchors) {
            steps++;
            if (!runStep("subsystem:" + anchor.name(), anchor::anchor))
                failed++;
        }

        KeepAlive.accept(Orchestrator.class);
        LOG.info("Exercise pass finished: {} steps, {} failed", steps, failed);
        eventBus.post(new StepEvents.PassFinished(steps, failed));
    }

    /** @return whether the step completed without letting an exception escape */
    private boolean runStep(String step, Attempt.Action<Object> body) {
        eventBus.post(new StepEvents.StepStarted(step));
        Stopwatch stopwatch = Stopwatch.createStarted();

        Attempt<Object> outcome = Attempt.of(body);

        if (outcome.succeeded()) {
            eventBus.post(new StepEvents.StepCompleted(step, stopwatch.elapsed(), String.valueOf(outcome.value())));
            return true;
        }
        LOG.warn("Step {} failed, continuing: {}", step, outcome.describe(), outcome.failure());
        eventBus.post(new StepEvents.StepFailed(step, stopwatch.elapsed(), outcome.failure()));
        return false;
    }
}
