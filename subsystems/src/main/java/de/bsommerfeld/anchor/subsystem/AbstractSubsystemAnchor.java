package de.bsommerfeld.anchor.subsystem;

import de.bsommerfeld.anchor.core.attempt.Attempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs each declared {@link EntryPoint} in its own {@link Attempt}, so a
 * failing call never skips the ones after it.
 */
public abstract class AbstractSubsystemAnchor implements SubsystemAnchor {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSubsystemAnchor.class);

    /** Entry points in invocation order. */
    protected abstract List<EntryPoint> entryPoints();

    @Override
    public final AnchorReport anchor() {
        List<AnchorReport.Outcome> outcomes = new ArrayList<>();
        for (EntryPoint entryPoint : entryPoints()) {
            Attempt<Void> call = Attempt.run(entryPoint.action());
            if (!call.succeeded()) {
                LOG.debug("[{}] {} failed: {}", name(), entryPoint.name(), call.describe());
            }
            outcomes.add(new AnchorReport.Outcome(entryPoint.name(), call.succeeded(), call.describe()));
        }
        AnchorReport report = new AnchorReport(name(), outcomes);
        LOG.info("Anchored {}", report);
        return report;
    }
}
