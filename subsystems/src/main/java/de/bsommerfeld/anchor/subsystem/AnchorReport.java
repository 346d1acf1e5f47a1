package de.bsommerfeld.anchor.subsystem;

import java.util.List;

/**
 * Per-entry-point outcomes of one anchor run, in invocation order.
 */
public record AnchorReport(String subsystem, List<Outcome> outcomes) {

    /**
     * @param detail {@code "ok"} or the absorbed failure's type and message
     */
    public record Outcome(String entryPoint, boolean succeeded, String detail) {
    }

    public AnchorReport {
        outcomes = List.copyOf(outcomes);
    }

    public long failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).count();
    }

    @Override
    public String toString() {
        return subsystem + ": " + outcomes.size() + " entry points, " + failures() + " absorbed failures";
    }
}
