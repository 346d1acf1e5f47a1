package de.bsommerfeld.anchor.generics;

import java.util.List;

/**
 * Result of one instantiation pass: the static facades referenced once, and
 * one record per element type and shape, in table order.
 */
public record InstantiationReport(List<Class<?>> facades, List<InstantiationRecord> records) {

    public InstantiationReport {
        facades = List.copyOf(facades);
        records = List.copyOf(records);
    }

    public long rejectedInsertions() {
        return records.stream().filter(r -> r.insertion() == Insertion.REJECTED).count();
    }

    @Override
    public String toString() {
        return records.size() + " instantiations over " + facades.size() + " facades, "
                + rejectedInsertions() + " rejected insertions";
    }
}
