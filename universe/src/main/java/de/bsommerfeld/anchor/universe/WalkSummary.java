package de.bsommerfeld.anchor.universe;

/**
 * Counts of one walker pass. Discardable; used for the step log line.
 *
 * @param sources              type sources visited
 * @param typesTouched         distinct types touched
 * @param duplicates           types listed by more than one source, touched once
 * @param loadFailures         types (or whole source listings) that failed to load
 * @param constructed          successful zero-argument constructions
 * @param constructionFailures constructions that were attempted and failed
 */
public record WalkSummary(
        int sources,
        int typesTouched,
        int duplicates,
        int loadFailures,
        int constructed,
        int constructionFailures) {

    @Override
    public String toString() {
        return sources + " sources, " + typesTouched + " types touched ("
                + duplicates + " duplicates, " + loadFailures + " load failures), "
                + constructed + " constructed, " + constructionFailures + " construction failures";
    }
}
