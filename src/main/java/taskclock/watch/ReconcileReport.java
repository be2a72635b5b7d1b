package taskclock.watch;

import java.util.Set;

/**
 * Outcome of one reconciliation.
 *
 * @param removed     jobs removed
 * @param added       jobs added
 * @param rescheduled jobs whose definition changed and were replaced
 * @param unchanged   jobs re-registered without any change
 */
public record ReconcileReport(Set<String> removed, Set<String> added, Set<String> rescheduled,
        Set<String> unchanged) {

    public static final ReconcileReport EMPTY = new ReconcileReport(Set.of(), Set.of(), Set.of(), Set.of());

    /** Number of job store mutations performed. */
    public int mutations() {
        return removed.size() + added.size() + rescheduled.size();
    }
}
