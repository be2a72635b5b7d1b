package taskclock.watch;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Three-way diff between the jobs that are live and the tasks a timetable wants.
 * Ids are kept in sorted order.
 *
 * @param toRemove     live but no longer desired
 * @param toAdd        desired but not live
 * @param toReschedule live and desired; re-registered with replace semantics
 */
public record ReconcilePlan(Set<String> toRemove, Set<String> toAdd, Set<String> toReschedule) {

    public static ReconcilePlan of(Set<String> liveIds, Set<String> desiredIds) {
        Set<String> remove = new TreeSet<>(liveIds);
        remove.removeAll(desiredIds);

        Set<String> add = new TreeSet<>(desiredIds);
        add.removeAll(liveIds);

        Set<String> reschedule = new TreeSet<>(desiredIds);
        reschedule.retainAll(liveIds);

        return new ReconcilePlan(Collections.unmodifiableSet(remove), Collections.unmodifiableSet(add),
                Collections.unmodifiableSet(reschedule));
    }
}
