package taskclock.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.load.TimetableLoader;
import taskclock.model.Task;
import taskclock.model.Timetable;
import taskclock.scheduler.JobLookupException;
import taskclock.scheduler.TaskScheduler;
import taskclock.scheduler.TimetableRegistrar;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Brings the live schedule in line with the current content of a timetable.
 *
 * Jobs no longer in the timetable are removed, new tasks are added and tasks
 * present on both sides are re-registered. Re-registering an unchanged task
 * writes nothing, so reconciling twice without an edit mutates nothing.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final TimetableLoader loader;
    private final String source;
    private final TaskScheduler scheduler;
    private final TimetableRegistrar registrar;

    public Reconciler(TimetableLoader loader, String source, TaskScheduler scheduler, TimetableRegistrar registrar) {
        this.loader = loader;
        this.source = source;
        this.scheduler = scheduler;
        this.registrar = registrar;
    }

    /**
     * Reload the source and apply it. If the source cannot be loaded the live
     * schedule is left untouched.
     */
    public ReconcileReport reconcile() {
        Timetable fresh;
        try {
            fresh = loader.load(source);
        } catch (RuntimeException e) {
            log.error("Reloading {} failed, keeping the current schedule: {}", source, e.getMessage());
            return ReconcileReport.EMPTY;
        }
        return apply(fresh);
    }

    /**
     * Apply a timetable to the live schedule.
     */
    public ReconcileReport apply(Timetable timetable) {
        Map<String, Task> desired = new LinkedHashMap<>();
        for (Task task : timetable.enabledTasks()) {
            desired.put(task.id(), task);
        }
        // every trigger must evaluate before anything is changed
        for (Task task : desired.values()) {
            try {
                registrar.jobFor(task);
            } catch (RuntimeException e) {
                log.error("Task \"{}\" in {} is invalid, keeping the current schedule: {}",
                        task.id(), source, e.getMessage());
                return ReconcileReport.EMPTY;
            }
        }

        ReconcilePlan plan = ReconcilePlan.of(scheduler.jobIds(), desired.keySet());

        Set<String> removed = new TreeSet<>();
        for (String id : plan.toRemove()) {
            try {
                scheduler.removeJob(id);
                removed.add(id);
            } catch (JobLookupException e) {
                log.debug("Job \"{}\" was already gone", id);
            }
        }

        Set<String> added = new TreeSet<>();
        for (String id : plan.toAdd()) {
            if (registrar.register(desired.get(id))) {
                added.add(id);
            }
        }

        Set<String> rescheduled = new TreeSet<>();
        Set<String> unchanged = new TreeSet<>();
        for (String id : plan.toReschedule()) {
            if (registrar.register(desired.get(id))) {
                rescheduled.add(id);
            } else {
                unchanged.add(id);
            }
        }

        ReconcileReport report = new ReconcileReport(removed, added, rescheduled, unchanged);
        log.info("Reconciled {}: removed={} added={} rescheduled={} unchanged={}",
                source, removed, added, rescheduled, unchanged.size());
        return report;
    }

    public String source() {
        return source;
    }
}
