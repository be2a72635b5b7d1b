package taskclock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.config.ConfigurationException;
import taskclock.model.Task;
import taskclock.model.Timetable;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Turns timetable tasks into scheduler jobs. Registration always replaces an
 * existing job with the same id, which is a no-op when nothing changed.
 */
public class TimetableRegistrar {

    private static final Logger log = LoggerFactory.getLogger(TimetableRegistrar.class);

    private final TaskScheduler scheduler;
    private final ZoneId zone;
    private final JobOptions options;

    public TimetableRegistrar(TaskScheduler scheduler, ZoneId zone) {
        this(scheduler, zone, JobOptions.forTimetable());
    }

    public TimetableRegistrar(TaskScheduler scheduler, ZoneId zone, JobOptions options) {
        if (scheduler == null) {
            throw new ConfigurationException("Unable to register tasks without a scheduler");
        }
        this.scheduler = scheduler;
        this.zone = Objects.requireNonNull(zone, "zone is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Build the job for a task without scheduling it.
     *
     * @throws taskclock.trigger.InvalidTriggerSyntaxException if a schedule cannot be evaluated
     */
    public ScheduledJob jobFor(Task task) {
        return ScheduledJob.forTask(task, zone, options);
    }

    /**
     * Schedule one task.
     *
     * @return true if the store was changed
     */
    public boolean register(Task task) {
        log.info("Registering task \"{}\" ({})", task.id(), task.meta().name());
        return scheduler.addJob(jobFor(task), true);
    }

    /**
     * Schedule every enabled task of the timetable.
     *
     * @return number of tasks registered
     */
    public int registerAll(Timetable timetable) {
        int registered = 0;
        for (Task task : timetable.tasks()) {
            if (!task.enabled()) {
                log.info("Skipping disabled task \"{}\"", task.id());
                continue;
            }
            register(task);
            registered++;
        }
        log.info("Registered {} task(s) from {}", registered, timetable.source().orElse("timetable"));
        return registered;
    }

    public ZoneId zone() {
        return zone;
    }
}
