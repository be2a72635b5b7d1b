package taskclock.scheduler;

import taskclock.model.RunStatus;
import taskclock.model.Task;
import taskclock.trigger.JobTrigger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A task bound to its trigger and concurrency policy, as the scheduler sees it.
 *
 * @param nextFireTime null before the job is scheduled or once its trigger is exhausted
 * @param lastRunAt    completion time of the last run, if any
 * @param lastStatus   outcome of the last run, if any
 */
public record ScheduledJob(
        String id,
        String name,
        Task task,
        JobTrigger trigger,
        JobOptions options,
        Instant nextFireTime,
        Instant lastRunAt,
        RunStatus lastStatus) {

    public ScheduledJob {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(task, "task is required");
        Objects.requireNonNull(trigger, "trigger is required");
        Objects.requireNonNull(options, "options is required");
        if (name == null || name.isBlank()) {
            name = id;
        }
    }

    /**
     * Job for a task, fired by all of the task's cron schedules.
     *
     * @throws taskclock.trigger.InvalidTriggerSyntaxException if a schedule cannot be evaluated
     */
    public static ScheduledJob forTask(Task task, ZoneId zone, JobOptions options) {
        JobTrigger trigger = JobTrigger.of(task.cronExpressions(), zone);
        return new ScheduledJob(task.id(), task.meta().name(), task, trigger, options, null, null, null);
    }

    public ScheduledJob withNextFireTime(Instant next) {
        return new ScheduledJob(id, name, task, trigger, options, next, lastRunAt, lastStatus);
    }
}
