package taskclock.model;

import java.util.List;
import java.util.Objects;

/**
 * One schedulable unit: metadata, at least one trigger and at least one step.
 * Immutable; a changed definition arrives as a new instance through a reload.
 */
public record Task(TaskMetadata meta, List<ScheduleItem> triggers, List<Step> steps, ExecutionLane lane) {

    public Task {
        if (meta == null) {
            throw new ValidationException("Task metadata is missing");
        }
        if (triggers == null || triggers.isEmpty()) {
            throw new ValidationException("Task '" + meta.id() + "' has no triggers");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("Task '" + meta.id() + "' has no steps");
        }
        triggers = List.copyOf(triggers);
        steps = List.copyOf(steps);
        lane = Objects.requireNonNullElse(lane, ExecutionLane.THREAD);
    }

    public Task(TaskMetadata meta, List<ScheduleItem> triggers, List<Step> steps) {
        this(meta, triggers, steps, ExecutionLane.THREAD);
    }

    public String id() {
        return meta.id();
    }

    public boolean enabled() {
        return meta.enabled();
    }

    public List<String> cronExpressions() {
        return triggers.stream().map(ScheduleItem::cron).toList();
    }
}
