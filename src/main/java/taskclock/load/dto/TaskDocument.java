package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskclock.model.ExecutionLane;
import taskclock.model.ScheduleItem;
import taskclock.model.Step;
import taskclock.model.Task;
import taskclock.model.ValidationException;

import java.util.List;

/**
 * Document form of a task, used both when loading timetables and when
 * persisting a job's task into the job store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskDocument(
        @JsonProperty("meta") TaskMetaDocument meta,
        @JsonProperty("on") TriggerDocument on,
        @JsonProperty("steps") List<StepDocument> steps,
        @JsonProperty("lane") String lane) {

    public Task toModel() {
        if (meta == null) {
            throw new ValidationException("Task is missing its 'meta' section");
        }
        if (on == null || on.schedule() == null) {
            throw new ValidationException("Task '" + meta.id() + "' is missing 'on.schedule'");
        }
        List<ScheduleItem> triggers = on.schedule().stream()
                .map(item -> new ScheduleItem(item == null ? null : item.cron()))
                .toList();
        List<Step> stepList = steps == null ? List.of() : steps.stream().map(StepDocument::toModel).toList();
        return new Task(meta.toModel(), triggers, stepList, ExecutionLane.fromTag(lane));
    }

    public static TaskDocument from(Task task) {
        List<TriggerDocument.ScheduleDocument> schedule = task.triggers().stream()
                .map(item -> new TriggerDocument.ScheduleDocument(item.cron()))
                .toList();
        return new TaskDocument(
                TaskMetaDocument.from(task.meta()),
                new TriggerDocument(schedule),
                task.steps().stream().map(StepDocument::from).toList(),
                task.lane().tag());
    }
}
