package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code on} section of a task.
 */
public record TriggerDocument(@JsonProperty("schedule") List<ScheduleDocument> schedule) {

    public record ScheduleDocument(@JsonProperty("cron") String cron) {
    }
}
