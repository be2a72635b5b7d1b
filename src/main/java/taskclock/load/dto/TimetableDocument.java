package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Top level of a JSON or YAML timetable.
 */
public record TimetableDocument(
        @JsonProperty("meta") Map<String, Object> meta,
        @JsonProperty("tasks") List<TaskDocument> tasks) {
}
