package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskclock.model.TaskMetadata;

public record TaskMetaDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled) {

    public TaskMetadata toModel() {
        return new TaskMetadata(id, name, description, enabled == null || enabled);
    }

    public static TaskMetaDocument from(TaskMetadata meta) {
        return new TaskMetaDocument(meta.id(), meta.name(), meta.description(), meta.enabled());
    }
}
