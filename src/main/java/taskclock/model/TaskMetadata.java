package taskclock.model;

/**
 * Identity and description of a task. The id is unique within a namespace.
 */
public record TaskMetadata(String id, String name, String description, boolean enabled) {

    public TaskMetadata {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Task id must not be empty");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
    }
}
