package taskclock.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The full set of task definitions loaded from one document.
 *
 * A fresh instance is built on every load; instances are never modified.
 * Two metadata keys are reserved: {@value #SOURCE_ATTRIBUTE} holds where the
 * timetable was loaded from, {@value #NAMESPACE_ATTRIBUTE} scopes its jobs in
 * a shared job store and is derived when the document does not supply one.
 */
public final class Timetable {

    public static final String SOURCE_ATTRIBUTE = "taskfile";
    public static final String NAMESPACE_ATTRIBUTE = "namespace";

    private final Map<String, Object> metadata;
    private final List<Task> tasks;

    private Timetable(Map<String, Object> metadata, List<Task> tasks) {
        this.metadata = Collections.unmodifiableMap(metadata);
        this.tasks = List.copyOf(tasks);
    }

    /**
     * Build a timetable, recording the source and deriving the namespace if absent.
     *
     * @throws ValidationException if two tasks share an id
     */
    public static Timetable of(Map<String, Object> metadata, List<Task> tasks, String source) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (metadata != null) {
            meta.putAll(metadata);
        }
        if (source != null) {
            meta.put(SOURCE_ATTRIBUTE, source);
        }
        Object namespace = meta.get(NAMESPACE_ATTRIBUTE);
        if (namespace == null || namespace.toString().isBlank()) {
            Object resource = meta.get(SOURCE_ATTRIBUTE);
            meta.put(NAMESPACE_ATTRIBUTE, Namespaces.forSource(resource != null ? resource.toString() : null));
        }

        List<Task> taskList = tasks != null ? tasks : List.of();
        Set<String> seen = new HashSet<>();
        for (Task task : taskList) {
            if (!seen.add(task.id())) {
                throw new ValidationException("Duplicate task id in timetable: " + task.id());
            }
        }
        return new Timetable(meta, taskList);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public List<Task> tasks() {
        return tasks;
    }

    public List<Task> enabledTasks() {
        return tasks.stream().filter(Task::enabled).toList();
    }

    public String namespace() {
        return metadata.get(NAMESPACE_ATTRIBUTE).toString();
    }

    public Optional<String> source() {
        return Optional.ofNullable(metadata.get(SOURCE_ATTRIBUTE)).map(Object::toString);
    }

    @Override
    public String toString() {
        return "Timetable{source=" + source().orElse("-") + ", namespace=" + namespace()
                + ", tasks=" + tasks.size() + "}";
    }
}
