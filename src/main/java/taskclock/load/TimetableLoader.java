package taskclock.load;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.load.dto.ScriptTaskDocument;
import taskclock.load.dto.TaskDocument;
import taskclock.load.dto.TimetableDocument;
import taskclock.model.ExecutionLane;
import taskclock.model.ScheduleItem;
import taskclock.model.Step;
import taskclock.model.Task;
import taskclock.model.TaskMetadata;
import taskclock.model.Timetable;
import taskclock.model.ValidationException;
import taskclock.runner.StepKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a timetable from a JSON, YAML or embedded-script document.
 *
 * The format is chosen by the source's suffix. Sources are local paths or
 * URLs ({@code http://}, {@code https://}, {@code file:}).
 */
public class TimetableLoader {

    private static final Logger log = LoggerFactory.getLogger(TimetableLoader.class);

    /** Task id given to the single task of an embedded-script timetable. */
    public static final String SCRIPT_TASK_ID = "script";
    /** Timetable metadata key holding an embedded script's environment. */
    public static final String ENV_ATTRIBUTE = "env";

    enum Format {
        JSON, YAML, SCRIPT
    }

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final TomlMapper tomlMapper;

    public TimetableLoader() {
        this.jsonMapper = configure(new ObjectMapper());
        // YAML mapping keys are always field names, so `on` is never read as a boolean
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
        this.tomlMapper = new TomlMapper();
        this.tomlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Load a timetable.
     *
     * @throws UnsupportedFormatException if the suffix is not recognized
     * @throws ValidationException        if the document is malformed
     * @throws UncheckedIOException       if the source cannot be read
     */
    public Timetable load(String source) {
        if (source == null || source.isBlank()) {
            throw new ValidationException("Timetable source must not be empty");
        }
        Format format = formatOf(source);
        log.info("Loading task(s) from file. Source: {}", source);

        String content = read(source);
        Timetable timetable = switch (format) {
            case JSON -> fromDocument(parse(jsonMapper, content, source), source);
            case YAML -> fromDocument(parse(yamlMapper, content, source), source);
            case SCRIPT -> fromScript(content, source);
        };
        log.debug("Loaded {}", timetable);
        return timetable;
    }

    static Format formatOf(String source) {
        String path = source;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return Format.JSON;
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return Format.YAML;
        }
        if (lower.endsWith(".sh") || lower.endsWith(".py") || lower.endsWith(".java")) {
            return Format.SCRIPT;
        }
        throw new UnsupportedFormatException(source);
    }

    static boolean isUrl(String source) {
        return source.matches("^[a-zA-Z][a-zA-Z0-9+.-]*://.*") || source.startsWith("file:");
    }

    private static String read(String source) {
        try {
            if (isUrl(source)) {
                try (InputStream in = new URL(source).openStream()) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read timetable: " + source, e);
        }
    }

    private static TimetableDocument parse(ObjectMapper mapper, String content, String source) {
        try {
            TimetableDocument document = mapper.readValue(content, TimetableDocument.class);
            if (document == null) {
                throw new ValidationException("Timetable is empty: " + source);
            }
            return document;
        } catch (IOException e) {
            throw new ValidationException("Malformed timetable " + source + ": " + e.getMessage(), e);
        }
    }

    private static Timetable fromDocument(TimetableDocument document, String source) {
        List<Task> tasks = new ArrayList<>();
        if (document.tasks() != null) {
            for (TaskDocument task : document.tasks()) {
                if (task == null) {
                    throw new ValidationException("Empty task entry in " + source);
                }
                tasks.add(task.toModel());
            }
        }
        return Timetable.of(document.meta(), tasks, source);
    }

    private Timetable fromScript(String content, String source) {
        String block = ScriptMetadataReader.read("task", content)
                .orElseThrow(() -> new ValidationException("No '/// task' block found in " + source));
        ScriptTaskDocument document;
        try {
            document = tomlMapper.readValue(block, ScriptTaskDocument.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed '/// task' block in " + source + ": " + e.getMessage(), e);
        }
        if (document == null || document.cron() == null) {
            throw new ValidationException("The '/// task' block in " + source + " does not declare 'cron'");
        }

        String stem = stem(source);
        Map<String, String> env = document.env() != null ? document.env() : Map.of();
        Step step = new Step(stem, StepKind.SCRIPT_FILE.tag(), source, List.of(), document.options(), true, env);
        Task task = new Task(
                new TaskMetadata(SCRIPT_TASK_ID, stem, "Embedded task of " + stem, true),
                List.of(new ScheduleItem(document.cron())),
                List.of(step),
                ExecutionLane.PROCESS);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ENV_ATTRIBUTE, env);
        return Timetable.of(meta, List.of(task), source);
    }

    private static String stem(String source) {
        String name = source;
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
