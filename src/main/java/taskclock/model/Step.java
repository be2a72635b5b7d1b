package taskclock.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One executable unit of a task.
 *
 * @param name      display name, used in logs
 * @param uses      step-kind tag selecting the handler
 * @param run       reference the handler resolves (callable name, script path, SQL)
 * @param args      positional arguments
 * @param kwargs    keyword arguments, in document order
 * @param condition when false the step is skipped at run time
 * @param env       extra environment for steps that spawn processes
 */
public record Step(
        String name,
        String uses,
        String run,
        List<Object> args,
        Map<String, Object> kwargs,
        boolean condition,
        Map<String, String> env) {

    public Step {
        if (uses == null || uses.isBlank()) {
            throw new ValidationException("Step '" + name + "' does not declare 'uses'");
        }
        if (run == null || run.isBlank()) {
            throw new ValidationException("Step '" + name + "' does not declare 'run'");
        }
        if (name == null || name.isBlank()) {
            name = run;
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    }

    public Step(String name, String uses, String run, List<Object> args, Map<String, Object> kwargs, boolean condition) {
        this(name, uses, run, args, kwargs, condition, Map.of());
    }
}
