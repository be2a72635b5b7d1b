package taskclock.runner;

import java.util.List;
import java.util.Map;

/**
 * A function that {@code entrypoint} steps can call by name.
 */
@FunctionalInterface
public interface StepCallable {

    Object call(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
