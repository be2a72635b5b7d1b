package taskclock.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named functions that {@code entrypoint} steps can call. Populated at
 * startup; steps refer to entries by name.
 */
public class CallableRegistry {

    private static final Logger log = LoggerFactory.getLogger(CallableRegistry.class);

    public static final String LOG = "builtin:log";
    public static final String SLEEP = "builtin:sleep";

    private final Map<String, StepCallable> callables = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in callables:
     * {@value #LOG} logs its arguments,
     * {@value #SLEEP} sleeps for {@code seconds} plus {@code jitter} seconds.
     */
    public static CallableRegistry withBuiltins() {
        return new CallableRegistry()
                .register(LOG, CallableRegistry::logArguments)
                .register(SLEEP, CallableRegistry::sleep);
    }

    public CallableRegistry register(String name, StepCallable callable) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Callable name must not be empty");
        }
        callables.put(name, callable);
        return this;
    }

    /**
     * @throws UnresolvedReferenceException if nothing is registered under the name
     */
    public StepCallable resolve(String name) {
        StepCallable callable = name != null ? callables.get(name) : null;
        if (callable == null) {
            throw new UnresolvedReferenceException(name);
        }
        return callable;
    }

    public Set<String> names() {
        return new TreeSet<>(callables.keySet());
    }

    private static Object logArguments(List<Object> args, Map<String, Object> kwargs) {
        log.info("args={} kwargs={}", args, kwargs);
        return null;
    }

    private static Object sleep(List<Object> args, Map<String, Object> kwargs) throws InterruptedException {
        double seconds = number(kwargs.get("seconds")) + number(kwargs.get("jitter"));
        log.info("Sleeping for {} seconds", seconds);
        Thread.sleep((long) (seconds * 1000));
        return seconds;
    }

    private static double number(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }
}
