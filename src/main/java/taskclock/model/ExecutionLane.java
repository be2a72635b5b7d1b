package taskclock.model;

import java.util.Locale;

/**
 * Executor a task's runs are dispatched to.
 */
public enum ExecutionLane {
    /** Bounded worker threads for short, I/O-bound steps. */
    THREAD,
    /** Bounded workers for CPU-bound or isolation-sensitive steps. */
    PROCESS;

    public static ExecutionLane fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return THREAD;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown execution lane: " + tag);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
