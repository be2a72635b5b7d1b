package taskclock.runner;

/**
 * A step's {@code uses} tag names no known step kind.
 */
public class UnknownStepKindException extends RuntimeException {

    private final String tag;

    public UnknownStepKindException(String tag) {
        super("Unknown step kind: " + tag);
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
