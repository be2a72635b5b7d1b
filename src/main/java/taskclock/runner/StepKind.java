package taskclock.runner;

/**
 * Closed set of step kinds, selected by a step's {@code uses} tag.
 */
public enum StepKind {
    /** Call a function registered in the {@link CallableRegistry}. */
    ENTRYPOINT("entrypoint"),
    /** Run a script file as a child process. */
    SCRIPT_FILE("script-file"),
    /** Execute a SQL statement over JDBC. */
    SQL("sql");

    private final String tag;

    StepKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * @throws UnknownStepKindException if no kind has the tag
     */
    public static StepKind fromTag(String tag) {
        for (StepKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new UnknownStepKindException(tag);
    }
}
