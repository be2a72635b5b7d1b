package taskclock.runner;

/**
 * A step's {@code run} reference names no registered callable.
 */
public class UnresolvedReferenceException extends RuntimeException {

    private final String reference;

    public UnresolvedReferenceException(String reference) {
        super("Unable to resolve reference: " + reference);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
