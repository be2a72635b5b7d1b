package taskclock.trigger;

import taskclock.model.ValidationException;

/**
 * Raised when a cron expression cannot be decoded or evaluated.
 * The message always carries the offending expression verbatim.
 */
public class InvalidTriggerSyntaxException extends ValidationException {

    private final String expression;

    public InvalidTriggerSyntaxException(String expression) {
        super("Invalid crontab syntax: " + expression);
        this.expression = expression;
    }

    public InvalidTriggerSyntaxException(String expression, Throwable cause) {
        super("Invalid crontab syntax: " + expression, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
