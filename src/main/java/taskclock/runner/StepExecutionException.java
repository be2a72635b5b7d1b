package taskclock.runner;

/**
 * A step failed. Remaining steps of the same run are not executed.
 */
public class StepExecutionException extends RuntimeException {

    private final String taskId;
    private final String stepName;

    public StepExecutionException(String taskId, String stepName, Throwable cause) {
        super("Step \"" + stepName + "\" of task \"" + taskId + "\" failed: " + cause.getMessage(), cause);
        this.taskId = taskId;
        this.stepName = stepName;
    }

    public StepExecutionException(String message) {
        super(message);
        this.taskId = null;
        this.stepName = null;
    }

    public String taskId() {
        return taskId;
    }

    public String stepName() {
        return stepName;
    }
}
