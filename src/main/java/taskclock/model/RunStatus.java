package taskclock.model;

/**
 * Outcome of the last completed run of a job.
 */
public enum RunStatus {
    SUCCESS,
    FAILED
}
