package taskclock.scheduler;

public class ConflictingIdException extends RuntimeException {

    public ConflictingIdException(String jobId) {
        super("Job identifier (" + jobId + ") conflicts with an existing job");
    }
}
