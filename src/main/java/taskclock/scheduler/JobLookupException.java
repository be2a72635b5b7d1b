package taskclock.scheduler;

public class JobLookupException extends RuntimeException {

    public JobLookupException(String jobId) {
        super("No job by the id of " + jobId + " was found");
    }
}
