package taskclock.scheduler;

/**
 * Lifecycle of a job: PENDING, then SCHEDULED, passing through FIRING on each
 * trigger, until REMOVED. REMOVED is terminal.
 */
public enum JobState {
    /** Added before the scheduler started; not yet in the job store. */
    PENDING,
    SCHEDULED,
    /** The trigger loop is dispatching runs for the job. */
    FIRING,
    REMOVED
}
