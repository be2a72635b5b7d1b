package taskclock.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concurrency policy of a job.
 *
 * @param maxInstances maximum number of runs of the job in flight at once
 * @param coalesce     when true, missed fire times collapse into one run
 */
public record JobOptions(
        @JsonProperty("max_instances") int maxInstances,
        @JsonProperty("coalesce") boolean coalesce) {

    public static final int DEFAULT_MAX_INSTANCES = 1;
    public static final int TIMETABLE_MAX_INSTANCES = 10;

    public JobOptions {
        if (maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be at least 1, got " + maxInstances);
        }
    }

    /** Policy for jobs added directly: one run at a time, every missed slot runs. */
    public static JobOptions defaults() {
        return new JobOptions(DEFAULT_MAX_INSTANCES, false);
    }

    /** Policy for jobs registered from a timetable. */
    public static JobOptions forTimetable() {
        return new JobOptions(TIMETABLE_MAX_INSTANCES, false);
    }
}
