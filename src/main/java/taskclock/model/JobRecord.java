package taskclock.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted form of a scheduled job as held by a job store.
 *
 * {@code triggerState} and {@code jobState} are opaque serialized documents
 * owned by the scheduler. {@code nextFireTime} is null while a job has no
 * remaining fire time. {@code lastRunAt} and {@code lastStatus} are run history.
 */
public final class JobRecord {
    private final String id;
    private final String name;
    private final String triggerState;
    private final Instant nextFireTime;
    private final String jobState;
    private final Instant lastRunAt;
    private final RunStatus lastStatus;

    private JobRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNullElse(builder.name, builder.id);
        this.triggerState = Objects.requireNonNull(builder.triggerState, "triggerState is required");
        this.jobState = Objects.requireNonNull(builder.jobState, "jobState is required");
        this.nextFireTime = builder.nextFireTime;
        this.lastRunAt = builder.lastRunAt;
        this.lastStatus = builder.lastStatus;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String triggerState() {
        return triggerState;
    }

    public Instant nextFireTime() {
        return nextFireTime;
    }

    public String jobState() {
        return jobState;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public RunStatus lastStatus() {
        return lastStatus;
    }

    /** True when both records describe the same job definition, ignoring timing and history. */
    public boolean sameDefinition(JobRecord other) {
        return other != null
                && id.equals(other.id)
                && name.equals(other.name)
                && triggerState.equals(other.triggerState)
                && jobState.equals(other.jobState);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .triggerState(triggerState)
                .nextFireTime(nextFireTime)
                .jobState(jobState)
                .lastRunAt(lastRunAt)
                .lastStatus(lastStatus);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String triggerState;
        private Instant nextFireTime;
        private String jobState;
        private Instant lastRunAt;
        private RunStatus lastStatus;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder triggerState(String triggerState) {
            this.triggerState = triggerState;
            return this;
        }

        public Builder nextFireTime(Instant nextFireTime) {
            this.nextFireTime = nextFireTime;
            return this;
        }

        public Builder jobState(String jobState) {
            this.jobState = jobState;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder lastStatus(RunStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord that))
            return false;
        return sameDefinition(that)
                && Objects.equals(nextFireTime, that.nextFireTime)
                && Objects.equals(lastRunAt, that.lastRunAt)
                && lastStatus == that.lastStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, triggerState, jobState, nextFireTime);
    }

    @Override
    public String toString() {
        return "JobRecord{id='" + id + "', next=" + nextFireTime + ", lastStatus=" + lastStatus + "}";
    }
}
