package taskclock.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import taskclock.load.dto.TaskDocument;
import taskclock.model.JobRecord;
import taskclock.model.Task;
import taskclock.trigger.JobTrigger;

import java.time.ZoneId;
import java.util.List;

/**
 * Converts between {@link ScheduledJob} and the {@link JobRecord} a job store
 * persists. Trigger and job state are stored as JSON documents.
 */
public class JobCodec {

    record TriggerState(
            @JsonProperty("cron") List<String> cron,
            @JsonProperty("timezone") String timezone) {
    }

    record JobStateDocument(
            @JsonProperty("task") TaskDocument task,
            @JsonProperty("options") JobOptions options) {
    }

    private final ObjectMapper mapper;

    public JobCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.findAndRegisterModules();
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public JobRecord encode(ScheduledJob job) {
        try {
            String triggerState = mapper.writeValueAsString(
                    new TriggerState(job.trigger().expressions(), job.trigger().zone().getId()));
            String jobState = mapper.writeValueAsString(
                    new JobStateDocument(TaskDocument.from(job.task()), job.options()));
            return JobRecord.builder()
                    .id(job.id())
                    .name(job.name())
                    .triggerState(triggerState)
                    .nextFireTime(job.nextFireTime())
                    .jobState(jobState)
                    .lastRunAt(job.lastRunAt())
                    .lastStatus(job.lastStatus())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job: " + job.id(), e);
        }
    }

    /**
     * @throws IllegalStateException if the stored state cannot be read back
     */
    public ScheduledJob decode(JobRecord record) {
        try {
            TriggerState triggerState = mapper.readValue(record.triggerState(), TriggerState.class);
            JobStateDocument jobState = mapper.readValue(record.jobState(), JobStateDocument.class);
            Task task = jobState.task().toModel();
            JobTrigger trigger = JobTrigger.of(triggerState.cron(), ZoneId.of(triggerState.timezone()));
            JobOptions options = jobState.options() != null ? jobState.options() : JobOptions.defaults();
            return new ScheduledJob(record.id(), record.name(), task, trigger, options,
                    record.nextFireTime(), record.lastRunAt(), record.lastStatus());
        } catch (JsonProcessingException | RuntimeException e) {
            throw new IllegalStateException("Failed to restore job: " + record.id(), e);
        }
    }
}
