package taskclock.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskclock.model.Step;
import taskclock.runner.StepKind;
import taskclock.scheduler.ScheduledJob;

import java.time.Instant;
import java.util.List;

/**
 * Runtime view of a scheduled job.
 * GET /api/v1/jobs, GET /api/v1/jobs/{id}
 *
 * {@code exec_ref} and {@code exec_args} describe the first non-SQL step,
 * {@code exec_sql} the first SQL step. Several cron expressions are joined
 * with {@code "; "} in {@code trigger_cron}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("trigger_cron") String triggerCron,
        @JsonProperty("exec_ref") String execRef,
        @JsonProperty("exec_args") List<Object> execArgs,
        @JsonProperty("exec_sql") String execSql,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("next_run") Instant nextRun,
        @JsonProperty("last_run") Instant lastRun,
        @JsonProperty("last_status") String lastStatus) {

    public static JobView from(ScheduledJob job) {
        Step exec = null;
        Step sql = null;
        for (Step step : job.task().steps()) {
            if (StepKind.SQL.tag().equals(step.uses())) {
                if (sql == null) {
                    sql = step;
                }
            } else if (exec == null) {
                exec = step;
            }
        }
        return new JobView(
                job.id(),
                job.name(),
                String.join("; ", job.trigger().expressions()),
                exec != null ? exec.run() : null,
                exec != null && !exec.args().isEmpty() ? exec.args() : null,
                sql != null ? sql.run() : null,
                job.task().enabled(),
                job.nextFireTime(),
                job.lastRunAt(),
                job.lastStatus() != null ? job.lastStatus().name() : null);
    }
}
