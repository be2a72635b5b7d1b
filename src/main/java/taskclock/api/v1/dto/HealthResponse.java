package taskclock.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("store") String store,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("jobs") Integer jobs) {

    public static HealthResponse healthy(String store, String uptime, boolean running, int jobs) {
        return new HealthResponse("healthy", store, uptime, running ? "running" : "stopped", jobs);
    }

    public static HealthResponse unhealthy(String store) {
        return new HealthResponse("unhealthy", store, null, null, null);
    }
}
