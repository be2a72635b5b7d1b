package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * TOML content of an embedded {@code /// task} block.
 */
public record ScriptTaskDocument(
        @JsonProperty("cron") String cron,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("options") Map<String, Object> options) {
}
