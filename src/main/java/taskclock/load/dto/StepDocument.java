package taskclock.load.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskclock.model.Step;

import java.util.List;
import java.util.Map;

/**
 * Document form of a step. The condition is spelled {@code if} in documents.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StepDocument(
        @JsonProperty("name") String name,
        @JsonProperty("uses") String uses,
        @JsonProperty("run") String run,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("if") Boolean condition,
        @JsonProperty("env") Map<String, String> env) {

    public Step toModel() {
        return new Step(name, uses, run, args, kwargs, condition == null || condition, env);
    }

    public static StepDocument from(Step step) {
        return new StepDocument(step.name(), step.uses(), step.run(), step.args(), step.kwargs(),
                step.condition() ? null : Boolean.FALSE, step.env());
    }
}
