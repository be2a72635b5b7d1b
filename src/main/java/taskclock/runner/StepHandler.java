package taskclock.runner;

import taskclock.model.Step;

/**
 * Executes steps of one kind.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * @return a result to log, may be null
     */
    Object execute(Step step) throws Exception;
}
