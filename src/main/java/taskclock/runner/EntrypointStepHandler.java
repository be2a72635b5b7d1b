package taskclock.runner;

import taskclock.model.Step;

/**
 * Calls the registered function named by the step's {@code run} reference.
 */
public class EntrypointStepHandler implements StepHandler {

    private final CallableRegistry registry;

    public EntrypointStepHandler(CallableRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Object execute(Step step) throws Exception {
        return registry.resolve(step.run()).call(step.args(), step.kwargs());
    }
}
