package taskclock.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.Step;
import taskclock.model.Task;
import taskclock.scheduler.TaskInvoker;

import java.util.EnumMap;
import java.util.Map;

/**
 * Executes a task's steps in order on the calling thread.
 *
 * Steps whose condition is false are logged and skipped. The first failing
 * step aborts the run; the remaining steps are not executed.
 */
public class StepRunner implements TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final Map<StepKind, StepHandler> handlers;

    public StepRunner(Map<StepKind, StepHandler> handlers) {
        this.handlers = new EnumMap<>(StepKind.class);
        this.handlers.putAll(handlers);
    }

    /**
     * Runner with a handler for every step kind.
     */
    public static StepRunner withDefaults(CallableRegistry registry) {
        Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);
        handlers.put(StepKind.ENTRYPOINT, new EntrypointStepHandler(registry));
        handlers.put(StepKind.SCRIPT_FILE, new ScriptFileStepHandler());
        handlers.put(StepKind.SQL, new SqlStepHandler());
        return new StepRunner(handlers);
    }

    @Override
    public void invoke(Task task) {
        run(task);
    }

    /**
     * @throws UnknownStepKindException      if a step's kind has no handler
     * @throws UnresolvedReferenceException  if an entrypoint reference is not registered
     * @throws StepExecutionException        if a step fails
     */
    public void run(Task task) {
        for (Step step : task.steps()) {
            if (!step.condition()) {
                log.info("Skipping step \"{}\" of task \"{}\": condition is false", step.name(), task.id());
                continue;
            }
            StepKind kind = StepKind.fromTag(step.uses());
            StepHandler handler = handlers.get(kind);
            if (handler == null) {
                throw new UnknownStepKindException(step.uses());
            }

            log.info("Invoking step \"{}\" of task \"{}\" ({}: {})", step.name(), task.id(), kind.tag(), step.run());
            Object result;
            try {
                result = handler.execute(step);
            } catch (UnresolvedReferenceException | UnknownStepKindException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException(task.id(), step.name(), e);
            } catch (Exception e) {
                throw new StepExecutionException(task.id(), step.name(), e);
            }
            log.info("Step \"{}\" of task \"{}\" finished, result: {}", step.name(), task.id(), result);
        }
    }
}
