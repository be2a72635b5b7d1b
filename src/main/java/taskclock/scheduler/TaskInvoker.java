package taskclock.scheduler;

import taskclock.model.Task;

/**
 * Executes a task when its job fires.
 */
@FunctionalInterface
public interface TaskInvoker {

    /**
     * Run the task to completion on the calling thread.
     *
     * @throws RuntimeException if the run fails
     */
    void invoke(Task task);
}
