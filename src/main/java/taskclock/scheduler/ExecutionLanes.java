package taskclock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.ExecutionLane;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The two bounded worker pools job runs are dispatched to.
 */
public class ExecutionLanes implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLanes.class);

    public static final int DEFAULT_THREAD_WORKERS = 20;
    public static final int DEFAULT_PROCESS_WORKERS = 5;

    private final ExecutorService threadLane;
    private final ExecutorService processLane;

    public ExecutionLanes() {
        this(DEFAULT_THREAD_WORKERS, DEFAULT_PROCESS_WORKERS);
    }

    public ExecutionLanes(int threadWorkers, int processWorkers) {
        this.threadLane = Executors.newFixedThreadPool(threadWorkers, named("taskclock-thread"));
        this.processLane = Executors.newFixedThreadPool(processWorkers, named("taskclock-process"));
        log.info("Execution lanes ready: thread={} process={}", threadWorkers, processWorkers);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * @throws java.util.concurrent.RejectedExecutionException after shutdown
     */
    public Future<?> submit(ExecutionLane lane, Runnable run) {
        return executor(lane).submit(run);
    }

    private ExecutorService executor(ExecutionLane lane) {
        return lane == ExecutionLane.PROCESS ? processLane : threadLane;
    }

    /**
     * Stop accepting runs. With {@code wait}, block until in-flight runs finish;
     * running work is never interrupted.
     */
    public void shutdown(boolean wait) {
        threadLane.shutdown();
        processLane.shutdown();
        if (!wait) {
            return;
        }
        try {
            while (!threadLane.awaitTermination(5, TimeUnit.SECONDS)) {
                log.info("Waiting for running jobs on the thread lane to finish");
            }
            while (!processLane.awaitTermination(5, TimeUnit.SECONDS)) {
                log.info("Waiting for running jobs on the process lane to finish");
            }
            log.info("Execution lanes stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running jobs");
        }
    }

    @Override
    public void close() {
        shutdown(true);
    }
}
