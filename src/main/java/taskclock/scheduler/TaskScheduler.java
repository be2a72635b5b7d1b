package taskclock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.JobRecord;
import taskclock.model.RunStatus;
import taskclock.repository.JobStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Trigger engine. Keeps jobs in a {@link JobStore} and dispatches their runs
 * to {@link ExecutionLanes} when they come due.
 *
 * Jobs added before {@link #start()} wait in memory as pending jobs and are
 * written to the store when the scheduler starts. All mutations of one job id
 * (add, replace, remove, firing bookkeeping) run under that id's lock; ids
 * share a fixed set of lock stripes.
 *
 * Each firing of a job is one instance: the run times it covers, every missed
 * time or only the latest when the job coalesces, run one after another on the
 * job's lane. A firing is skipped when the job already has
 * {@code maxInstances} instances running.
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /** Upper bound of missed runs dispatched for one job in one tick. */
    static final int MAX_CATCH_UP_RUNS = 10_000;

    /** Removed ids remembered for {@link #jobState}. */
    static final int MAX_TOMBSTONES = 1024;

    private static final int LOCK_STRIPES = 64;

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(500);

    private record PendingJob(ScheduledJob job, boolean replaceExisting) {
    }

    private final JobStore store;
    private final JobCodec codec;
    private final TaskInvoker invoker;
    private final ExecutionLanes lanes;
    private final Clock clock;
    private final Duration tickInterval;
    private final ScheduledExecutorService loop;

    private final Object schedulerLock = new Object();
    // guarded by schedulerLock
    private final Map<String, PendingJob> pending = new LinkedHashMap<>();
    private final Object[] jobLocks = new Object[LOCK_STRIPES];
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Set<String> firing = ConcurrentHashMap.newKeySet();
    private final Set<String> removed = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > MAX_TOMBSTONES;
                }
            }));

    private volatile boolean running = false;
    private volatile boolean shutdown = false;

    public TaskScheduler(JobStore store, TaskInvoker invoker, ExecutionLanes lanes) {
        this(store, new JobCodec(), invoker, lanes, Clock.systemUTC(), DEFAULT_TICK_INTERVAL);
    }

    public TaskScheduler(JobStore store, JobCodec codec, TaskInvoker invoker, ExecutionLanes lanes,
            Clock clock, Duration tickInterval) {
        this.store = store;
        this.codec = codec;
        this.invoker = invoker;
        this.lanes = lanes;
        this.clock = clock;
        this.tickInterval = tickInterval;
        for (int i = 0; i < jobLocks.length; i++) {
            jobLocks[i] = new Object();
        }
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskclock-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Add a job, or replace the job with the same id.
     *
     * @return false when an identical job was already scheduled and nothing was written
     * @throws ConflictingIdException if the id exists and {@code replaceExisting} is false
     */
    public boolean addJob(ScheduledJob job, boolean replaceExisting) {
        synchronized (schedulerLock) {
            if (shutdown) {
                throw new IllegalStateException("Scheduler has been shut down");
            }
            if (!running) {
                if (pending.containsKey(job.id()) && !replaceExisting) {
                    throw new ConflictingIdException(job.id());
                }
                pending.put(job.id(), new PendingJob(job, replaceExisting));
                removed.remove(job.id());
                log.info("Adding job tentatively -- it will be properly scheduled when the scheduler starts: {}",
                        job.id());
                return true;
            }
        }

        synchronized (lockFor(job.id())) {
            Optional<JobRecord> existing = store.get(job.id());
            if (existing.isPresent() && !replaceExisting) {
                throw new ConflictingIdException(job.id());
            }
            return write(job, existing, clock.instant());
        }
    }

    /** Caller holds the job's lock. */
    private boolean write(ScheduledJob job, Optional<JobRecord> existing, Instant now) {
        Optional<Instant> next = job.trigger().nextFireTime(now);
        JobRecord candidate = codec.encode(job.withNextFireTime(next.orElse(null)));

        if (existing.isPresent()) {
            JobRecord current = existing.get();
            if (current.sameDefinition(candidate)) {
                log.debug("Job \"{}\" is unchanged", job.id());
                return false;
            }
            candidate = candidate.toBuilder()
                    .lastRunAt(current.lastRunAt())
                    .lastStatus(current.lastStatus())
                    .build();
        }
        if (next.isEmpty()) {
            log.warn("Job \"{}\" has no future fire times and is not scheduled", job.id());
            if (existing.isPresent()) {
                store.remove(job.id());
                forget(job.id());
                return true;
            }
            return false;
        }

        store.put(candidate);
        removed.remove(job.id());
        log.info("{} job \"{}\" (trigger: {}, next run at: {})",
                existing.isPresent() ? "Replaced" : "Added", job.id(), job.trigger(), next.get());
        return true;
    }

    /**
     * Remove a job. Removal is terminal: adding the same id later creates a new job.
     *
     * @throws JobLookupException if no such job exists
     */
    public void removeJob(String jobId) {
        synchronized (schedulerLock) {
            if (!running) {
                if (pending.remove(jobId) != null) {
                    forget(jobId);
                    log.info("Removed pending job \"{}\"", jobId);
                    return;
                }
                if (!store.get(jobId).isPresent()) {
                    throw new JobLookupException(jobId);
                }
            }
        }

        synchronized (lockFor(jobId)) {
            if (!store.remove(jobId)) {
                throw new JobLookupException(jobId);
            }
            forget(jobId);
            log.info("Removed job \"{}\"", jobId);
        }
    }

    /**
     * Start scheduling: write all pending jobs and begin the trigger loop.
     * A stored job with an identical definition, left by an earlier process,
     * is kept as it is, so its missed fire times are caught up.
     */
    public void start() {
        synchronized (schedulerLock) {
            if (shutdown) {
                throw new IllegalStateException("Scheduler has been shut down");
            }
            if (running) {
                log.warn("Scheduler already running");
                return;
            }

            Instant now = clock.instant();
            for (PendingJob entry : pending.values()) {
                ScheduledJob job = entry.job();
                synchronized (lockFor(job.id())) {
                    Optional<JobRecord> existing = store.get(job.id());
                    if (existing.isPresent() && !entry.replaceExisting()) {
                        log.warn("Not scheduling job \"{}\": {}", job.id(),
                                new ConflictingIdException(job.id()).getMessage());
                        continue;
                    }
                    write(job, existing, now);
                }
            }
            int count = pending.size();
            pending.clear();
            running = true;

            loop.scheduleWithFixedDelay(
                    wrapRunnable("trigger-loop", this::processDueJobs),
                    0,
                    tickInterval.toMillis(),
                    TimeUnit.MILLISECONDS);
            log.info("Scheduler started ({} pending jobs scheduled, tick every {}ms)", count,
                    tickInterval.toMillis());
        }
    }

    /**
     * Dispatch runs for every job whose next fire time has passed.
     * Called by the trigger loop; tests may call it directly.
     *
     * @return number of runs dispatched
     */
    public int processDueJobs() {
        if (!running || shutdown) {
            return 0;
        }
        Instant now = clock.instant();
        int dispatched = 0;
        for (JobRecord record : store.list()) {
            if (record.nextFireTime() != null && !record.nextFireTime().isAfter(now)) {
                dispatched += fire(record.id(), now);
            }
        }
        return dispatched;
    }

    private int fire(String jobId, Instant now) {
        synchronized (lockFor(jobId)) {
            Optional<JobRecord> current = store.get(jobId);
            if (current.isEmpty() || current.get().nextFireTime() == null
                    || current.get().nextFireTime().isAfter(now)) {
                return 0;
            }
            JobRecord record = current.get();

            ScheduledJob job;
            try {
                job = codec.decode(record);
            } catch (IllegalStateException e) {
                log.error("Unable to restore job \"{}\" -- removing it", jobId, e);
                store.remove(jobId);
                forget(jobId);
                return 0;
            }

            firing.add(jobId);
            try {
                List<Instant> runTimes = job.trigger().runTimes(record.nextFireTime(), now, MAX_CATCH_UP_RUNS);
                Instant lastSlot = runTimes.get(runTimes.size() - 1);
                if (job.options().coalesce() && runTimes.size() > 1) {
                    runTimes = List.of(lastSlot);
                }

                int dispatched = 0;
                if (dispatch(job, runTimes)) {
                    dispatched = runTimes.size();
                } else {
                    log.warn("Execution of job \"{}\" skipped {} time(s): maximum number of running instances reached ({})",
                            jobId, runTimes.size(), job.options().maxInstances());
                }

                Optional<Instant> next = job.trigger().nextFireTime(lastSlot);
                if (next.isEmpty()) {
                    store.remove(jobId);
                    forget(jobId);
                    log.info("Removed job \"{}\": its trigger has no more fire times", jobId);
                } else {
                    store.put(record.toBuilder().nextFireTime(next.get()).build());
                }
                return dispatched;
            } finally {
                firing.remove(jobId);
            }
        }
    }

    /** Submit one instance covering the given run times, unless the job is at its limit. */
    private boolean dispatch(ScheduledJob job, List<Instant> runTimes) {
        AtomicInteger instances = inFlight.computeIfAbsent(job.id(), id -> new AtomicInteger());
        if (instances.get() >= job.options().maxInstances()) {
            return false;
        }
        instances.incrementAndGet();
        try {
            lanes.submit(job.task().lane(), () -> execute(job, runTimes, instances));
            return true;
        } catch (RejectedExecutionException e) {
            instances.decrementAndGet();
            log.warn("Run of job \"{}\" at {} rejected: execution lanes are shut down", job.id(), runTimes);
            return false;
        }
    }

    private void execute(ScheduledJob job, List<Instant> runTimes, AtomicInteger instances) {
        try {
            for (Instant runTime : runTimes) {
                recordRun(job.id(), run(job, runTime));
            }
        } finally {
            instances.decrementAndGet();
        }
    }

    private RunStatus run(ScheduledJob job, Instant runTime) {
        log.info("Running job \"{}\" (scheduled at {})", job.name(), runTime);
        try {
            invoker.invoke(job.task());
            log.info("Job \"{}\" executed successfully", job.name());
            return RunStatus.SUCCESS;
        } catch (RuntimeException e) {
            log.error("Job \"{}\" raised an exception", job.id(), e);
            return RunStatus.FAILED;
        }
    }

    private void recordRun(String jobId, RunStatus status) {
        Instant finishedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        try {
            synchronized (lockFor(jobId)) {
                store.get(jobId).ifPresent(record -> store.put(record.toBuilder()
                        .lastRunAt(finishedAt)
                        .lastStatus(status)
                        .build()));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record run of job \"{}\": {}", jobId, e.getMessage());
        }
    }

    /**
     * All jobs: stored jobs, plus pending ones before the scheduler starts.
     * Records that cannot be decoded are logged and left out.
     */
    public List<ScheduledJob> getJobs() {
        Map<String, ScheduledJob> jobs = new TreeMap<>();
        for (JobRecord record : store.list()) {
            try {
                jobs.put(record.id(), codec.decode(record));
            } catch (IllegalStateException e) {
                log.error("Unable to restore job \"{}\"", record.id(), e);
            }
        }
        synchronized (schedulerLock) {
            for (PendingJob entry : pending.values()) {
                jobs.put(entry.job().id(), entry.job());
            }
        }
        return new ArrayList<>(jobs.values());
    }

    public Optional<ScheduledJob> getJob(String jobId) {
        synchronized (schedulerLock) {
            PendingJob entry = pending.get(jobId);
            if (entry != null) {
                return Optional.of(entry.job());
            }
        }
        return store.get(jobId).map(codec::decode);
    }

    /** Ids of all jobs, sorted. */
    public Set<String> jobIds() {
        Set<String> ids = new TreeSet<>();
        for (JobRecord record : store.list()) {
            ids.add(record.id());
        }
        synchronized (schedulerLock) {
            ids.addAll(pending.keySet());
        }
        return ids;
    }

    /**
     * Current lifecycle state of a job, empty if the id was never seen.
     */
    public Optional<JobState> jobState(String jobId) {
        synchronized (schedulerLock) {
            if (pending.containsKey(jobId)) {
                return Optional.of(JobState.PENDING);
            }
        }
        if (firing.contains(jobId)) {
            return Optional.of(JobState.FIRING);
        }
        if (store.get(jobId).isPresent()) {
            return Optional.of(JobState.SCHEDULED);
        }
        if (removed.contains(jobId)) {
            return Optional.of(JobState.REMOVED);
        }
        return Optional.empty();
    }

    /** Number of runs of the job currently executing. */
    public int runningInstances(String jobId) {
        AtomicInteger count = inFlight.get(jobId);
        return count != null ? count.get() : 0;
    }

    public boolean isRunning() {
        return running;
    }

    public JobStore store() {
        return store;
    }

    /**
     * Stop the trigger loop. With {@code wait}, block until in-flight runs
     * finish; runs are never interrupted.
     */
    public void shutdown(boolean wait) {
        synchronized (schedulerLock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            running = false;
        }

        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
                log.warn("Trigger loop forcefully stopped");
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        lanes.shutdown(wait);
        log.info("Scheduler has been shut down");
    }

    @Override
    public void close() {
        shutdown(true);
    }

    private Object lockFor(String jobId) {
        return jobLocks[Math.floorMod(jobId.hashCode(), jobLocks.length)];
    }

    /** Remember a removed id and drop its idle run counter. */
    private void forget(String jobId) {
        removed.add(jobId);
        inFlight.computeIfPresent(jobId, (id, count) -> count.get() == 0 ? null : count);
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
