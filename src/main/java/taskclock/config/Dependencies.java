package taskclock.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.api.v1.HealthController;
import taskclock.api.v1.JobController;
import taskclock.load.TimetableLoader;
import taskclock.model.JobStoreLocation;
import taskclock.repository.JobStore;
import taskclock.runner.CallableRegistry;
import taskclock.runner.StepRunner;
import taskclock.scheduler.ExecutionLanes;
import taskclock.scheduler.JobCodec;
import taskclock.scheduler.TaskScheduler;
import taskclock.scheduler.TimetableRegistrar;
import taskclock.server.RouterHandler;
import taskclock.server.SchedulerHttpServer;
import taskclock.store.JobStoreFactory;
import taskclock.util.Debouncer;
import taskclock.watch.Reconciler;
import taskclock.watch.TimetableWatcher;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the job store, scheduler, step runner and registrar, and
 * on request the watcher and HTTP server. Nothing here is a process-wide
 * singleton; collaborators receive what they need through their constructors.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv(), timetable.namespace());
 * deps.registrar().registerAll(timetable);
 * deps.scheduler().start();
 * // ... run until terminated ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final JobStoreLocation location;
    private final JobStore store;
    private final CallableRegistry callables;
    private final StepRunner stepRunner;
    private final ExecutionLanes lanes;
    private final TaskScheduler scheduler;
    private final TimetableRegistrar registrar;
    private final TimetableLoader loader;

    // Started on request
    private TimetableWatcher watcher;
    private SchedulerHttpServer httpServer;

    private Dependencies(SchedulerConfig config, String namespace, CallableRegistry callables) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.location = config.storeLocation().withNamespace(namespace);
        this.store = JobStoreFactory.open(location, config.storePoolSize());
        if (config.deleteJobs()) {
            JobStoreFactory.clearQuietly(store);
        }

        // Execution
        this.callables = callables;
        this.stepRunner = StepRunner.withDefaults(callables);
        this.lanes = new ExecutionLanes(config.threadWorkers(), config.processWorkers());
        this.scheduler = new TaskScheduler(store, new JobCodec(), stepRunner, lanes,
                Clock.systemUTC(), config.tickInterval());

        // Timetables
        this.registrar = new TimetableRegistrar(scheduler, config.timezone());
        this.loader = new TimetableLoader();

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, scoping the job store to a namespace.
     *
     * @throws ConfigurationException if the job store cannot be opened
     */
    public static Dependencies create(SchedulerConfig config, String namespace) {
        return new Dependencies(config, namespace, CallableRegistry.withBuiltins());
    }

    public static Dependencies create(SchedulerConfig config, String namespace, CallableRegistry callables) {
        return new Dependencies(config, namespace, callables);
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public JobStoreLocation location() {
        return location;
    }

    public JobStore store() {
        return store;
    }

    public CallableRegistry callables() {
        return callables;
    }

    public StepRunner stepRunner() {
        return stepRunner;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public TimetableRegistrar registrar() {
        return registrar;
    }

    public TimetableLoader loader() {
        return loader;
    }

    public Reconciler reconciler(String source) {
        return new Reconciler(loader, source, scheduler, registrar);
    }

    /**
     * Start reconciling the schedule whenever the timetable file changes.
     */
    public synchronized TimetableWatcher startWatcher(Path timetable, String source) {
        if (watcher == null) {
            watcher = new TimetableWatcher(timetable, reconciler(source), new Debouncer(config.debounce()));
            watcher.start();
        }
        return watcher;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        return new RouterHandler()
                .registerController(new HealthController(scheduler))
                .registerController(new JobController(scheduler));
    }

    /**
     * Start the HTTP facade on the configured listen address.
     */
    public synchronized SchedulerHttpServer startHttpServer() {
        if (httpServer == null) {
            httpServer = new SchedulerHttpServer(config.httpHost(), config.httpPort(), routerHandler());
            httpServer.start();
        }
        return httpServer;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        if (watcher != null) {
            try {
                watcher.close();
            } catch (Exception e) {
                log.warn("Error stopping watcher: {}", e.getMessage());
            }
        }

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        // Stop scheduler before the store; in-flight runs finish first
        try {
            scheduler.shutdown(true);
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            store.close();
        } catch (Exception e) {
            log.warn("Error closing job store: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
