package taskclock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.config.ConfigurationException;
import taskclock.config.Dependencies;
import taskclock.config.SchedulerConfig;
import taskclock.load.TimetableLoader;
import taskclock.model.Timetable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point: loads a timetable, schedules its tasks and runs until terminated.
 *
 * <pre>
 * java -jar taskclock.jar [timetable]
 * </pre>
 *
 * The timetable is the first argument, or {@code TASKCLOCK_PRESEED} when
 * there is none. Everything else comes from {@code TASKCLOCK_*} environment
 * variables, see {@link SchedulerConfig}.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        Dependencies deps;
        try {
            deps = start(SchedulerConfig.fromEnv(), args.length > 0 ? args[0] : null);
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            deps.close();
            terminated.countDown();
        }, "taskclock-shutdown"));

        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Load, register and start everything.
     *
     * @throws ConfigurationException if no timetable is given or the store address is unusable
     */
    static Dependencies start(SchedulerConfig config, String argument) {
        String source = argument != null && !argument.isBlank() ? argument : config.preseed();
        if (source == null) {
            throw new ConfigurationException(
                    "No timetable given: pass its path as first argument or set TASKCLOCK_PRESEED");
        }

        Timetable timetable = new TimetableLoader().load(source);
        Dependencies deps = Dependencies.create(config, timetable.namespace());
        try {
            deps.registrar().registerAll(timetable);
            deps.scheduler().start();

            if (config.watch() && !source.contains(":/") && Files.isRegularFile(Path.of(source))) {
                deps.startWatcher(Path.of(source), source);
            }
            if (config.httpEnabled()) {
                deps.startHttpServer();
            }
        } catch (RuntimeException e) {
            deps.close();
            throw e;
        }
        log.info("taskclock started: {} (namespace {}, store {})", source, timetable.namespace(),
                deps.location());
        return deps;
    }
}
