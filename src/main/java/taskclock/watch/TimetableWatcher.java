package taskclock.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.util.Debouncer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Reconciles the schedule whenever the timetable file changes.
 *
 * A watch thread pushes change notifications for the file into a bounded
 * queue, dropping them when it is full. A single consumer thread takes them,
 * drops those that arrive within the debounce window of the last processed
 * one and runs the {@link Reconciler}.
 */
public class TimetableWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimetableWatcher.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofSeconds(1);
    static final int QUEUE_CAPACITY = 64;

    private final Path file;
    private final Reconciler reconciler;
    private final Debouncer debouncer;
    private final BlockingQueue<Instant> events = new ArrayBlockingQueue<>(QUEUE_CAPACITY);

    private WatchService watchService;
    private Thread watchThread;
    private Thread consumerThread;
    private volatile boolean running = false;

    public TimetableWatcher(Path file, Reconciler reconciler) {
        this(file, reconciler, new Debouncer(DEFAULT_DEBOUNCE));
    }

    public TimetableWatcher(Path file, Reconciler reconciler, Debouncer debouncer) {
        this.file = file.toAbsolutePath().normalize();
        this.reconciler = reconciler;
        this.debouncer = debouncer;
    }

    /**
     * Start watching.
     *
     * @throws UncheckedIOException if the file's directory cannot be watched
     */
    public synchronized void start() {
        if (running) {
            log.warn("Watcher already running");
            return;
        }
        Path directory = file.getParent();
        try {
            watchService = directory.getFileSystem().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to watch " + directory, e);
        }

        running = true;
        watchThread = new Thread(this::watchLoop, "taskclock-watch");
        watchThread.setDaemon(true);
        consumerThread = new Thread(this::consumeLoop, "taskclock-reconcile");
        consumerThread.setDaemon(true);
        watchThread.start();
        consumerThread.start();
        log.info("Watching {} for changes", file);
    }

    private void watchLoop() {
        Path name = file.getFileName();
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW || name.equals(event.context())) {
                    if (!events.offer(Instant.now())) {
                        log.debug("Change queue full, dropping notification for {}", file);
                    }
                }
            }
            if (!key.reset()) {
                log.warn("Watch on {} is no longer valid", file.getParent());
                return;
            }
        }
    }

    private void consumeLoop() {
        while (running) {
            try {
                events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!debouncer.tryAcquire()) {
                log.debug("Ignoring change notification within {}", debouncer.window());
                continue;
            }
            log.info("Detected change in {}, reloading", file);
            try {
                reconciler.reconcile();
            } catch (RuntimeException e) {
                log.error("Reconciling {} failed", file, e);
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service: {}", e.getMessage());
        }
        consumerThread.interrupt();
        watchThread.interrupt();
        log.info("Stopped watching {}", file);
    }
}
