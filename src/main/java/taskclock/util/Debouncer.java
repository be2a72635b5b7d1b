package taskclock.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lets one event through per window: events arriving within {@code window}
 * of the last accepted one are dropped.
 */
public final class Debouncer {
    private final Duration window;
    private final Clock clock;
    private Instant lastAccepted;

    public Debouncer(Duration window) {
        this(window, Clock.systemUTC());
    }

    public Debouncer(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /**
     * @return true if the event should be processed
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        if (lastAccepted != null && now.isBefore(lastAccepted.plus(window))) {
            return false;
        }
        lastAccepted = now;
        return true;
    }

    public Duration window() {
        return window;
    }
}
