package taskclock.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.api.Controller;
import taskclock.api.v1.dto.HealthResponse;
import taskclock.scheduler.TaskScheduler;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final TaskScheduler scheduler;

    public HealthController(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        String store = scheduler.store().describe();
        try {
            if (!scheduler.store().isHealthy()) {
                return new ControllerResponse(HttpResponseStatus.SERVICE_UNAVAILABLE, HealthResponse.unhealthy(store));
            }
            return ControllerResponse.ok(HealthResponse.healthy(
                    store, formatUptime(), scheduler.isRunning(), scheduler.jobIds().size()));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return new ControllerResponse(HttpResponseStatus.SERVICE_UNAVAILABLE, HealthResponse.unhealthy(store));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
