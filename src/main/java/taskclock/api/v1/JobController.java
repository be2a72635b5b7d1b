package taskclock.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskclock.api.Controller;
import taskclock.api.v1.dto.JobView;
import taskclock.scheduler.TaskScheduler;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Read-only job listing.
 * GET /api/v1/jobs - all jobs
 * GET /api/v1/jobs/{id} - one job
 */
public class JobController implements Controller {

    private static final String PREFIX = "/api/v1/jobs";

    private final TaskScheduler scheduler;

    public JobController(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (path.equals(PREFIX) || path.startsWith(PREFIX + "/"));
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        if (path.equals(PREFIX) || path.equals(PREFIX + "/")) {
            List<JobView> jobs = scheduler.getJobs().stream().map(JobView::from).toList();
            return ControllerResponse.ok(jobs);
        }

        String id = URLDecoder.decode(path.substring(PREFIX.length() + 1), StandardCharsets.UTF_8);
        return scheduler.getJob(id)
                .map(job -> ControllerResponse.ok(JobView.from(job)))
                .orElseGet(() -> ControllerResponse.notFound("Job not found: " + id));
    }
}
