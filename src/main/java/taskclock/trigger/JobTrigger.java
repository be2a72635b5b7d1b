package taskclock.trigger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Combined trigger of a task: fires whenever any of its cron schedules fires.
 */
public final class JobTrigger {

    private final List<CronSchedule> schedules;
    private final ZoneId zone;

    private JobTrigger(List<CronSchedule> schedules, ZoneId zone) {
        this.schedules = List.copyOf(schedules);
        this.zone = zone;
    }

    public static JobTrigger of(List<String> expressions, ZoneId zone) {
        Objects.requireNonNull(zone, "zone is required");
        if (expressions == null || expressions.isEmpty()) {
            throw new IllegalArgumentException("At least one cron expression is required");
        }
        List<CronSchedule> schedules = new ArrayList<>();
        for (String expression : expressions) {
            schedules.add(CronSchedule.parse(expression, zone));
        }
        return new JobTrigger(schedules, zone);
    }

    /**
     * Earliest fire time strictly after {@code instant} across all schedules.
     * Empty once every schedule is exhausted.
     */
    public Optional<Instant> nextFireTime(Instant instant) {
        Instant earliest = null;
        for (CronSchedule schedule : schedules) {
            Optional<Instant> next = schedule.nextAfter(instant);
            if (next.isPresent() && (earliest == null || next.get().isBefore(earliest))) {
                earliest = next.get();
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * All fire times in {@code [first, now]}, oldest first, capped at {@code limit}.
     * {@code first} is a previously computed fire time and is included itself.
     */
    public List<Instant> runTimes(Instant first, Instant now, int limit) {
        List<Instant> times = new ArrayList<>();
        Instant current = first;
        while (current != null && !current.isAfter(now) && times.size() < limit) {
            times.add(current);
            current = nextFireTime(current).orElse(null);
        }
        return times;
    }

    public List<String> expressions() {
        return schedules.stream().map(CronSchedule::source).toList();
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobTrigger other))
            return false;
        return expressions().equals(other.expressions()) && zone.equals(other.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expressions(), zone);
    }

    @Override
    public String toString() {
        return "cron" + expressions() + " @" + zone;
    }
}
