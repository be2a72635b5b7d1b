package taskclock.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskclock.config.ConfigurationException;
import taskclock.model.ScheduleItem;
import taskclock.model.Step;
import taskclock.model.Task;
import taskclock.model.TaskMetadata;
import taskclock.model.Timetable;
import taskclock.store.MemoryJobStore;
import taskclock.trigger.InvalidTriggerSyntaxException;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimetableRegistrarTest {

    private TaskScheduler scheduler;
    private TimetableRegistrar registrar;

    @BeforeEach
    void setup() {
        scheduler = new TaskScheduler(new MemoryJobStore(), task -> {
        }, new ExecutionLanes(1, 1));
        registrar = new TimetableRegistrar(scheduler, ZoneOffset.UTC);
    }

    @AfterEach
    void teardown() {
        scheduler.shutdown(true);
    }

    private static Task task(String id, boolean enabled, String cron) {
        return new Task(
                new TaskMetadata(id, id, "", enabled),
                List.of(new ScheduleItem(cron)),
                List.of(new Step("s", "entrypoint", "builtin:log", null, null, true)));
    }

    @Test
    void requiresScheduler() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new TimetableRegistrar(null, ZoneOffset.UTC));
        assertEquals("Unable to register tasks without a scheduler", e.getMessage());
    }

    @Test
    void registersEnabledTasksOnly() {
        Timetable timetable = Timetable.of(null,
                List.of(task("a", true, "0 2 * * *"), task("b", false, "0 3 * * *")), "t.yaml");

        assertEquals(1, registrar.registerAll(timetable));
        assertEquals(Set.of("a"), scheduler.jobIds());
    }

    @Test
    void timetableJobsUseTimetableOptions() {
        ScheduledJob job = registrar.jobFor(task("a", true, "0 2 * * *"));

        assertEquals(JobOptions.forTimetable(), job.options());
        assertEquals(ZoneOffset.UTC, job.trigger().zone());
        assertEquals("a", job.id());
    }

    @Test
    void registeringTwiceReplacesWithoutConflict() {
        scheduler.start();

        assertTrue(registrar.register(task("a", true, "0 2 * * *")));
        assertFalse(registrar.register(task("a", true, "0 2 * * *")));
        assertTrue(registrar.register(task("a", true, "0 4 * * *")));
    }

    @Test
    void invalidFieldFailsRegistration() {
        assertThrows(InvalidTriggerSyntaxException.class, () -> registrar.register(task("a", true, "0 99 * * *")));
    }
}
