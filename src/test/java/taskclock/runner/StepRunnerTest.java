package taskclock.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskclock.model.ScheduleItem;
import taskclock.model.Step;
import taskclock.model.Task;
import taskclock.model.TaskMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepRunnerTest {

    private List<String> calls;
    private StepRunner runner;

    @BeforeEach
    void setup() {
        calls = new ArrayList<>();
        CallableRegistry registry = CallableRegistry.withBuiltins()
                .register("test:record", (args, kwargs) -> {
                    calls.add(String.valueOf(args.get(0)));
                    return args.size();
                })
                .register("test:fail", (args, kwargs) -> {
                    throw new IllegalStateException("exploded");
                });
        runner = StepRunner.withDefaults(registry);
    }

    private static Task task(Step... steps) {
        return new Task(new TaskMetadata("t1", "Task", "", true), List.of(new ScheduleItem("0 2 * * *")),
                List.of(steps));
    }

    private static Step record(String value, boolean condition) {
        return new Step("record " + value, "entrypoint", "test:record", List.of(value), Map.of(), condition);
    }

    @Test
    void runsStepsInOrder() {
        runner.run(task(record("one", true), record("two", true)));

        assertEquals(List.of("one", "two"), calls);
    }

    @Test
    void skipsStepsWithFalseCondition() {
        runner.run(task(record("one", true), record("skipped", false), record("three", true)));

        assertEquals(List.of("one", "three"), calls);
    }

    @Test
    void skippedStepIsNeverResolved() {
        Step unresolvable = new Step("notify", "entrypoint", "notify:slack", null, null, false);

        assertDoesNotThrow(() -> runner.run(task(unresolvable, record("after", true))));
        assertEquals(List.of("after"), calls);
    }

    @Test
    void unknownStepKindFails() {
        Step step = new Step("bad", "docker", "image:latest", null, null, true);

        UnknownStepKindException e = assertThrows(UnknownStepKindException.class, () -> runner.run(task(step)));
        assertEquals("Unknown step kind: docker", e.getMessage());
    }

    @Test
    void unresolvedReferenceFails() {
        Step step = new Step("missing", "entrypoint", "nowhere:fn", null, null, true);

        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> runner.run(task(step)));
        assertEquals("Unable to resolve reference: nowhere:fn", e.getMessage());
    }

    @Test
    void failingStepAbortsRemainingSteps() {
        Step failing = new Step("fail", "entrypoint", "test:fail", null, null, true);

        StepExecutionException e = assertThrows(StepExecutionException.class,
                () -> runner.run(task(record("before", true), failing, record("after", true))));

        assertEquals(List.of("before"), calls);
        assertEquals("Step \"fail\" of task \"t1\" failed: exploded", e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void invokeRunsTask() {
        runner.invoke(task(record("via-invoker", true)));

        assertEquals(List.of("via-invoker"), calls);
    }

    @Test
    void builtinsAreRegistered() {
        CallableRegistry registry = CallableRegistry.withBuiltins();

        assertTrue(registry.names().containsAll(List.of(CallableRegistry.LOG, CallableRegistry.SLEEP)));
        assertDoesNotThrow(() -> runner.run(task(
                new Step("log", "entrypoint", CallableRegistry.LOG, List.of("hello"), Map.of("jitter", 0.42), true),
                new Step("sleep", "entrypoint", CallableRegistry.SLEEP, null, Map.of("seconds", 0.01), true))));
    }

    @Test
    void stepKindTags() {
        assertEquals(StepKind.SCRIPT_FILE, StepKind.fromTag("script-file"));
        assertEquals("sql", StepKind.SQL.tag());
        assertThrows(UnknownStepKindException.class, () -> StepKind.fromTag("python"));
    }
}
