package taskclock.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskclock.model.Step;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlStepHandlerTest {

    private static final String URL = "jdbc:h2:mem:sql-steps;DB_CLOSE_DELAY=-1";

    private SqlStepHandler handler;

    @BeforeEach
    void setup() throws Exception {
        handler = new SqlStepHandler(Map.of());
        handler.execute(sql("DROP TABLE IF EXISTS sessions", List.of()));
        handler.execute(sql("CREATE TABLE sessions (id INT PRIMARY KEY, expired BOOLEAN)", List.of()));
        handler.execute(sql("INSERT INTO sessions VALUES (1, TRUE), (2, FALSE), (3, TRUE)", List.of()));
    }

    private static Step sql(String statement, List<Object> args) {
        return new Step("sql", "sql", statement, args, Map.of("url", URL), true);
    }

    @Test
    void returnsUpdateCount() throws Exception {
        Object deleted = handler.execute(sql("DELETE FROM sessions WHERE expired = ?", List.of(true)));

        assertEquals(2, deleted);
        assertEquals(1, handler.execute(sql("SELECT id FROM sessions", List.of())));
    }

    @Test
    void returnsRowCountForQueries() throws Exception {
        assertEquals(3, handler.execute(sql("SELECT id FROM sessions", List.of())));
    }

    @Test
    void resolvesUrlFromStepEnvThenProcessEnv() {
        Step fromStepEnv = new Step("q", "sql", "SELECT 1", null, null, true, Map.of("DATABASE_URL", "jdbc:h2:mem:a"));
        Step bare = new Step("q", "sql", "SELECT 1", null, null, true);

        assertEquals("jdbc:h2:mem:a", handler.url(fromStepEnv));
        assertEquals("jdbc:h2:mem:b", new SqlStepHandler(Map.of("DATABASE_URL", "jdbc:h2:mem:b")).url(bare));
        assertThrows(IllegalArgumentException.class, () -> handler.url(bare));
    }

    @Test
    void runsThroughStepRunner() {
        StepRunner runner = StepRunner.withDefaults(CallableRegistry.withBuiltins());
        taskclock.model.Task task = new taskclock.model.Task(
                new taskclock.model.TaskMetadata("purge", null, null, true),
                List.of(new taskclock.model.ScheduleItem("0 2 * * *")),
                List.of(sql("DELETE FROM sessions WHERE expired = ?", List.of(false))));

        assertDoesNotThrow(() -> runner.run(task));
    }
}
