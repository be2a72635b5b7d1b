package taskclock.store;

import org.junit.jupiter.api.*;
import taskclock.model.JobRecord;
import taskclock.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private static Database db;
    private static JdbcJobStore store;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        db = new Database("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1", "sa", "", 4);
        store = new JdbcJobStore(db, StandardDialect.H2, "taskclock", "jobs");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() {
        store.removeAll();
    }

    @Test
    void putAndGet() {
        JobRecord record = MemoryJobStoreTest.record("job-1");
        store.put(record);

        Optional<JobRecord> found = store.get("job-1");
        assertTrue(found.isPresent());
        assertEquals(record, found.get());
        assertEquals(Instant.parse("2030-01-01T02:00:00Z"), found.get().nextFireTime());
        assertNull(found.get().lastRunAt());
        assertNull(found.get().lastStatus());
    }

    @Test
    void putReplacesExistingRecord() {
        store.put(MemoryJobStoreTest.record("job-1"));

        Instant lastRun = Instant.parse("2030-01-01T02:00:01.123Z");
        store.put(MemoryJobStoreTest.record("job-1").toBuilder()
                .nextFireTime(null)
                .lastRunAt(lastRun)
                .lastStatus(RunStatus.SUCCESS)
                .build());

        JobRecord found = store.get("job-1").orElseThrow();
        assertNull(found.nextFireTime());
        assertEquals(lastRun, found.lastRunAt());
        assertEquals(RunStatus.SUCCESS, found.lastStatus());
        assertEquals(1, store.list().size());
    }

    @Test
    void listIsOrderedById() {
        store.put(MemoryJobStoreTest.record("b"));
        store.put(MemoryJobStoreTest.record("a"));

        assertEquals(List.of("a", "b"), store.list().stream().map(JobRecord::id).toList());
    }

    @Test
    void removeReportsWhetherRecordExisted() {
        store.put(MemoryJobStoreTest.record("job-1"));

        assertTrue(store.remove("job-1"));
        assertFalse(store.remove("job-1"));
        assertTrue(store.get("job-1").isEmpty());
    }

    @Test
    void tablesAreIsolatedByName() {
        JdbcJobStore other = new JdbcJobStore(db, StandardDialect.H2, "taskclock", "ns_other_jobs");
        try {
            store.put(MemoryJobStoreTest.record("job-1"));

            assertTrue(other.list().isEmpty());
            assertEquals("taskclock.ns_other_jobs", other.table());
        } finally {
            other.removeAll();
        }
    }

    @Test
    void rejectsUnsafeIdentifiers() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcJobStore(db, StandardDialect.H2, "taskclock", "jobs; DROP TABLE x"));
    }

    @Test
    void refreshesAfterEveryMutation() {
        AtomicInteger refreshes = new AtomicInteger();
        JdbcDialect counting = new JdbcDialect() {
            @Override
            public String name() {
                return "H2";
            }

            @Override
            public List<String> createStatements(String schema, String table) {
                return StandardDialect.H2.createStatements(schema, table);
            }

            @Override
            public Optional<String> refreshStatement(String qualifiedTable) {
                refreshes.incrementAndGet();
                return Optional.of("SELECT COUNT(*) FROM " + qualifiedTable);
            }
        };
        JdbcJobStore refreshing = new JdbcJobStore(db, counting, "taskclock", "refreshed_jobs");

        refreshing.put(MemoryJobStoreTest.record("job-1"));
        // a read right after the write observes it
        assertTrue(refreshing.get("job-1").isPresent());
        refreshing.remove("job-1");
        assertTrue(refreshing.list().isEmpty());
        refreshing.removeAll();

        assertEquals(3, refreshes.get());
    }

    @Test
    void healthAndDescription() {
        assertTrue(store.isHealthy());
        assertEquals("h2:taskclock.jobs", store.describe());
    }
}
