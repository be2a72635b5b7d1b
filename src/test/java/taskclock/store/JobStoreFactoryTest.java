package taskclock.store;

import org.junit.jupiter.api.Test;
import taskclock.config.ConfigurationException;
import taskclock.model.JobRecord;
import taskclock.model.JobStoreLocation;
import taskclock.repository.JobStore;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobStoreFactoryTest {

    @Test
    void opensMemoryStore() {
        try (JobStore store = JobStoreFactory.open(JobStoreLocation.defaults())) {
            assertInstanceOf(MemoryJobStore.class, store);
        }
    }

    @Test
    void opensH2Store() {
        JobStoreLocation location = JobStoreLocation.of("h2:mem:factory;DB_CLOSE_DELAY=-1").withNamespace("abc");
        try (JobStore store = JobStoreFactory.open(location, 2)) {
            JdbcJobStore jdbc = assertInstanceOf(JdbcJobStore.class, store);
            assertEquals("taskclock.ns_abc_jobs", jdbc.table());

            store.put(MemoryJobStoreTest.record("job-1"));
            assertTrue(store.get("job-1").isPresent());
        }
    }

    @Test
    void rejectsUnknownScheme() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> JobStoreFactory.open(JobStoreLocation.of("mongodb://localhost/jobs")));
        assertEquals("Initializing job store failed. Unknown address: mongodb://localhost/jobs", e.getMessage());
    }

    @Test
    void rejectsAddressWithoutHost() {
        assertThrows(ConfigurationException.class,
                () -> JobStoreFactory.open(JobStoreLocation.of("postgresql:///db")));
    }

    @Test
    void clearQuietlyDeletesJobs() {
        MemoryJobStore store = new MemoryJobStore();
        store.put(MemoryJobStoreTest.record("a"));

        JobStoreFactory.clearQuietly(store);

        assertTrue(store.list().isEmpty());
    }

    @Test
    void clearQuietlyToleratesFailures() {
        JobStore failing = new JobStore() {
            @Override
            public void put(JobRecord record) {
            }

            @Override
            public Optional<JobRecord> get(String id) {
                return Optional.empty();
            }

            @Override
            public boolean remove(String id) {
                return false;
            }

            @Override
            public void removeAll() {
                throw new StoreException("table does not exist");
            }

            @Override
            public List<JobRecord> list() {
                return List.of();
            }

            @Override
            public String describe() {
                return "failing";
            }

            @Override
            public void close() {
            }
        };

        assertDoesNotThrow(() -> JobStoreFactory.clearQuietly(failing));
    }
}
