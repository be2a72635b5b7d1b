package taskclock.config;

import org.junit.jupiter.api.Test;
import taskclock.model.JobStoreLocation;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of());

        assertEquals("memory://", config.storeAddress());
        assertEquals("taskclock", config.storeSchema());
        assertEquals("jobs", config.storeTable());
        assertFalse(config.deleteJobs());
        assertNull(config.preseed());
        assertTrue(config.watch());
        assertEquals(Duration.ofSeconds(1), config.debounce());
        assertEquals(ZoneId.of("UTC"), config.timezone());
        assertEquals(20, config.threadWorkers());
        assertEquals(5, config.processWorkers());
        assertFalse(config.httpEnabled());
    }

    @Test
    void readsEnvironment() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
                SchedulerConfig.STORE_ADDRESS, "postgresql://u:p@db:5432/app",
                SchedulerConfig.STORE_SCHEMA_NAME, "ops",
                SchedulerConfig.STORE_TABLE_NAME, "schedule",
                SchedulerConfig.JOBS_DELETE, "yes",
                SchedulerConfig.PRESEED, " /etc/timetable.yaml ",
                SchedulerConfig.HTTP_LISTEN_ADDRESS, "0.0.0.0:8080",
                SchedulerConfig.TIMEZONE, "Europe/Berlin",
                SchedulerConfig.WATCH, "off"));

        assertEquals(new JobStoreLocation("postgresql://u:p@db:5432/app", "ops", "schedule"),
                config.storeLocation());
        assertTrue(config.deleteJobs());
        assertEquals("/etc/timetable.yaml", config.preseed());
        assertTrue(config.httpEnabled());
        assertEquals("0.0.0.0", config.httpHost());
        assertEquals(8080, config.httpPort());
        assertEquals(ZoneId.of("Europe/Berlin"), config.timezone());
        assertFalse(config.watch());
        assertFalse(config.toString().contains(":p@"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(ConfigurationException.class,
                () -> SchedulerConfig.fromEnv(Map.of(SchedulerConfig.JOBS_DELETE, "maybe")));
        assertThrows(ConfigurationException.class,
                () -> SchedulerConfig.fromEnv(Map.of(SchedulerConfig.TIMEZONE, "Mars/Olympus")));
        assertThrows(ConfigurationException.class,
                () -> SchedulerConfig.fromEnv(Map.of(SchedulerConfig.HTTP_LISTEN_ADDRESS, "8080")));
        assertThrows(ConfigurationException.class,
                () -> SchedulerConfig.defaults().withHttpListenAddress("localhost:http"));
    }

    @Test
    void fluentSetters() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .withStoreAddress("h2:mem:x")
                .withWorkers(2, 1)
                .withTickInterval(Duration.ofMillis(50))
                .withHttpListenAddress("127.0.0.1:0");

        assertEquals("h2:mem:x", config.storeLocation().address());
        assertEquals(2, config.threadWorkers());
        assertEquals(Duration.ofMillis(50), config.tickInterval());
        assertEquals(0, config.httpPort());
    }
}
