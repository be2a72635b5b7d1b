package taskclock.config;

import taskclock.model.JobStoreLocation;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * {@code TASKCLOCK_*} environment variables.
 */
public final class SchedulerConfig {

    static final String STORE_ADDRESS = "TASKCLOCK_STORE_ADDRESS";
    static final String STORE_SCHEMA_NAME = "TASKCLOCK_STORE_SCHEMA_NAME";
    static final String STORE_TABLE_NAME = "TASKCLOCK_STORE_TABLE_NAME";
    static final String JOBS_DELETE = "TASKCLOCK_JOBS_DELETE";
    static final String PRESEED = "TASKCLOCK_PRESEED";
    static final String HTTP_LISTEN_ADDRESS = "TASKCLOCK_HTTP_LISTEN_ADDRESS";
    static final String TIMEZONE = "TASKCLOCK_TIMEZONE";
    static final String WATCH = "TASKCLOCK_WATCH";

    // Job store settings
    private String storeAddress = JobStoreLocation.DEFAULT_ADDRESS;
    private String storeSchema = JobStoreLocation.DEFAULT_SCHEMA;
    private String storeTable = JobStoreLocation.DEFAULT_TABLE;
    private int storePoolSize = 4;
    private boolean deleteJobs = false;

    // Timetable settings
    private String preseed = null;
    private boolean watch = true;
    private Duration debounce = Duration.ofSeconds(1);

    // Scheduler settings
    private ZoneId timezone = ZoneId.of("UTC");
    private Duration tickInterval = Duration.ofMillis(500);
    private int threadWorkers = 20;
    private int processWorkers = 5;

    // HTTP facade (off unless a listen address is set)
    private String httpHost = null;
    private int httpPort = 0;

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * @throws ConfigurationException if a value cannot be parsed
     */
    static SchedulerConfig fromEnv(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();

        String address = env.get(STORE_ADDRESS);
        if (address != null && !address.isBlank()) {
            config.storeAddress = address.trim();
        }

        String schema = env.get(STORE_SCHEMA_NAME);
        if (schema != null && !schema.isBlank()) {
            config.storeSchema = schema.trim();
        }

        String table = env.get(STORE_TABLE_NAME);
        if (table != null && !table.isBlank()) {
            config.storeTable = table.trim();
        }

        String delete = env.get(JOBS_DELETE);
        if (delete != null && !delete.isBlank()) {
            config.deleteJobs = parseFlag(JOBS_DELETE, delete);
        }

        String preseed = env.get(PRESEED);
        if (preseed != null && !preseed.isBlank()) {
            config.preseed = preseed.trim();
        }

        String listen = env.get(HTTP_LISTEN_ADDRESS);
        if (listen != null && !listen.isBlank()) {
            config.withHttpListenAddress(listen.trim());
        }

        String timezone = env.get(TIMEZONE);
        if (timezone != null && !timezone.isBlank()) {
            try {
                config.timezone = ZoneId.of(timezone.trim());
            } catch (DateTimeException e) {
                throw new ConfigurationException("Invalid " + TIMEZONE + ": " + timezone, e);
            }
        }

        String watch = env.get(WATCH);
        if (watch != null && !watch.isBlank()) {
            config.watch = parseFlag(WATCH, watch);
        }

        return config;
    }

    private static boolean parseFlag(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> throw new ConfigurationException("Invalid boolean for " + key + ": " + value);
        };
    }

    // Getters
    public String storeAddress() {
        return storeAddress;
    }

    public String storeSchema() {
        return storeSchema;
    }

    public String storeTable() {
        return storeTable;
    }

    public int storePoolSize() {
        return storePoolSize;
    }

    public boolean deleteJobs() {
        return deleteJobs;
    }

    public String preseed() {
        return preseed;
    }

    public boolean watch() {
        return watch;
    }

    public Duration debounce() {
        return debounce;
    }

    public ZoneId timezone() {
        return timezone;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public int threadWorkers() {
        return threadWorkers;
    }

    public int processWorkers() {
        return processWorkers;
    }

    public String httpHost() {
        return httpHost;
    }

    public int httpPort() {
        return httpPort;
    }

    public boolean httpEnabled() {
        return httpHost != null;
    }

    /** Store location from the address, schema and table settings, not yet namespaced. */
    public JobStoreLocation storeLocation() {
        return new JobStoreLocation(storeAddress, storeSchema, storeTable);
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withStoreAddress(String address) {
        this.storeAddress = address;
        return this;
    }

    public SchedulerConfig withStoreSchema(String schema) {
        this.storeSchema = schema;
        return this;
    }

    public SchedulerConfig withStoreTable(String table) {
        this.storeTable = table;
        return this;
    }

    public SchedulerConfig withDeleteJobs(boolean deleteJobs) {
        this.deleteJobs = deleteJobs;
        return this;
    }

    public SchedulerConfig withPreseed(String preseed) {
        this.preseed = preseed;
        return this;
    }

    public SchedulerConfig withWatch(boolean watch) {
        this.watch = watch;
        return this;
    }

    public SchedulerConfig withDebounce(Duration debounce) {
        this.debounce = debounce;
        return this;
    }

    public SchedulerConfig withTimezone(ZoneId timezone) {
        this.timezone = timezone;
        return this;
    }

    public SchedulerConfig withTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
        return this;
    }

    public SchedulerConfig withWorkers(int threadWorkers, int processWorkers) {
        this.threadWorkers = threadWorkers;
        this.processWorkers = processWorkers;
        return this;
    }

    /**
     * Enable the HTTP facade on {@code host:port}. Port 0 picks a free port.
     *
     * @throws ConfigurationException if the address is not {@code host:port}
     */
    public SchedulerConfig withHttpListenAddress(String listen) {
        int colon = listen.lastIndexOf(':');
        if (colon <= 0 || colon == listen.length() - 1) {
            throw new ConfigurationException("Invalid " + HTTP_LISTEN_ADDRESS + ", expected host:port: " + listen);
        }
        try {
            this.httpPort = Integer.parseInt(listen.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port in " + HTTP_LISTEN_ADDRESS + ": " + listen, e);
        }
        this.httpHost = listen.substring(0, colon);
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "store=" + storeLocation() +
                ", deleteJobs=" + deleteJobs +
                ", preseed='" + preseed + '\'' +
                ", watch=" + watch +
                ", timezone=" + timezone +
                ", http=" + (httpEnabled() ? httpHost + ":" + httpPort : "off") +
                '}';
    }
}
