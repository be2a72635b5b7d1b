package taskclock.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.JobRecord;
import taskclock.model.RunStatus;
import taskclock.repository.JobStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC implementation of {@link JobStore} over a {@link Database} pool.
 *
 * Each mutation runs in its own transaction. When the dialect has a refresh
 * statement it is issued after every mutation, so reads that follow see the
 * write.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String COLUMNS =
            "id, name, trigger_state, next_fire_time, job_state, last_run, last_status";

    private final Database db;
    private final JdbcDialect dialect;
    private final String table;
    private final boolean ownsDatabase;

    public JdbcJobStore(Database db, JdbcDialect dialect, String schema, String table) {
        this(db, dialect, schema, table, false);
    }

    JdbcJobStore(Database db, JdbcDialect dialect, String schema, String table, boolean ownsDatabase) {
        this.db = db;
        this.dialect = dialect;
        this.table = identifier(schema) + "." + identifier(table);
        this.ownsDatabase = ownsDatabase;

        db.initSchema(dialect.createStatements(schema, table));
        log.info("Job store ready: {} ({})", this.table, dialect.name());
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    @Override
    public void put(JobRecord record) {
        String update = "UPDATE " + table + " SET name = ?, trigger_state = ?, next_fire_time = ?, job_state = ?,"
                + " last_run = ?, last_status = ? WHERE id = ?";
        String insert = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(update)) {
                    ps.setString(1, record.name());
                    ps.setString(2, record.triggerState());
                    setInstant(ps, 3, record.nextFireTime());
                    ps.setString(4, record.jobState());
                    setInstant(ps, 5, record.lastRunAt());
                    ps.setString(6, record.lastStatus() != null ? record.lastStatus().name() : null);
                    ps.setString(7, record.id());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insert)) {
                        ps.setString(1, record.id());
                        ps.setString(2, record.name());
                        ps.setString(3, record.triggerState());
                        setInstant(ps, 4, record.nextFireTime());
                        ps.setString(5, record.jobState());
                        setInstant(ps, 6, record.lastRunAt());
                        ps.setString(7, record.lastStatus() != null ? record.lastStatus().name() : null);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            refresh(conn);

            log.debug("Stored job: {}", record.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to store job: " + record.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<JobRecord> result = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return result;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + id, e);
        }
    }

    @Override
    public boolean remove(String id) {
        String sql = "DELETE FROM " + table + " WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            int deleted;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, id);
                deleted = ps.executeUpdate();
            }
            conn.commit();
            refresh(conn);

            log.debug("Removed job: {} (deleted={})", id, deleted);
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove job: " + id, e);
        }
    }

    @Override
    public void removeAll() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {

            int deleted = st.executeUpdate("DELETE FROM " + table);
            conn.commit();
            refresh(conn);

            log.info("Removed all {} jobs from {}", deleted, table);
        } catch (SQLException e) {
            throw new StoreException("Failed to remove all jobs from " + table, e);
        }
    }

    @Override
    public List<JobRecord> list() {
        String sql = "SELECT " + COLUMNS + " FROM " + table + " ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<JobRecord> records = new ArrayList<>();
            while (rs.next()) {
                records.add(mapRow(rs));
            }
            conn.commit();
            return records;
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs from " + table, e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    @Override
    public String describe() {
        return dialect.name().toLowerCase(Locale.ROOT) + ":" + table;
    }

    public String table() {
        return table;
    }

    private void refresh(Connection conn) throws SQLException {
        Optional<String> refresh = dialect.refreshStatement(table);
        if (refresh.isEmpty()) {
            return;
        }
        try (Statement st = conn.createStatement()) {
            st.execute(refresh.get());
        }
        conn.commit();
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, instant.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        String status = rs.getString("last_status");
        return JobRecord.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .triggerState(rs.getString("trigger_state"))
                .nextFireTime(getInstant(rs, "next_fire_time"))
                .jobState(rs.getString("job_state"))
                .lastRunAt(getInstant(rs, "last_run"))
                .lastStatus(status != null ? RunStatus.valueOf(status) : null)
                .build();
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            db.close();
        }
    }
}
