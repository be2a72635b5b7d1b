package taskclock.store;

import java.util.List;
import java.util.Optional;

/**
 * Built-in dialects.
 */
public enum StandardDialect implements JdbcDialect {

    H2 {
        @Override
        public List<String> createStatements(String schema, String table) {
            return List.of(
                    "CREATE SCHEMA IF NOT EXISTS " + schema,
                    """
                            CREATE TABLE IF NOT EXISTS %s.%s (
                                id              VARCHAR(191) PRIMARY KEY,
                                name            VARCHAR(1024),
                                trigger_state   CLOB NOT NULL,
                                next_fire_time  BIGINT,
                                job_state       CLOB NOT NULL,
                                last_run        BIGINT,
                                last_status     VARCHAR(16)
                            )
                            """.formatted(schema, table),
                    "CREATE INDEX IF NOT EXISTS " + schema + "." + nextFireIndex(schema, table));
        }
    },

    POSTGRESQL {
        @Override
        public List<String> createStatements(String schema, String table) {
            return List.of(
                    "CREATE SCHEMA IF NOT EXISTS " + schema,
                    """
                            CREATE TABLE IF NOT EXISTS %s.%s (
                                id              VARCHAR(191) PRIMARY KEY,
                                name            TEXT,
                                trigger_state   TEXT NOT NULL,
                                next_fire_time  BIGINT,
                                job_state       TEXT NOT NULL,
                                last_run        BIGINT,
                                last_status     VARCHAR(16)
                            )
                            """.formatted(schema, table),
                    "CREATE INDEX IF NOT EXISTS " + nextFireIndex(schema, table));
        }
    },

    /**
     * CrateDB over the PostgreSQL wire protocol. Schemas are created
     * implicitly, and writes only become visible to reads after a refresh.
     */
    CRATEDB {
        @Override
        public List<String> createStatements(String schema, String table) {
            return List.of("""
                    CREATE TABLE IF NOT EXISTS %s.%s (
                        id              TEXT PRIMARY KEY,
                        name            TEXT,
                        trigger_state   TEXT NOT NULL,
                        next_fire_time  BIGINT,
                        job_state       TEXT NOT NULL,
                        last_run        BIGINT,
                        last_status     TEXT
                    )
                    """.formatted(schema, table));
        }

        @Override
        public Optional<String> refreshStatement(String qualifiedTable) {
            return Optional.of("REFRESH TABLE " + qualifiedTable);
        }
    };

    @Override
    public Optional<String> refreshStatement(String qualifiedTable) {
        return Optional.empty();
    }

    private static String nextFireIndex(String schema, String table) {
        return "ix_" + table + "_next_fire ON " + schema + "." + table + "(next_fire_time)";
    }
}
