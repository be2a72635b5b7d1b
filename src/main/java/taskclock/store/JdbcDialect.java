package taskclock.store;

import java.util.List;
import java.util.Optional;

/**
 * Backend-specific SQL used by {@link JdbcJobStore}.
 */
public interface JdbcDialect {

    String name();

    /**
     * Statements creating the schema and job table if they do not exist.
     */
    List<String> createStatements(String schema, String table);

    /**
     * Statement that makes prior writes to the table visible to subsequent
     * reads. Empty for backends with read-your-writes consistency.
     */
    Optional<String> refreshStatement(String qualifiedTable);
}
