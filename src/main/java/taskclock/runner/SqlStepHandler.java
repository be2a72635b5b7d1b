package taskclock.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.Step;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executes the step's {@code run} text as one SQL statement.
 *
 * The JDBC URL is taken from kwarg {@code url}, else {@code DATABASE_URL} from
 * the step env, else from the process environment. Kwargs {@code user} and
 * {@code password} are optional. Positional args are bound as parameters.
 * The result is the update count, or the number of rows for a query.
 */
public class SqlStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(SqlStepHandler.class);

    static final String URL_ENV = "DATABASE_URL";

    private final Map<String, String> processEnv;

    public SqlStepHandler() {
        this(System.getenv());
    }

    SqlStepHandler(Map<String, String> processEnv) {
        this.processEnv = processEnv;
    }

    @Override
    public Object execute(Step step) throws SQLException {
        String url = url(step);
        Object user = step.kwargs().get("user");
        Object password = step.kwargs().get("password");

        try (Connection conn = user != null
                ? DriverManager.getConnection(url, user.toString(), password != null ? password.toString() : null)
                : DriverManager.getConnection(url);
                PreparedStatement ps = conn.prepareStatement(step.run())) {

            List<Object> args = step.args();
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }

            int result;
            if (ps.execute()) {
                result = 0;
                try (ResultSet rs = ps.getResultSet()) {
                    while (rs.next()) {
                        result++;
                    }
                }
            } else {
                result = ps.getUpdateCount();
            }
            if (!conn.getAutoCommit()) {
                conn.commit();
            }
            log.debug("SQL step \"{}\" on {} returned {}", step.name(), url, result);
            return result;
        }
    }

    String url(Step step) {
        Object url = step.kwargs().get("url");
        if (url != null && !url.toString().isBlank()) {
            return url.toString();
        }
        String fromStep = step.env().get(URL_ENV);
        if (fromStep != null && !fromStep.isBlank()) {
            return fromStep;
        }
        String fromProcess = processEnv.get(URL_ENV);
        if (fromProcess != null && !fromProcess.isBlank()) {
            return fromProcess;
        }
        throw new IllegalArgumentException("No JDBC URL for SQL step \"" + step.name()
                + "\": set kwarg 'url' or " + URL_ENV);
    }
}
