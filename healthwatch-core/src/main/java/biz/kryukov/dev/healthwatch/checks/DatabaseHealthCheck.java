package biz.kryukov.dev.healthwatch.checks;

import biz.kryukov.dev.healthwatch.CheckKind;
import biz.kryukov.dev.healthwatch.CheckTimeoutException;
import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.UnhealthyException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;

/**
 * Database health check: runs a lightweight query through a pooled {@link DataSource}.
 */
public final class DatabaseHealthCheck implements HealthCheck {

    private static final String DEFAULT_QUERY = "SELECT 1";

    private final DataSource dataSource;
    private final String query;

    private DatabaseHealthCheck(Builder builder) {
        this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
        this.query = builder.query;
    }

    @Override
    public String name() {
        return CheckKind.DATABASE.label();
    }

    @Override
    public void check(Duration timeout) throws Exception {
        int timeoutSec = Math.max(1, (int) Math.ceil(timeout.toMillis() / 1000.0));
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(timeoutSec);
            stmt.execute(query);
        } catch (SQLException e) {
            throw classify(e, timeoutSec);
        }
    }

    @Override
    public Duration degradedThreshold() {
        return CheckKind.DATABASE.degradedThreshold();
    }

    /** Returns the probe query. */
    public String query() {
        return query;
    }

    private static Exception classify(SQLException e, int timeoutSec) {
        String state = e.getSQLState();
        // 57014: query canceled, reported by PostgreSQL when the query timeout fires
        if (e instanceof SQLTimeoutException || "57014".equals(state)) {
            return new CheckTimeoutException("Database query timed out after " + timeoutSec + "s", e);
        }
        String msg = "Database query failed: " + e.getMessage();
        // SQLSTATE class 28: invalid authorization specification
        if (state != null && state.startsWith("28")) {
            return new UnhealthyException(msg, ErrorCategory.AUTH_ERROR, e);
        }
        // class 08: connection exception
        if (state != null && state.startsWith("08")) {
            return new UnhealthyException(msg, ErrorCategory.CONNECTION_ERROR, e);
        }
        return new UnhealthyException(msg, ErrorCategory.ERROR, e);
    }

    public static Builder builder(DataSource dataSource) {
        return new Builder(dataSource);
    }

    public static final class Builder {
        private final DataSource dataSource;
        private String query = DEFAULT_QUERY;

        private Builder(DataSource dataSource) {
            this.dataSource = dataSource;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public DatabaseHealthCheck build() {
            return new DatabaseHealthCheck(this);
        }
    }
}
