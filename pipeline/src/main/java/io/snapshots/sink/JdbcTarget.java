package io.snapshots.sink;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Connection settings of the analytical store. Use DataSource pooling in production deployments.
 */
public record JdbcTarget(String jdbcUrl, String user, String password) {
    public static JdbcTarget of(String jdbcUrl) { return new JdbcTarget(jdbcUrl, null, null); }

    public Connection connect() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }

    @Override
    public String toString() {
        return "JdbcTarget[" + jdbcUrl + (user == null ? "" : ", user=" + user) + "]";
    }
}
