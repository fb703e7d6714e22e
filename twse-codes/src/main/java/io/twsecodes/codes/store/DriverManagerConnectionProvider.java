package io.twsecodes.codes.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens a fresh connection per call. Good enough for a single-writer CLI; use a pooled DataSource elsewhere.
 */
public class DriverManagerConnectionProvider implements ConnectionProvider {
    private final String jdbcUrl;
    private final String user;
    private final String password;

    public DriverManagerConnectionProvider(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
