package io.twsecodes.codes.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out JDBC connections to the persisted store. Created once per process and closed on shutdown.
 */
public interface ConnectionProvider extends AutoCloseable {
    Connection getConnection() throws SQLException;

    @Override
    default void close() {}
}
