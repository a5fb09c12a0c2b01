package com.skanga.mssql.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out open connections. The caller owns each connection for one operation and must close it.
 */
public interface ConnectionProvider extends AutoCloseable {

    /**
     * Returns a connection to the default database.
     *
     * @throws SQLException if no connection can be obtained
     */
    Connection acquire() throws SQLException;

    /**
     * Returns a connection switched to the named database. A null or blank name means the default database.
     *
     * @param databaseName target database
     * @throws SQLException if no connection can be obtained or the database cannot be selected
     */
    Connection acquire(String databaseName) throws SQLException;

    @Override
    default void close() {
    }
}
