package com.skanga.mssql.db;

import com.skanga.mssql.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Common plumbing for services whose operations each run on one connection and return an
 * {@link OperationResult}. Failures never escape an operation: they are logged under the
 * operation name and turned into a failure envelope.
 */
public abstract class DatabaseOperations {
    private final Logger logger = LoggerFactory.getLogger(getClass());

    protected final ConnectionProvider connectionProvider;
    protected final int queryTimeoutSeconds;

    protected DatabaseOperations(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        if (connectionProvider == null) {
            throw new IllegalArgumentException("Connection provider is required");
        }
        this.connectionProvider = connectionProvider;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Opens a connection to the named database, or the default one when the name is null.
     */
    protected Connection connect(String databaseName) throws SQLException {
        return databaseName == null ? connectionProvider.acquire() : connectionProvider.acquire(databaseName);
    }

    protected void applyTimeout(Statement statement) throws SQLException {
        if (queryTimeoutSeconds > 0) {
            statement.setQueryTimeout(queryTimeoutSeconds);
        }
    }

    protected OperationResult failure(String operationName, Exception e) {
        String errorMessage = e.getMessage() != null ? e.getMessage() : e.toString();
        if (e instanceof ToolException) {
            logger.error("{} failed: {}", operationName, errorMessage);
        } else {
            logger.error("{} failed: {}", operationName, errorMessage, e);
        }
        return OperationResult.failure(errorMessage);
    }
}
