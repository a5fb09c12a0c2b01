package com.skanga.mssql.tools;

import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.DatabaseOperations;
import com.skanga.mssql.db.OperationResult;
import com.skanga.mssql.routine.RoutineReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Write tools. The statement text of create, insert and update is supplied by the caller and
 * executed as is; drop builds its statement from a quoted table name.
 */
public class DataService extends DatabaseOperations {
    private static final Logger logger = LoggerFactory.getLogger(DataService.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + DataService.class.getName());

    public DataService(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        super(connectionProvider, queryTimeoutSeconds);
    }

    public OperationResult createTable(String sqlText, String database) {
        try {
            logSecurityEvent("CREATE_TABLE", sqlText);
            executeUpdate(sqlText, database);
            return OperationResult.rowsAffected(0);
        } catch (Exception e) {
            return failure("CreateTable", e);
        }
    }

    /**
     * Drops a table if it exists.
     *
     * @param tableName {@code [schema.]name}; each part is bracket-quoted
     */
    public OperationResult dropTable(String tableName, String database) {
        try {
            String dropText = "DROP TABLE IF EXISTS " + RoutineReference.parse(tableName).quoted();
            logSecurityEvent("DROP_TABLE", dropText);
            executeUpdate(dropText, database);
            return OperationResult.rowsAffected(0);
        } catch (Exception e) {
            return failure("DropTable", e);
        }
    }

    public OperationResult insertData(String sqlText, String database) {
        try {
            logSecurityEvent("INSERT_DATA", sqlText);
            return OperationResult.rowsAffected(executeUpdate(sqlText, database));
        } catch (Exception e) {
            return failure("InsertData", e);
        }
    }

    public OperationResult updateData(String sqlText, String database) {
        try {
            logSecurityEvent("UPDATE_DATA", sqlText);
            return OperationResult.rowsAffected(executeUpdate(sqlText, database));
        } catch (Exception e) {
            return failure("UpdateData", e);
        }
    }

    private int executeUpdate(String sqlText, String database) throws SQLException {
        try (Connection dbConn = connect(database);
             Statement statement = dbConn.createStatement()) {
            applyTimeout(statement);
            int updateCount = statement.executeUpdate(sqlText);
            logger.debug("Statement affected {} rows", updateCount);
            return Math.max(updateCount, 0);
        }
    }

    private static void logSecurityEvent(String securityEvent, String sqlText) {
        securityLogger.warn("SECURITY_EVENT: {} - {}", securityEvent,
                sqlText != null && sqlText.length() > 200 ? sqlText.substring(0, 200) + "..." : sqlText);
    }
}
