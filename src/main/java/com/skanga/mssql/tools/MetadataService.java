package com.skanga.mssql.tools;

import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.DatabaseOperations;
import com.skanga.mssql.db.OperationResult;
import com.skanga.mssql.db.RowReader;
import com.skanga.mssql.routine.RoutineReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only catalog tools: listing databases and routines, and describing the instance,
 * a database, a stored procedure, a function or a view.
 */
public class MetadataService extends DatabaseOperations {
    private static final Logger logger = LoggerFactory.getLogger(MetadataService.class);
    private static final Set<String> TABLE_FUNCTION_TYPES = Set.of("IF", "TF");

    public MetadataService(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        super(connectionProvider, queryTimeoutSeconds);
    }

    public OperationResult listDatabases() {
        try (Connection dbConn = connect(null)) {
            return OperationResult.success(queryRows(dbConn, CatalogQueries.LIST_DATABASES));
        } catch (Exception e) {
            return failure("ListDatabases", e);
        }
    }

    public OperationResult listStoredProcedures(String database) {
        try (Connection dbConn = connect(database)) {
            return OperationResult.success(queryQualifiedNames(dbConn, CatalogQueries.LIST_PROCEDURES));
        } catch (Exception e) {
            return failure("ListStoredProcedures", e);
        }
    }

    public OperationResult listFunctions(String database) {
        try (Connection dbConn = connect(database)) {
            return OperationResult.success(queryQualifiedNames(dbConn, CatalogQueries.LIST_FUNCTIONS));
        } catch (Exception e) {
            return failure("ListFunctions", e);
        }
    }

    public OperationResult listViews(String database) {
        try (Connection dbConn = connect(database)) {
            return OperationResult.success(queryQualifiedNames(dbConn, CatalogQueries.LIST_VIEWS));
        } catch (Exception e) {
            return failure("ListViews", e);
        }
    }

    /**
     * Describes the server instance the default connection points at.
     */
    public OperationResult describeInstance() {
        try (Connection dbConn = connect(null)) {
            Map<String, Object> description = new LinkedHashMap<>();
            description.put("instance", queryFirstRow(dbConn, CatalogQueries.INSTANCE_VERSION));
            description.put("configuration", queryFirstRow(dbConn, CatalogQueries.INSTANCE_CONFIGURATION));
            description.put("resources", queryFirstRow(dbConn, CatalogQueries.INSTANCE_RESOURCES));
            description.put("database_summary", queryFirstRow(dbConn, CatalogQueries.INSTANCE_DATABASE_SUMMARY));
            return OperationResult.success(description);
        } catch (Exception e) {
            return failure("DescribeInstance", e);
        }
    }

    /**
     * Describes the current database of the connection, i.e. {@code database} or the default one.
     */
    public OperationResult describeDatabase(String database) {
        try (Connection dbConn = connect(database)) {
            Map<String, Object> databaseInfo = queryFirstRow(dbConn, CatalogQueries.DATABASE_INFO);
            if (databaseInfo == null) {
                throw new ObjectNotFoundException("Database", database != null ? database : "(default)");
            }
            databaseInfo.put("is_encrypted", queryOptionalFlag(dbConn, CatalogQueries.DATABASE_ENCRYPTION, "is_encrypted"));
            databaseInfo.put("is_change_tracking_enabled",
                    queryOptionalFlag(dbConn, CatalogQueries.DATABASE_CHANGE_TRACKING, "is_change_tracking_enabled"));

            Map<String, Object> description = new LinkedHashMap<>();
            description.put("database", databaseInfo);
            description.put("size", queryFirstRow(dbConn, CatalogQueries.DATABASE_SIZE));
            description.put("files", queryRows(dbConn, CatalogQueries.DATABASE_FILES));
            description.put("object_counts", queryFirstRow(dbConn, CatalogQueries.DATABASE_OBJECT_COUNTS));
            description.put("schemas", queryRows(dbConn, CatalogQueries.DATABASE_SCHEMAS));
            return OperationResult.success(description);
        } catch (Exception e) {
            return failure("DescribeDatabase", e);
        }
    }

    public OperationResult describeStoredProcedure(String procedureName, String database) {
        try (Connection dbConn = connect(database)) {
            RoutineReference routine = RoutineReference.parse(procedureName);
            String[] lookup = lookupParameters(routine);

            Map<String, Object> procedureInfo = queryFirstRow(dbConn, CatalogQueries.PROCEDURE_INFO, lookup);
            if (procedureInfo == null) {
                throw new ObjectNotFoundException("Stored procedure", procedureName);
            }

            Map<String, Object> description = new LinkedHashMap<>();
            description.put("procedure", procedureInfo);
            description.put("parameters", queryRows(dbConn, CatalogQueries.PROCEDURE_PARAMETERS, lookup));
            putDefinition(description, dbConn, CatalogQueries.PROCEDURE_DEFINITION, lookup);
            description.put("dependencies", queryRows(dbConn, CatalogQueries.PROCEDURE_DEPENDENCIES, lookup));
            return OperationResult.success(description);
        } catch (Exception e) {
            return failure("DescribeStoredProcedure", e);
        }
    }

    /**
     * Describes a scalar, inline table-valued or multi-statement table-valued function.
     * Only table-valued functions get a {@code table_columns} section.
     */
    public OperationResult describeFunction(String functionName, String database) {
        try (Connection dbConn = connect(database)) {
            RoutineReference routine = RoutineReference.parse(functionName);
            String[] lookup = lookupParameters(routine);

            Map<String, Object> functionInfo = queryFirstRow(dbConn, CatalogQueries.FUNCTION_INFO, lookup);
            if (functionInfo == null) {
                throw new ObjectNotFoundException("Function", functionName);
            }

            Map<String, Object> description = new LinkedHashMap<>();
            description.put("function", functionInfo);
            description.put("parameters", queryRows(dbConn, CatalogQueries.FUNCTION_PARAMETERS, lookup));
            Map<String, Object> returnType = queryFirstRow(dbConn, CatalogQueries.FUNCTION_RETURN_TYPE, lookup);
            if (returnType != null) {
                description.put("return_type", returnType);
            }
            Object functionType = functionInfo.get("type");
            if (functionType != null && TABLE_FUNCTION_TYPES.contains(functionType.toString().trim())) {
                description.put("table_columns", queryRows(dbConn, CatalogQueries.FUNCTION_TABLE_COLUMNS, lookup));
            }
            putDefinition(description, dbConn, CatalogQueries.FUNCTION_DEFINITION, lookup);
            description.put("dependencies", queryRows(dbConn, CatalogQueries.FUNCTION_DEPENDENCIES, lookup));
            return OperationResult.success(description);
        } catch (Exception e) {
            return failure("DescribeFunction", e);
        }
    }

    public OperationResult describeView(String viewName, String database) {
        try (Connection dbConn = connect(database)) {
            RoutineReference view = RoutineReference.parse(viewName);
            String[] lookup = lookupParameters(view);

            Map<String, Object> viewInfo = queryFirstRow(dbConn, CatalogQueries.VIEW_INFO, lookup);
            if (viewInfo == null) {
                throw new ObjectNotFoundException("View", viewName);
            }

            Map<String, Object> description = new LinkedHashMap<>();
            description.put("view", viewInfo);
            description.put("columns", queryRows(dbConn, CatalogQueries.VIEW_COLUMNS, lookup));
            description.put("indexes", queryRows(dbConn, CatalogQueries.VIEW_INDEXES, lookup));
            putDefinition(description, dbConn, CatalogQueries.VIEW_DEFINITION, lookup);
            description.put("dependencies", queryRows(dbConn, CatalogQueries.VIEW_DEPENDENCIES, lookup));
            return OperationResult.success(description);
        } catch (Exception e) {
            return failure("DescribeView", e);
        }
    }

    // name = ? AND (schema = ? OR ? IS NULL)
    static String[] lookupParameters(RoutineReference reference) {
        return new String[]{reference.name(), reference.schema(), reference.schema()};
    }

    private void putDefinition(Map<String, Object> description, Connection dbConn, String sqlQuery,
                               String[] lookup) throws SQLException {
        Map<String, Object> definitionRow = queryFirstRow(dbConn, sqlQuery, lookup);
        if (definitionRow != null) {
            description.put("definition", definitionRow.get("definition"));
        }
    }

    private boolean queryOptionalFlag(Connection dbConn, String sqlQuery, String columnLabel) {
        try {
            Map<String, Object> flagRow = queryFirstRow(dbConn, sqlQuery);
            Object flagValue = flagRow != null ? flagRow.get(columnLabel) : null;
            return flagValue instanceof Number && ((Number) flagValue).intValue() != 0;
        } catch (SQLException e) {
            logger.debug("Could not read {}: {}", columnLabel, e.getMessage());
            return false;
        }
    }

    private List<String> queryQualifiedNames(Connection dbConn, String sqlQuery) throws SQLException {
        List<String> qualifiedNames = new ArrayList<>();
        try (PreparedStatement prepStmt = dbConn.prepareStatement(sqlQuery)) {
            applyTimeout(prepStmt);
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                while (resultSet.next()) {
                    qualifiedNames.add(resultSet.getString(1) + "." + resultSet.getString(2));
                }
            }
        }
        return qualifiedNames;
    }

    private List<Map<String, Object>> queryRows(Connection dbConn, String sqlQuery, String... paramValues)
            throws SQLException {
        try (PreparedStatement prepStmt = dbConn.prepareStatement(sqlQuery)) {
            applyTimeout(prepStmt);
            for (int i = 0; i < paramValues.length; i++) {
                prepStmt.setString(i + 1, paramValues[i]);
            }
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                return RowReader.readRows(resultSet);
            }
        }
    }

    private Map<String, Object> queryFirstRow(Connection dbConn, String sqlQuery, String... paramValues)
            throws SQLException {
        List<Map<String, Object>> resultRows = queryRows(dbConn, sqlQuery, paramValues);
        return resultRows.isEmpty() ? null : resultRows.get(0);
    }
}
