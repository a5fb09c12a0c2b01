package com.skanga.mssql.routine;

import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.DatabaseOperations;
import com.skanga.mssql.db.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Invokes stored procedures, scalar functions and table-valued functions with weakly typed
 * parameters. Every call runs on its own connection, which is released on every exit path.
 * <p>
 * Procedures take a JSON object of parameter names to values. Functions take either a JSON
 * object (text starting with {@code {}) or a literal argument list that is spliced into the call
 * unchanged; the caller is responsible for the safety of literal lists.
 */
public class RoutineInvoker extends DatabaseOperations {
    private static final Logger logger = LoggerFactory.getLogger(RoutineInvoker.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + RoutineInvoker.class.getName());

    static final String DEFAULT_SCHEMA_QUERY = "SELECT SCHEMA_NAME()";
    static final String FALLBACK_SCHEMA = "dbo";

    private final ParameterDecoder parameterDecoder = new ParameterDecoder();
    private final ParameterBinder parameterBinder = new ParameterBinder();
    private final BatchBuilder batchBuilder = new BatchBuilder();
    private final ResultAggregator resultAggregator = new ResultAggregator();

    public RoutineInvoker(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        super(connectionProvider, queryTimeoutSeconds);
    }

    /**
     * Executes a stored procedure.
     *
     * @param routineName   {@code [schema.]name}
     * @param parameterText optional JSON object, e.g. {@code {"@orderId": 7}}
     * @param database      optional target database
     * @return envelope whose data holds {@code return_value} and any row sets and output parameters
     */
    public OperationResult invokeProcedure(String routineName, String parameterText, String database) {
        try {
            RoutineReference routine = RoutineReference.parse(routineName);
            Map<String, ParameterValue> parameterValues = parameterDecoder.decode(parameterText);
            return OperationResult.success(callProcedure(routine, parameterValues, database).toData());
        } catch (Exception e) {
            return failure("ExecuteStoredProcedure", e);
        }
    }

    /**
     * Executes a scalar function and returns {@code {result: value}}.
     */
    public OperationResult invokeScalarFunction(String routineName, String parameterText, String database) {
        try {
            RoutineReference routine = RoutineReference.parse(routineName);
            BatchPlan batchPlan = planFunctionArguments(routine, parameterText);
            return OperationResult.success(
                    callFunction(routine, InvocationStyle.SCALAR_FUNCTION, batchPlan, database).toData());
        } catch (Exception e) {
            return failure("ExecuteScalarFunction", e);
        }
    }

    /**
     * Executes a table-valued function and returns its rows.
     */
    public OperationResult invokeTableFunction(String routineName, String parameterText, String database) {
        try {
            RoutineReference routine = RoutineReference.parse(routineName);
            BatchPlan batchPlan = planFunctionArguments(routine, parameterText);
            return OperationResult.success(
                    callFunction(routine, InvocationStyle.TABLE_FUNCTION, batchPlan, database).toData());
        } catch (Exception e) {
            return failure("ExecuteTableFunction", e);
        }
    }

    BatchPlan planFunctionArguments(RoutineReference routine, String parameterText) throws MalformedParametersException {
        if (parameterText == null || parameterText.isBlank()) {
            return BatchPlan.empty();
        }
        if (parameterText.trim().startsWith("{")) {
            return parameterBinder.planVariables(parameterDecoder.decode(parameterText));
        }
        securityLogger.warn("SECURITY_EVENT: LITERAL_ARGUMENTS - {} called with caller-supplied literal SQL: {}",
                routine, parameterText.length() > 100 ? parameterText.substring(0, 100) + "..." : parameterText);
        return BatchPlan.literal(parameterText);
    }

    ProcedureResult callProcedure(RoutineReference routine, Map<String, ParameterValue> parameterValues,
                                  String database) throws SQLException {
        try (Connection dbConn = connect(database)) {
            List<ProcedureParameter> outputParameters = findOutputParameters(dbConn, routine);

            List<ProcedureParameter> unsuppliedOutputs = new ArrayList<>();
            for (ProcedureParameter outputParameter : outputParameters) {
                if (parameterValues.keySet().stream().noneMatch(outputParameter::matches)) {
                    unsuppliedOutputs.add(outputParameter);
                }
            }

            BatchPlan batchPlan = parameterBinder.planNamed(parameterValues).withPlaceholders(unsuppliedOutputs.size());
            String callText = batchBuilder.render(routine, InvocationStyle.PROCEDURE, batchPlan);
            logger.debug("Executing procedure call: {}", callText);

            try (CallableStatement callStmt = dbConn.prepareCall(callText)) {
                applyTimeout(callStmt);
                callStmt.registerOutParameter(1, Types.INTEGER);
                parameterBinder.bindNamed(callStmt, batchPlan);

                List<String> outputNames = new ArrayList<>();
                for (ProcedureParameter outputParameter : outputParameters) {
                    callStmt.registerOutParameter(outputParameter.name(), outputParameter.sqlType());
                    outputNames.add(outputParameter.name());
                }

                boolean isResultSet = callStmt.execute();
                return resultAggregator.readProcedure(callStmt, isResultSet, outputNames);
            }
        }
    }

    RoutineResult callFunction(RoutineReference routine, InvocationStyle invocationStyle, BatchPlan batchPlan,
                               String database) throws SQLException {
        String batchText = batchBuilder.render(routine, invocationStyle, batchPlan);
        logger.debug("Executing function batch: {}", batchText);

        try (Connection dbConn = connect(database);
             PreparedStatement prepStmt = dbConn.prepareStatement(batchText)) {
            applyTimeout(prepStmt);
            parameterBinder.bindPositional(prepStmt, batchPlan);
            boolean isResultSet = prepStmt.execute();
            return invocationStyle == InvocationStyle.SCALAR_FUNCTION
                    ? resultAggregator.readScalar(prepStmt, isResultSet)
                    : resultAggregator.readTable(prepStmt, isResultSet);
        }
    }

    /**
     * Looks up the procedure's OUTPUT parameters. SQL Server reports them as in/out columns.
     */
    List<ProcedureParameter> findOutputParameters(Connection dbConn, RoutineReference routine) throws SQLException {
        DatabaseMetaData metaData = dbConn.getMetaData();
        String escapeString = metaData.getSearchStringEscape();
        String schemaName = routine.schema() != null ? routine.schema() : defaultSchema(dbConn);
        List<ProcedureParameter> outputParameters = new ArrayList<>();

        try (ResultSet columnsResultSet = metaData.getProcedureColumns(dbConn.getCatalog(),
                escapePattern(schemaName, escapeString), escapePattern(routine.name(), escapeString), "%")) {
            while (columnsResultSet.next()) {
                ProcedureParameter procedureParameter = new ProcedureParameter(
                        columnsResultSet.getString("COLUMN_NAME"),
                        ProcedureParameter.Direction.fromColumnType(columnsResultSet.getInt("COLUMN_TYPE")),
                        columnsResultSet.getInt("DATA_TYPE"));
                if (procedureParameter.isOutput()) {
                    outputParameters.add(procedureParameter);
                }
            }
        }
        logger.debug("Procedure {} declares {} output parameters", routine, outputParameters.size());
        return outputParameters;
    }

    /**
     * The schema an unqualified name resolves to for this connection's login.
     */
    String defaultSchema(Connection dbConn) throws SQLException {
        try (Statement stmt = dbConn.createStatement();
             ResultSet schemaResultSet = stmt.executeQuery(DEFAULT_SCHEMA_QUERY)) {
            String schemaName = schemaResultSet.next() ? schemaResultSet.getString(1) : null;
            if (schemaName == null) {
                schemaName = FALLBACK_SCHEMA;
            }
            logger.debug("Unqualified routine names resolve to schema {}", schemaName);
            return schemaName;
        }
    }

    static String escapePattern(String identifier, String escapeString) {
        if (identifier == null || escapeString == null || escapeString.isEmpty()) {
            return identifier;
        }
        return identifier.replace(escapeString, escapeString + escapeString)
                .replace("_", escapeString + "_")
                .replace("%", escapeString + "%");
    }
}
