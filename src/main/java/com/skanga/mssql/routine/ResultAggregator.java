package com.skanga.mssql.routine;

import com.skanga.mssql.db.RowReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.CallableStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumes an executed statement and folds its row sets and output parameters into a {@link RoutineResult}.
 */
public class ResultAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    /**
     * Reads every row set, then the output parameters and the return code.
     * Output parameters can only be read once all row sets have been consumed.
     *
     * @param callStmt     the executed call; slot 1 holds the return code
     * @param isResultSet  what {@code execute()} returned
     * @param outputNames  names of the output parameters registered on the call
     * @return the procedure result
     * @throws SQLException if reading any result fails
     */
    public ProcedureResult readProcedure(CallableStatement callStmt, boolean isResultSet,
                                         List<String> outputNames) throws SQLException {
        List<List<Map<String, Object>>> rowSets = readAllRowSets(callStmt, isResultSet);

        Map<String, Object> outputValues = new LinkedHashMap<>();
        for (String outputName : outputNames) {
            outputValues.put(outputName, RowReader.materialize(callStmt.getObject(outputName)));
        }
        Object returnValue = callStmt.getObject(1);
        outputValues.put(ProcedureResult.RETURN_VALUE_NAME, returnValue);

        return fold(rowSets, outputValues, returnValue);
    }

    /**
     * Builds a procedure result, discarding empty row sets.
     */
    public ProcedureResult fold(List<List<Map<String, Object>>> rowSets, Map<String, Object> outputValues,
                                Object returnValue) {
        List<List<Map<String, Object>>> nonEmptySets = new ArrayList<>();
        for (List<Map<String, Object>> rowSet : rowSets) {
            if (!rowSet.isEmpty()) {
                nonEmptySets.add(rowSet);
            }
        }
        logger.debug("Procedure produced {} row sets, {} non-empty, {} output values",
                rowSets.size(), nonEmptySets.size(), outputValues.size());
        return new ProcedureResult(returnValue, nonEmptySets, outputValues);
    }

    /**
     * Reads the first column of the first row of the first row set.
     */
    public ScalarResult readScalar(Statement statement, boolean isResultSet) throws SQLException {
        try (ResultSet resultSet = firstResultSet(statement, isResultSet)) {
            if (resultSet == null || !resultSet.next()) {
                return new ScalarResult(null);
            }
            return new ScalarResult(RowReader.materialize(resultSet.getObject(1)));
        }
    }

    /**
     * Reads all rows of the first row set.
     */
    public TableResult readTable(Statement statement, boolean isResultSet) throws SQLException {
        try (ResultSet resultSet = firstResultSet(statement, isResultSet)) {
            if (resultSet == null) {
                return new TableResult(List.of());
            }
            return new TableResult(RowReader.readRows(resultSet));
        }
    }

    List<List<Map<String, Object>>> readAllRowSets(Statement statement, boolean isResultSet) throws SQLException {
        List<List<Map<String, Object>>> rowSets = new ArrayList<>();
        boolean hasResultSet = isResultSet;
        while (true) {
            if (hasResultSet) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    rowSets.add(RowReader.readRows(resultSet));
                }
            } else if (statement.getUpdateCount() == -1) {
                break;
            }
            hasResultSet = statement.getMoreResults();
        }
        return rowSets;
    }

    // DECLARE and SET statements ahead of the SELECT may report update counts first
    private static ResultSet firstResultSet(Statement statement, boolean isResultSet) throws SQLException {
        boolean hasResultSet = isResultSet;
        while (!hasResultSet) {
            if (statement.getUpdateCount() == -1) {
                return null;
            }
            hasResultSet = statement.getMoreResults();
        }
        return statement.getResultSet();
    }
}
