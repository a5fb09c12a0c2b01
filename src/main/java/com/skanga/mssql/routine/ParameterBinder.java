package com.skanga.mssql.routine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns decoded parameter values into a {@link BatchPlan} and binds the plan's values to a statement.
 * Values only ever reach the database through driver binding.
 */
public class ParameterBinder {
    private static final Logger logger = LoggerFactory.getLogger(ParameterBinder.class);

    static final String BIND_PREFIX = "@p";
    static final String VARIABLE_PREFIX = "@v";

    /**
     * Plans a declare/assign/call batch. Entry {@code i} in iteration order is bound as {@code @p<i>}
     * (JDBC slot {@code i + 1}), copied into {@code @v<i>}, and the call references {@code @v<i>}.
     *
     * @param parameterValues decoded values in caller order
     * @return the plan; empty when there are no values
     */
    public BatchPlan planVariables(Map<String, ParameterValue> parameterValues) {
        if (parameterValues == null || parameterValues.isEmpty()) {
            return BatchPlan.empty();
        }

        List<BatchPlan.Declaration> declarations = new ArrayList<>();
        List<BatchPlan.Assignment> assignments = new ArrayList<>();
        List<BindVariable> bindVariables = new ArrayList<>();
        List<String> arguments = new ArrayList<>();

        int index = 0;
        for (ParameterValue parameterValue : parameterValues.values()) {
            String bindName = BIND_PREFIX + index;
            String variableName = VARIABLE_PREFIX + index;
            bindVariables.add(new BindVariable(bindName, index, parameterValue));
            declarations.add(new BatchPlan.Declaration(variableName, SqlTypeInferencer.sqlTypeFor(parameterValue)));
            assignments.add(new BatchPlan.Assignment(variableName, bindName));
            arguments.add(variableName);
            index++;
        }
        return new BatchPlan(declarations, assignments, bindVariables, arguments);
    }

    /**
     * Plans a direct call where each value binds to the routine parameter of the same name.
     * No declarations or assignments are produced.
     */
    public BatchPlan planNamed(Map<String, ParameterValue> parameterValues) {
        if (parameterValues == null || parameterValues.isEmpty()) {
            return BatchPlan.empty();
        }

        List<BindVariable> bindVariables = new ArrayList<>();
        List<String> arguments = new ArrayList<>();
        int index = 0;
        for (ParameterValue parameterValue : parameterValues.values()) {
            bindVariables.add(new BindVariable(parameterValue.key(), index++, parameterValue));
            arguments.add("?");
        }
        return new BatchPlan(List.of(), List.of(), bindVariables, arguments);
    }

    public void bindPositional(PreparedStatement prepStmt, BatchPlan batchPlan) throws SQLException {
        for (BindVariable bindVariable : batchPlan.bindVariables()) {
            try {
                setValue(prepStmt, bindVariable.position(), bindVariable.value());
            } catch (SQLException e) {
                logger.error("Failed to bind {} at position {}: {}", bindVariable.name(), bindVariable.position(), e.getMessage());
                throw new SQLException("Parameter binding failed for " + bindVariable.value().key() + ": " + e.getMessage(), e);
            }
        }
    }

    public void bindNamed(CallableStatement callStmt, BatchPlan batchPlan) throws SQLException {
        for (BindVariable bindVariable : batchPlan.bindVariables()) {
            try {
                setValue(callStmt, bindVariable.name(), bindVariable.value());
            } catch (SQLException e) {
                logger.error("Failed to bind parameter {}: {}", bindVariable.name(), e.getMessage());
                throw new SQLException("Parameter binding failed for " + bindVariable.name() + ": " + e.getMessage(), e);
            }
        }
    }

    static void setValue(PreparedStatement prepStmt, int paramIndex, ParameterValue parameterValue) throws SQLException {
        Object rawValue = parameterValue.value();
        switch (parameterValue.kind()) {
            case NULL -> prepStmt.setNull(paramIndex, Types.NULL);
            case INT32 -> prepStmt.setInt(paramIndex, (Integer) rawValue);
            case INT64 -> prepStmt.setLong(paramIndex, (Long) rawValue);
            case DECIMAL -> prepStmt.setBigDecimal(paramIndex, (BigDecimal) rawValue);
            case FLOAT64 -> prepStmt.setDouble(paramIndex, (Double) rawValue);
            case BOOL -> prepStmt.setBoolean(paramIndex, (Boolean) rawValue);
            case TEXT -> prepStmt.setString(paramIndex, (String) rawValue);
            case TEMPORAL -> prepStmt.setTimestamp(paramIndex, Timestamp.valueOf((LocalDateTime) rawValue));
        }
    }

    static void setValue(CallableStatement callStmt, String paramName, ParameterValue parameterValue) throws SQLException {
        Object rawValue = parameterValue.value();
        switch (parameterValue.kind()) {
            case NULL -> callStmt.setNull(paramName, Types.NULL);
            case INT32 -> callStmt.setInt(paramName, (Integer) rawValue);
            case INT64 -> callStmt.setLong(paramName, (Long) rawValue);
            case DECIMAL -> callStmt.setBigDecimal(paramName, (BigDecimal) rawValue);
            case FLOAT64 -> callStmt.setDouble(paramName, (Double) rawValue);
            case BOOL -> callStmt.setBoolean(paramName, (Boolean) rawValue);
            case TEXT -> callStmt.setString(paramName, (String) rawValue);
            case TEMPORAL -> callStmt.setTimestamp(paramName, Timestamp.valueOf((LocalDateTime) rawValue));
        }
    }
}
