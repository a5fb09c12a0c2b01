package com.skanga.mssql.routine;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the executable statement text for a routine call.
 */
public class BatchBuilder {
    static final String STATEMENT_SEPARATOR = "; ";

    /**
     * Renders the statement for the given style.
     * <ul>
     *   <li>PROCEDURE: {@code {? = call [schema].[name](?, ...)}}</li>
     *   <li>SCALAR_FUNCTION: {@code DECLARE ...; SET ...; SELECT [schema].[name](@v0, ...) AS Result}</li>
     *   <li>TABLE_FUNCTION: {@code DECLARE ...; SET ...; SELECT * FROM [schema].[name](@v0, ...)}</li>
     * </ul>
     * The declare/set preamble is left out entirely when the plan has none.
     *
     * @param routine         the routine to call
     * @param invocationStyle how to call it
     * @param batchPlan       arguments and preamble
     * @return statement text ready to prepare
     */
    public String render(RoutineReference routine, InvocationStyle invocationStyle, BatchPlan batchPlan) {
        String invocationText = routine.quoted() + "(" + String.join(", ", batchPlan.arguments()) + ")";

        return switch (invocationStyle) {
            case PROCEDURE -> "{? = call " + invocationText + "}";
            case SCALAR_FUNCTION -> withPreamble(batchPlan, "SELECT " + invocationText + " AS Result");
            case TABLE_FUNCTION -> withPreamble(batchPlan, "SELECT * FROM " + invocationText);
        };
    }

    private static String withPreamble(BatchPlan batchPlan, String selectText) {
        if (!batchPlan.hasPreamble()) {
            return selectText;
        }
        List<String> batchStatements = new ArrayList<>();
        for (BatchPlan.Declaration declaration : batchPlan.declarations()) {
            batchStatements.add("DECLARE " + declaration.variable() + " " + declaration.sqlType());
        }
        // JDBC binds positionally, the logical @p name only orders the slots
        for (BatchPlan.Assignment assignment : batchPlan.assignments()) {
            batchStatements.add("SET " + assignment.variable() + " = ?");
        }
        batchStatements.add(selectText);
        return String.join(STATEMENT_SEPARATOR, batchStatements);
    }
}
