package com.skanga.mssql.routine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The pieces a batch is rendered from: variable declarations, the assignments that copy each bound
 * value into its variable, the driver-bound values, and the argument expressions of the call.
 * Declarations and assignments are zipped by position and share variable names at each index.
 */
public record BatchPlan(List<Declaration> declarations,
                        List<Assignment> assignments,
                        List<BindVariable> bindVariables,
                        List<String> arguments) {

    public record Declaration(String variable, String sqlType) {
    }

    public record Assignment(String variable, String bindParameter) {
    }

    public BatchPlan {
        declarations = List.copyOf(declarations);
        assignments = List.copyOf(assignments);
        bindVariables = List.copyOf(bindVariables);
        arguments = List.copyOf(arguments);
        if (declarations.size() != assignments.size()) {
            throw new IllegalStateException("Batch has " + declarations.size() + " declarations but " +
                    assignments.size() + " assignments");
        }
        for (int i = 0; i < declarations.size(); i++) {
            if (!declarations.get(i).variable().equals(assignments.get(i).variable())) {
                throw new IllegalStateException("Declaration and assignment " + i + " name different variables");
            }
        }
    }

    public static BatchPlan empty() {
        return new BatchPlan(List.of(), List.of(), List.of(), List.of());
    }

    /**
     * A plan whose whole argument list is caller-supplied literal SQL text.
     */
    public static BatchPlan literal(String literalArguments) {
        return new BatchPlan(List.of(), List.of(), List.of(), List.of(literalArguments.trim()));
    }

    public boolean hasPreamble() {
        return !declarations.isEmpty();
    }

    /**
     * Returns a copy with {@code count} more driver placeholders appended to the argument list.
     * Used for output parameters the caller did not supply a value for.
     */
    public BatchPlan withPlaceholders(int count) {
        List<String> extendedArguments = new ArrayList<>(arguments);
        extendedArguments.addAll(Collections.nCopies(count, "?"));
        return new BatchPlan(declarations, assignments, bindVariables, extendedArguments);
    }
}
