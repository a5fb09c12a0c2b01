package com.skanga.mssql.routine;

/**
 * How a routine is called, which decides the statement shape and the result shape.
 */
public enum InvocationStyle {
    /** JDBC call escape with a reserved return-code slot. */
    PROCEDURE,
    /** {@code SELECT routine(args) AS Result} */
    SCALAR_FUNCTION,
    /** {@code SELECT * FROM routine(args)} */
    TABLE_FUNCTION
}
