package com.skanga.mssql.routine;

/**
 * Result of one routine invocation. Each implementation is one result shape.
 */
public interface RoutineResult {

    /**
     * The payload placed in the envelope's {@code data} field.
     */
    Object toData();
}
