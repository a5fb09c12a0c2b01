package com.skanga.mssql.routine;

/**
 * Closed set of value shapes a decoded parameter can take.
 */
public enum ValueKind {
    NULL,
    INT32,
    INT64,
    DECIMAL,
    FLOAT64,
    BOOL,
    TEXT,
    TEMPORAL
}
