package com.skanga.mssql.db;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by every tool. A failure carries only {@code error}; a success carries
 * {@code data}, {@code rowsAffected}, or both.
 *
 * @param success      whether the operation completed
 * @param data         payload on success
 * @param error        message on failure
 * @param rowsAffected row count reported by write operations
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(boolean success, Object data, String error, Integer rowsAffected) {
    public OperationResult {
        if (success && error != null) {
            throw new IllegalArgumentException("A successful result cannot carry an error");
        }
        if (!success && (data != null || error == null)) {
            throw new IllegalArgumentException("A failed result carries an error and no data");
        }
    }

    public static OperationResult success(Object data) {
        return new OperationResult(true, data, null, null);
    }

    public static OperationResult rowsAffected(int rowsAffected) {
        return new OperationResult(true, null, null, rowsAffected);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, null, error != null ? error : "Unknown error", null);
    }
}
