package com.skanga.mssql.routine;

/**
 * A value bound by the driver, never spliced into statement text.
 *
 * @param name  bind name, {@code @p<i>} for function batches or the routine parameter name for procedures
 * @param index zero-based position in the batch
 * @param value the decoded value
 */
public record BindVariable(String name, int index, ParameterValue value) {

    /**
     * One-based JDBC parameter slot for positional binding.
     */
    public int position() {
        return index + 1;
    }
}
