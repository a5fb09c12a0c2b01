package com.skanga.mssql.routine;

import java.sql.DatabaseMetaData;

/**
 * A stored procedure parameter as reported by the driver's metadata.
 *
 * @param name      parameter name including the {@code @} prefix
 * @param direction parameter direction
 * @param sqlType   {@link java.sql.Types} code used when registering it as an output
 */
public record ProcedureParameter(String name, Direction direction, int sqlType) {

    public enum Direction {
        IN,
        OUT,
        INOUT,
        RETURN;

        /**
         * Maps a {@code COLUMN_TYPE} value from {@link DatabaseMetaData#getProcedureColumns}.
         */
        public static Direction fromColumnType(int columnType) {
            return switch (columnType) {
                case DatabaseMetaData.procedureColumnOut -> OUT;
                case DatabaseMetaData.procedureColumnInOut -> INOUT;
                case DatabaseMetaData.procedureColumnReturn -> RETURN;
                default -> IN;
            };
        }
    }

    public boolean isOutput() {
        return direction == Direction.OUT || direction == Direction.INOUT;
    }

    /**
     * True when a caller-supplied key names this parameter. The {@code @} prefix is optional
     * and SQL Server parameter names are case-insensitive.
     */
    public boolean matches(String parameterKey) {
        return stripPrefix(name).equalsIgnoreCase(stripPrefix(parameterKey.trim()));
    }

    private static String stripPrefix(String parameterName) {
        return parameterName.startsWith("@") ? parameterName.substring(1) : parameterName;
    }
}
