package com.skanga.mssql.routine;

/**
 * Chooses the SQL Server type used to declare the intermediate variable holding a value.
 */
public final class SqlTypeInferencer {
    static final int MIN_TEXT_LENGTH = 50;
    static final int MAX_SIZED_TEXT_LENGTH = 4000;

    private SqlTypeInferencer() {
    }

    public static String sqlTypeFor(ParameterValue parameterValue) {
        return switch (parameterValue.kind()) {
            case NULL -> "SQL_VARIANT";
            case INT32 -> "INT";
            case INT64 -> "BIGINT";
            case DECIMAL -> "DECIMAL(38,10)";
            case FLOAT64 -> "FLOAT";
            case BOOL -> "BIT";
            case TEXT -> textType((String) parameterValue.value());
            case TEMPORAL -> "DATETIME2";
        };
    }

    // NVARCHAR(n) tops out at 4000, longer values need MAX
    private static String textType(String textValue) {
        int declaredLength = Math.max(textValue.length() * 2, MIN_TEXT_LENGTH);
        return declaredLength > MAX_SIZED_TEXT_LENGTH ? "NVARCHAR(MAX)" : "NVARCHAR(" + declaredLength + ")";
    }
}
