package com.skanga.mssql.routine;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class SqlTypeInferencerTest {

    @Test
    void testFixedTypes() {
        assertEquals("SQL_VARIANT", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofNull("p")));
        assertEquals("INT", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofInt("p", 7)));
        assertEquals("BIGINT", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofLong("p", 1L << 40)));
        assertEquals("DECIMAL(38,10)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofDecimal("p", new BigDecimal("1.5"))));
        assertEquals("FLOAT", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofDouble("p", 1e40)));
        assertEquals("BIT", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofBoolean("p", false)));
        assertEquals("DATETIME2", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofTemporal("p", LocalDateTime.now())));
    }

    @Test
    void testTextLengths() {
        assertEquals("NVARCHAR(50)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofText("p", "")));
        assertEquals("NVARCHAR(50)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofText("p", "x".repeat(25))));
        assertEquals("NVARCHAR(52)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofText("p", "x".repeat(26))));
        assertEquals("NVARCHAR(4000)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofText("p", "x".repeat(2000))));
        assertEquals("NVARCHAR(MAX)", SqlTypeInferencer.sqlTypeFor(ParameterValue.ofText("p", "x".repeat(2001))));
    }
}
