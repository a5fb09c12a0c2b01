package com.skanga.mssql.routine;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchBuilderTest {
    private final BatchBuilder batchBuilder = new BatchBuilder();
    private final ParameterBinder parameterBinder = new ParameterBinder();

    @Test
    void testScalarFunctionWithVariables() {
        Map<String, ParameterValue> parameterValues = new LinkedHashMap<>();
        parameterValues.put("@amount", ParameterValue.ofDecimal("@amount", new BigDecimal("100.00")));
        parameterValues.put("@rate", ParameterValue.ofDecimal("@rate", new BigDecimal("0.08")));

        String batchText = batchBuilder.render(RoutineReference.parse("dbo.AddTax"),
                InvocationStyle.SCALAR_FUNCTION, parameterBinder.planVariables(parameterValues));

        assertEquals("DECLARE @v0 DECIMAL(38,10); DECLARE @v1 DECIMAL(38,10); " +
                "SET @v0 = ?; SET @v1 = ?; SELECT [dbo].[AddTax](@v0, @v1) AS Result", batchText);
    }

    @Test
    void testZeroArgumentCalls() {
        RoutineReference routine = RoutineReference.parse("dbo.Now");

        assertEquals("SELECT [dbo].[Now]() AS Result",
                batchBuilder.render(routine, InvocationStyle.SCALAR_FUNCTION, BatchPlan.empty()));
        assertEquals("SELECT * FROM [dbo].[Now]()",
                batchBuilder.render(routine, InvocationStyle.TABLE_FUNCTION, BatchPlan.empty()));
        assertEquals("{? = call [dbo].[Now]()}",
                batchBuilder.render(routine, InvocationStyle.PROCEDURE, BatchPlan.empty()));
    }

    @Test
    void testTableFunctionWithVariables() {
        Map<String, ParameterValue> parameterValues = new LinkedHashMap<>();
        parameterValues.put("@region", ParameterValue.ofText("@region", "EU"));

        String batchText = batchBuilder.render(RoutineReference.parse("sales.TopCustomers"),
                InvocationStyle.TABLE_FUNCTION, parameterBinder.planVariables(parameterValues));

        assertEquals("DECLARE @v0 NVARCHAR(50); SET @v0 = ?; SELECT * FROM [sales].[TopCustomers](@v0)", batchText);
    }

    @Test
    void testLiteralArgumentsAreSplicedUnchanged() {
        String batchText = batchBuilder.render(RoutineReference.parse("dbo.AddTax"),
                InvocationStyle.SCALAR_FUNCTION, BatchPlan.literal("  100.00, 0.08 "));

        assertEquals("SELECT [dbo].[AddTax](100.00, 0.08) AS Result", batchText);
    }

    @Test
    void testProcedureCallWithOutputPlaceholders() {
        Map<String, ParameterValue> parameterValues = new LinkedHashMap<>();
        parameterValues.put("@OrderId", ParameterValue.ofInt("@OrderId", 7));

        BatchPlan batchPlan = parameterBinder.planNamed(parameterValues).withPlaceholders(2);

        assertEquals(List.of("?", "?", "?"), batchPlan.arguments());
        assertEquals("{? = call [dbo].[UpdateOrder](?, ?, ?)}",
                batchBuilder.render(RoutineReference.parse("dbo.UpdateOrder"), InvocationStyle.PROCEDURE, batchPlan));
    }

    @Test
    void testMismatchedPlanIsRejected() {
        assertThrows(IllegalStateException.class, () -> new BatchPlan(
                List.of(new BatchPlan.Declaration("@v0", "INT")),
                List.of(),
                List.of(),
                List.of("@v0")));
        assertThrows(IllegalStateException.class, () -> new BatchPlan(
                List.of(new BatchPlan.Declaration("@v0", "INT")),
                List.of(new BatchPlan.Assignment("@v1", "@p0")),
                List.of(),
                List.of("@v0")));
    }
}
