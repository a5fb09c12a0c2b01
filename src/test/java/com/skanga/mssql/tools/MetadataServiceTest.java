package com.skanga.mssql.tools;

import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.OperationResult;
import com.skanga.mssql.routine.RoutineReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetadataServiceTest {
    @Mock
    private ConnectionProvider connectionProvider;

    @Mock
    private Connection dbConn;

    @Mock
    private PreparedStatement prepStmt;

    @Mock
    private ResultSet resultSet;

    private MetadataService metadataService;

    @BeforeEach
    void setUp() {
        metadataService = new MetadataService(connectionProvider, 15);
    }

    @Test
    void testListStoredProceduresQualifiesNames() throws SQLException {
        when(connectionProvider.acquire("Sales")).thenReturn(dbConn);
        when(dbConn.prepareStatement(CatalogQueries.LIST_PROCEDURES)).thenReturn(prepStmt);
        when(prepStmt.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString(1)).thenReturn("dbo", "sales");
        when(resultSet.getString(2)).thenReturn("GetOrders", "Refund");

        OperationResult operationResult = metadataService.listStoredProcedures("Sales");

        assertTrue(operationResult.success());
        assertEquals(List.of("dbo.GetOrders", "sales.Refund"), operationResult.data());
        verify(prepStmt).setQueryTimeout(15);
        verify(dbConn).close();
    }

    @Test
    void testMissingProcedureIsReportedByName() throws SQLException {
        when(connectionProvider.acquire()).thenReturn(dbConn);
        when(dbConn.prepareStatement(CatalogQueries.PROCEDURE_INFO)).thenReturn(prepStmt);
        when(prepStmt.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(mock(ResultSetMetaData.class));

        OperationResult operationResult = metadataService.describeStoredProcedure("dbo.Missing", null);

        assertFalse(operationResult.success());
        assertEquals("Stored procedure 'dbo.Missing' not found.", operationResult.error());
        verify(prepStmt).setString(1, "Missing");
        verify(prepStmt).setString(2, "dbo");
        verify(prepStmt).setString(3, "dbo");
        verify(dbConn).close();
    }

    @Test
    void testTableFunctionDescriptionIncludesColumns() throws SQLException {
        PreparedStatement infoStmt = mock(PreparedStatement.class);
        ResultSet infoResultSet = mock(ResultSet.class);
        ResultSetMetaData infoMetaData = mock(ResultSetMetaData.class);

        when(connectionProvider.acquire()).thenReturn(dbConn);
        when(dbConn.prepareStatement(anyString())).thenReturn(prepStmt);
        when(dbConn.prepareStatement(CatalogQueries.FUNCTION_INFO)).thenReturn(infoStmt);
        when(prepStmt.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(mock(ResultSetMetaData.class));

        when(infoStmt.executeQuery()).thenReturn(infoResultSet);
        when(infoResultSet.getMetaData()).thenReturn(infoMetaData);
        when(infoMetaData.getColumnCount()).thenReturn(2);
        when(infoMetaData.getColumnLabel(1)).thenReturn("name");
        when(infoMetaData.getColumnLabel(2)).thenReturn("type");
        when(infoResultSet.next()).thenReturn(true, false);
        when(infoResultSet.getObject(1)).thenReturn("TopCustomers");
        when(infoResultSet.getObject(2)).thenReturn("IF");

        OperationResult operationResult = metadataService.describeFunction("TopCustomers", null);

        assertTrue(operationResult.success(), operationResult.error());
        @SuppressWarnings("unchecked")
        Map<String, Object> description = (Map<String, Object>) operationResult.data();
        assertEquals(Map.of("name", "TopCustomers", "type", "IF"), description.get("function"));
        assertEquals(List.of(), description.get("table_columns"));
        assertEquals(List.of(), description.get("parameters"));
        assertFalse(description.containsKey("return_type"));
        assertFalse(description.containsKey("definition"));
        verify(infoStmt).setString(1, "TopCustomers");
        verify(infoStmt).setString(2, null);
    }

    @Test
    void testConnectionFailureBecomesErrorEnvelope() throws SQLException {
        when(connectionProvider.acquire()).thenThrow(new SQLException("Login failed for user 'sa'.", "28000"));

        OperationResult operationResult = metadataService.listDatabases();

        assertFalse(operationResult.success());
        assertEquals("Login failed for user 'sa'.", operationResult.error());
    }

    @Test
    void testLookupParameters() {
        assertArrayEquals(new String[]{"Orders", "sales", "sales"},
                MetadataService.lookupParameters(RoutineReference.parse("[sales].[Orders]")));
        assertArrayEquals(new String[]{"Orders", null, null},
                MetadataService.lookupParameters(RoutineReference.parse("Orders")));
    }
}
