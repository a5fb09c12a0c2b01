package com.skanga.mssql.tools;

import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataServiceTest {
    @Mock
    private ConnectionProvider connectionProvider;

    @Mock
    private Connection dbConn;

    @Mock
    private Statement statement;

    private DataService dataService;

    @BeforeEach
    void setUp() {
        dataService = new DataService(connectionProvider, 0);
    }

    @Test
    void testCreateTableReportsZeroRows() throws SQLException {
        String createText = "CREATE TABLE dbo.Audit (Id INT PRIMARY KEY)";
        when(connectionProvider.acquire("Sales")).thenReturn(dbConn);
        when(dbConn.createStatement()).thenReturn(statement);
        when(statement.executeUpdate(createText)).thenReturn(0);

        OperationResult operationResult = dataService.createTable(createText, "Sales");

        assertTrue(operationResult.success());
        assertEquals(0, operationResult.rowsAffected());
        assertNull(operationResult.data());
        verify(statement).close();
        verify(dbConn).close();
    }

    @Test
    void testDropTableQuotesName() throws SQLException {
        when(connectionProvider.acquire()).thenReturn(dbConn);
        when(dbConn.createStatement()).thenReturn(statement);
        when(statement.executeUpdate("DROP TABLE IF EXISTS [sales].[Old Orders]")).thenReturn(0);

        OperationResult operationResult = dataService.dropTable("sales.Old Orders", null);

        assertTrue(operationResult.success());
        assertEquals(0, operationResult.rowsAffected());
    }

    @Test
    void testDropTableRejectsEmptyName() {
        OperationResult operationResult = dataService.dropTable("", null);

        assertFalse(operationResult.success());
        verifyNoInteractions(connectionProvider);
    }

    @Test
    void testInsertAndUpdateReportAffectedRows() throws SQLException {
        when(connectionProvider.acquire()).thenReturn(dbConn);
        when(dbConn.createStatement()).thenReturn(statement);
        when(statement.executeUpdate("INSERT INTO dbo.Orders VALUES (1), (2), (3)")).thenReturn(3);
        when(statement.executeUpdate("UPDATE dbo.Orders SET Status = 'x' WHERE 1 = 0")).thenReturn(0);

        assertEquals(3, dataService.insertData("INSERT INTO dbo.Orders VALUES (1), (2), (3)", null).rowsAffected());
        assertEquals(0, dataService.updateData("UPDATE dbo.Orders SET Status = 'x' WHERE 1 = 0", null).rowsAffected());
    }

    @Test
    void testStatementFailureBecomesErrorEnvelope() throws SQLException {
        String insertText = "INSERT INTO dbo.Missing VALUES (1)";
        when(connectionProvider.acquire()).thenReturn(dbConn);
        when(dbConn.createStatement()).thenReturn(statement);
        when(statement.executeUpdate(insertText)).thenThrow(new SQLException("Invalid object name 'dbo.Missing'."));

        OperationResult operationResult = dataService.insertData(insertText, null);

        assertFalse(operationResult.success());
        assertEquals("Invalid object name 'dbo.Missing'.", operationResult.error());
        assertNull(operationResult.rowsAffected());
        verify(dbConn).close();
    }
}
