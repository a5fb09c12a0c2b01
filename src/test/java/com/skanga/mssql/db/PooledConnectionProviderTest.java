package com.skanga.mssql.db;

import com.skanga.mssql.config.ConfigParams;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PooledConnectionProviderTest {

    private static ConfigParams h2Config(String name) {
        return ConfigParams.defaultConfig("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "sa", "", "org.h2.Driver");
    }

    @Test
    void testAcquireReturnsWorkingConnection() throws SQLException {
        try (PooledConnectionProvider connectionProvider = new PooledConnectionProvider(h2Config("pooltest"))) {
            try (Connection dbConn = connectionProvider.acquire();
                 Statement statement = dbConn.createStatement();
                 ResultSet resultSet = statement.executeQuery("SELECT 42")) {
                assertTrue(resultSet.next());
                assertEquals(42, resultSet.getInt(1));
            }
            try (Connection dbConn = connectionProvider.acquire("  ")) {
                assertFalse(dbConn.isClosed());
            }
        }
    }

    @Test
    void testUnknownDriverFails() {
        ConfigParams config = ConfigParams.defaultConfig("jdbc:h2:mem:nodriver", "sa", "", "com.example.NoSuchDriver");

        RuntimeException exception = assertThrows(RuntimeException.class, () -> new PooledConnectionProvider(config));
        assertTrue(exception.getMessage().contains("JDBC driver class not found: com.example.NoSuchDriver"));
    }

    @Test
    void testAcquireSwitchesCatalog() throws SQLException {
        HikariDataSource dataSource = mock(HikariDataSource.class);
        Connection dbConn = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(dbConn);

        PooledConnectionProvider connectionProvider = new PooledConnectionProvider(dataSource);

        assertSame(dbConn, connectionProvider.acquire(" Sales "));
        verify(dbConn).setCatalog("Sales");
        verify(dbConn, never()).close();
    }

    @Test
    void testFailedCatalogSwitchReleasesConnection() throws SQLException {
        HikariDataSource dataSource = mock(HikariDataSource.class);
        Connection dbConn = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(dbConn);
        doThrow(new SQLException("Database 'Nope' does not exist.", "S0001")).when(dbConn).setCatalog("Nope");

        PooledConnectionProvider connectionProvider = new PooledConnectionProvider(dataSource);

        SQLException exception = assertThrows(SQLException.class, () -> connectionProvider.acquire("Nope"));
        assertEquals("Database 'Nope' does not exist.", exception.getMessage());
        verify(dbConn).close();
    }

    @Test
    void testIsConnectionError() {
        assertTrue(PooledConnectionProvider.isConnectionError(new SQLException("link failure", "08S01")));
        assertFalse(PooledConnectionProvider.isConnectionError(new SQLException("syntax", "42000")));
        assertFalse(PooledConnectionProvider.isConnectionError(new SQLException("no state")));
    }
}
