package com.skanga.mssql.db;

import com.skanga.mssql.config.ConfigParams;
import com.skanga.mssql.config.ResourceManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection provider backed by a HikariCP pool.
 * A connection acquired for a named database has its catalog switched; the pool restores
 * the default catalog when the connection is returned.
 */
public class PooledConnectionProvider implements ConnectionProvider {
    private static final Logger logger = LoggerFactory.getLogger(PooledConnectionProvider.class);
    static final String APPLICATION_NAME = "MSSQL-MCP-Server";

    private final HikariDataSource dataSource;

    /**
     * Creates the pool and checks that a connection can be opened.
     *
     * @param configParams connection and pool settings
     * @throws RuntimeException if the driver cannot be loaded or the database is unreachable
     */
    public PooledConnectionProvider(ConfigParams configParams) {
        loadDriver(configParams.dbDriver());

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(configParams.dbUrl());
        poolConfig.setUsername(configParams.dbUser());
        poolConfig.setPassword(configParams.dbPass());
        poolConfig.setDriverClassName(configParams.dbDriver());
        poolConfig.setMaximumPoolSize(configParams.maxConnections());
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setIdleTimeout(configParams.idleTimeoutMs());
        poolConfig.setMaxLifetime(configParams.maxLifetimeMs());
        poolConfig.setLeakDetectionThreshold(configParams.leakDetectionThresholdMs());
        poolConfig.setConnectionTestQuery("SELECT 1");
        poolConfig.setValidationTimeout(5000);
        poolConfig.setMinimumIdle(Math.max(1, configParams.maxConnections() / 4));
        poolConfig.setPoolName("MssqlMcpPool-" + System.currentTimeMillis());
        if (configParams.dbUrl().startsWith("jdbc:sqlserver:")) {
            poolConfig.addDataSourceProperty("applicationName", APPLICATION_NAME);
        }

        logger.info("Initializing connection pool with settings - Max: {}, Idle: {}, Timeout: {}ms",
                configParams.maxConnections(), poolConfig.getMinimumIdle(), configParams.connectionTimeoutMs());
        this.dataSource = new HikariDataSource(poolConfig);

        try (Connection ignored = dataSource.getConnection()) {
            logger.info("Database connection pool initialized for: {}", configParams.maskSensitive(configParams.dbUrl()));
        } catch (SQLException e) {
            logger.error("Failed to initialize connection pool: {}", configParams.maskSensitive(configParams.dbUrl()), e);
            dataSource.close();
            throw new RuntimeException(ResourceManager.getErrorMessage("database.pool.init.failed",
                    configParams.maskSensitive(configParams.dbUrl())), e);
        }
    }

    /**
     * Wraps an existing pool. Useful for tests or when the pool is managed elsewhere.
     */
    public PooledConnectionProvider(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Connection acquire() throws SQLException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            if (isConnectionError(e)) {
                logPoolStatistics();
            }
            throw e;
        }
    }

    @Override
    public Connection acquire(String databaseName) throws SQLException {
        Connection dbConn = acquire();
        if (databaseName == null || databaseName.isBlank()) {
            return dbConn;
        }
        try {
            dbConn.setCatalog(databaseName.trim());
            logger.debug("Switched connection to database {}", databaseName);
            return dbConn;
        } catch (SQLException e) {
            logger.warn("Could not switch to database {}: {}", databaseName, e.getMessage());
            try {
                dbConn.close();
            } catch (SQLException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            try {
                dataSource.close();
                logger.info("Database connection pool closed");
            } catch (Exception e) {
                logger.warn("Error closing database connection pool: {}", e.getMessage(), e);
            }
        }
    }

    private static void loadDriver(String driverClass) {
        try {
            Class.forName(driverClass);
            logger.info("Database driver loaded successfully: {}", driverClass);
        } catch (ClassNotFoundException e) {
            logger.error("Failed to load database driver '{}'", driverClass, e);
            throw new RuntimeException(ResourceManager.getErrorMessage("database.driver.not.found", driverClass), e);
        } catch (LinkageError e) {
            logger.error("Database driver '{}' has linkage problems: {}", driverClass, e.getMessage(), e);
            throw new RuntimeException("Database driver has incompatible dependencies: " + driverClass, e);
        }
    }

    // SQLState class 08 is a connection exception
    static boolean isConnectionError(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    private void logPoolStatistics() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        if (poolBean != null) {
            logger.warn("Connection error; pool stats - Active: {}, Idle: {}, Total: {}, Waiting: {}",
                    poolBean.getActiveConnections(),
                    poolBean.getIdleConnections(),
                    poolBean.getTotalConnections(),
                    poolBean.getThreadsAwaitingConnection());
        }
    }
}
