package com.skanga.mssql.config;

/**
 * Database connection and pool settings.
 *
 * @param dbUrl                    JDBC URL of the SQL Server instance
 * @param dbUser                   login name
 * @param dbPass                   login password
 * @param dbDriver                 JDBC driver class
 * @param maxConnections           pool size
 * @param connectionTimeoutMs      wait for a pooled connection
 * @param queryTimeoutSeconds      per-statement timeout
 * @param idleTimeoutMs            idle connection eviction
 * @param maxLifetimeMs            connection retirement
 * @param leakDetectionThresholdMs pool leak warning threshold
 */
public record ConfigParams(
        String dbUrl,
        String dbUser,
        String dbPass,
        String dbDriver,
        int maxConnections,
        int connectionTimeoutMs,
        int queryTimeoutSeconds,
        int idleTimeoutMs,
        int maxLifetimeMs,
        int leakDetectionThresholdMs) {
    public static final String SQLSERVER_DRIVER = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    public ConfigParams {
        if (dbUrl == null || dbUrl.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.url.missing"));
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.positive.required", "MAX_CONNECTIONS", maxConnections));
        }
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.positive.required", "QUERY_TIMEOUT_SECONDS", queryTimeoutSeconds));
        }
    }

    /**
     * Settings with default pool sizing and timeouts.
     */
    public static ConfigParams defaultConfig(String dbUrl, String dbUser, String dbPass, String dbDriver) {
        return new ConfigParams(dbUrl, dbUser, dbPass, dbDriver, 10, 30000, 30, 600000, 1800000, 20000);
    }

    /**
     * Masks the password and any {@code password=} property in a JDBC URL for logging.
     */
    public String maskSensitive(String text) {
        if (text == null) {
            return null;
        }
        String maskedText = text.replaceAll("(?i)(password|pwd)=([^;&]*)", "$1=***");
        if (dbPass != null && !dbPass.isEmpty()) {
            maskedText = maskedText.replace(dbPass, "***");
        }
        return maskedText;
    }

    @Override
    public String toString() {
        return "ConfigParams[dbUrl=" + maskSensitive(dbUrl) + ", dbUser=" + dbUser + ", dbDriver=" + dbDriver +
                ", maxConnections=" + maxConnections + ", queryTimeoutSeconds=" + queryTimeoutSeconds + "]";
    }
}
