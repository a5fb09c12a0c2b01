package com.skanga.mssql.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParamsTest {

    @Test
    void defaultConfigUsesPoolDefaults() {
        ConfigParams config = ConfigParams.defaultConfig("jdbc:sqlserver://localhost:1433", "sa", "pw",
                ConfigParams.SQLSERVER_DRIVER);

        assertThat(config.maxConnections()).isEqualTo(10);
        assertThat(config.connectionTimeoutMs()).isEqualTo(30000);
        assertThat(config.queryTimeoutSeconds()).isEqualTo(30);
        assertThat(config.leakDetectionThresholdMs()).isEqualTo(20000);
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> ConfigParams.defaultConfig(" ", "sa", "", ConfigParams.SQLSERVER_DRIVER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Database URL is required");
    }

    @Test
    void negativeQueryTimeoutIsRejected() {
        assertThatThrownBy(() -> new ConfigParams("jdbc:sqlserver://localhost", "sa", "", ConfigParams.SQLSERVER_DRIVER,
                10, 30000, -1, 600000, 1800000, 20000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("QUERY_TIMEOUT_SECONDS");
    }

    @Test
    void maskSensitiveHidesPasswords() {
        ConfigParams config = ConfigParams.defaultConfig(
                "jdbc:sqlserver://db:1433;user=app;password=S3cret!;encrypt=true", "app", "S3cret!",
                ConfigParams.SQLSERVER_DRIVER);

        assertThat(config.maskSensitive(config.dbUrl()))
                .isEqualTo("jdbc:sqlserver://db:1433;user=app;password=***;encrypt=true");
        assertThat(config.maskSensitive("login failed for S3cret!")).isEqualTo("login failed for ***");
        assertThat(config.maskSensitive(null)).isNull();
        assertThat(config.toString()).doesNotContain("S3cret!");
    }
}
