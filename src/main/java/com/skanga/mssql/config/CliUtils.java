package com.skanga.mssql.config;

import com.skanga.mssql.McpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Driver;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line handling: argument parsing, help and version output, and layered configuration loading.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "MSSQL MCP";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "MCP server for SQL Server catalog, data and routine tools";

    static final String DEFAULT_DB_URL = "jdbc:sqlserver://localhost:1433;encrypt=false";
    static final String DEFAULT_DB_USER = "sa";
    static final String DEFAULT_DB_PASSWORD = "";
    static final String DEFAULT_DB_DRIVER = ConfigParams.SQLSERVER_DRIVER;

    /**
     * Maps short form arguments to their long form equivalents.
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("h", "help");
        shortToLong.put("v", "version");

        shortToLong.put("c", "config_file");
        shortToLong.put("m", "http_mode");
        shortToLong.put("b", "bind_address");
        shortToLong.put("p", "http_port");

        shortToLong.put("u", "db_url");
        shortToLong.put("U", "db_user");
        shortToLong.put("P", "db_password");
        shortToLong.put("d", "db_driver");

        shortToLong.put("C", "max_connections");
        shortToLong.put("t", "connection_timeout_ms");
        shortToLong.put("i", "idle_timeout_ms");
        shortToLong.put("l", "max_lifetime_ms");
        shortToLong.put("L", "leak_detection_threshold_ms");

        shortToLong.put("q", "query_timeout_seconds");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a map keyed by upper-case long option names.
     * Accepts {@code -k=value}, {@code -k value}, {@code --key=value}, {@code --key value}
     * and bare flags, which are read as {@code true}.
     *
     * @param args command line arguments
     * @return upper-case keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey = null;
            String argValue;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);
                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    argKey = argParts[0];
                    argValue = argParts[1];
                } else {
                    argKey = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);
                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    argKey = shortToLong.get(argParts[0]);
                    argValue = argParts[1];
                } else {
                    argKey = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
            } else {
                logger.debug("Ignoring positional argument: {}", currArg);
                continue;
            }

            if (argKey != null) {
                argsMap.put(argKey.toUpperCase(), argValue);
            } else {
                logger.warn("Unknown option: {}", currArg);
            }
        }

        return argsMap;
    }

    /**
     * Prints help or version output if requested.
     *
     * @return true if something was printed and the caller should exit
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        String jarName = "mssql-mcp-" + SERVER_VERSION + ".jar";
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println("Usage: java -jar " + jarName + " [OPTIONS]");
        System.out.println();
        System.out.println("ARGUMENT FORMATS:");
        System.out.println("  -k=value  or  --key=value");
        System.out.println("  -k value  or  --key value");
        System.out.println("  -k        or  --key           (flags, defaults to true)");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                     Show this help message and exit");
        System.out.println("  -v, --version                  Show version information and exit");
        System.out.println("  -c, --config_file=<path>       Load configuration from file");
        System.out.println("  -m, --http_mode=<true|false>   Run in HTTP mode (default: false, uses stdio)");
        System.out.println("  -b, --bind_address=<address>   HTTP bind address (default: localhost)");
        System.out.println("  -p, --http_port=<port>         HTTP port number (default: 8080)");
        System.out.println();
        System.out.println("DATABASE CONFIGURATION:");
        System.out.println("  -u, --db_url=<url>             JDBC URL (default: " + DEFAULT_DB_URL + ")");
        System.out.println("  -U, --db_user=<username>       Login name (default: sa)");
        System.out.println("  -P, --db_password=<password>   Login password (default: empty)");
        System.out.println("  -d, --db_driver=<class>        JDBC driver class (default: " + DEFAULT_DB_DRIVER + ")");
        System.out.println();
        System.out.println("CONNECTION POOL SETTINGS:");
        System.out.println("  -C, --max_connections=<num>    Maximum connections (default: 10)");
        System.out.println("  -t, --connection_timeout_ms=<ms>  Connection timeout (default: 30000)");
        System.out.println("  -i, --idle_timeout_ms=<ms>     Idle timeout (default: 600000)");
        System.out.println("  -l, --max_lifetime_ms=<ms>     Max connection lifetime (default: 1800000)");
        System.out.println("  -L, --leak_detection_threshold_ms=<ms>  Leak detection (default: 20000)");
        System.out.println();
        System.out.println("QUERY SETTINGS:");
        System.out.println("  -q, --query_timeout_seconds=<sec>  Statement timeout, 0 for none (default: 30)");
        System.out.println();
        System.out.println("EXAMPLES:");
        System.out.println("  java -jar " + jarName + " -u \"jdbc:sqlserver://db:1433;databaseName=Sales;encrypt=false\" -U app -P secret");
        System.out.println("  java -jar " + jarName + " --http_mode --http_port 9090");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + McpServer.DEFAULT_PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
        System.out.println();
        showJdbcDrivers();
    }

    /**
     * Lists the JDBC drivers registered with {@link DriverManager}.
     */
    private static void showJdbcDrivers() {
        System.out.println("Available JDBC Drivers:");

        Map<String, String> foundDrivers = new LinkedHashMap<>();
        Enumeration<Driver> drivers = DriverManager.getDrivers();
        while (drivers.hasMoreElements()) {
            Driver driver = drivers.nextElement();
            String driverClass = driver.getClass().getName().trim();
            foundDrivers.put(driverClass, String.format("%s v%d.%d",
                    driverClass, driver.getMajorVersion(), driver.getMinorVersion()));
        }

        if (foundDrivers.isEmpty()) {
            System.out.println("  No JDBC drivers found in classpath");
        } else {
            List<String> sortedDrivers = new ArrayList<>(foundDrivers.values());
            sortedDrivers.sort(String.CASE_INSENSITIVE_ORDER);
            for (String driverInfo : sortedDrivers) {
                System.out.println(" - " + driverInfo);
            }
        }
    }

    /**
     * Loads configuration with priority CLI args ({@code --db_url}) &gt; config file &gt;
     * environment variables ({@code DB_URL}) &gt; system properties ({@code -Ddb.url=}) &gt; defaults.
     *
     * @param args command line arguments
     * @return validated configuration
     * @throws IOException if the config file cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed or fails validation
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException("Failed to load configuration file: " + configFile, e);
            }
        }

        String dbUrl = getConfigValue("DB_URL", DEFAULT_DB_URL, cliArgs, fileConfig);
        String dbUser = getConfigValue("DB_USER", DEFAULT_DB_USER, cliArgs, fileConfig);
        String dbPassword = getConfigValue("DB_PASSWORD", DEFAULT_DB_PASSWORD, cliArgs, fileConfig);
        String dbDriver = getConfigValue("DB_DRIVER", DEFAULT_DB_DRIVER, cliArgs, fileConfig);
        String maxConnections = getConfigValue("MAX_CONNECTIONS", "10", cliArgs, fileConfig);
        String connectionTimeoutMs = getConfigValue("CONNECTION_TIMEOUT_MS", "30000", cliArgs, fileConfig);
        String queryTimeoutSeconds = getConfigValue("QUERY_TIMEOUT_SECONDS", "30", cliArgs, fileConfig);
        String idleTimeoutMs = getConfigValue("IDLE_TIMEOUT_MS", "600000", cliArgs, fileConfig);
        String maxLifetimeMs = getConfigValue("MAX_LIFETIME_MS", "1800000", cliArgs, fileConfig);
        String leakDetectionThresholdMs = getConfigValue("LEAK_DETECTION_THRESHOLD_MS", "20000", cliArgs, fileConfig);

        try {
            return new ConfigParams(dbUrl, dbUser, dbPassword, dbDriver,
                    parseIntegerConfig("MAX_CONNECTIONS", maxConnections),
                    parseIntegerConfig("CONNECTION_TIMEOUT_MS", connectionTimeoutMs),
                    parseIntegerConfig("QUERY_TIMEOUT_SECONDS", queryTimeoutSeconds),
                    parseIntegerConfig("IDLE_TIMEOUT_MS", idleTimeoutMs),
                    parseIntegerConfig("MAX_LIFETIME_MS", maxLifetimeMs),
                    parseIntegerConfig("LEAK_DETECTION_THRESHOLD_MS", leakDetectionThresholdMs));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.validation.failed", "configuration parameters", e.getMessage()), e);
        }
    }

    public static boolean isHttpMode(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return parseBooleanConfig("HTTP_MODE", getConfigValue("HTTP_MODE", "false", cliArgs, null));
    }

    public static String getBindAddress(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return getConfigValue("BIND_ADDRESS", "localhost", cliArgs, null);
    }

    public static int getHttpPort(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return parseIntegerConfig("HTTP_PORT", getConfigValue("HTTP_PORT", "8080", cliArgs, null));
    }

    // CLI args > config file > env vars > system properties > default
    private static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs,
                                         Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName.toUpperCase());
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName.toUpperCase());
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(varName);
        if (envValue != null) {
            return envValue;
        }

        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    /**
     * Loads {@code KEY=VALUE} lines from a file. Blank lines and lines starting with {@code #}
     * are skipped; surrounding single or double quotes are removed from values.
     *
     * @param configFilePath path to the configuration file
     * @return upper-case keys to values
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = Files.newBufferedReader(Path.of(configFilePath), StandardCharsets.UTF_8)) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();
                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if (paramValue.length() >= 2 && ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                        || (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }

    static boolean parseBooleanConfig(String paramName, String value) {
        if (value == null) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.boolean.failed", paramName, "null"));
        }

        String lowerValue = value.toLowerCase().trim();
        if ("true".equals(lowerValue) || "false".equals(lowerValue)) {
            return Boolean.parseBoolean(lowerValue);
        }
        throw new IllegalArgumentException(
                ResourceManager.getErrorMessage("config.parse.boolean.failed", paramName, value));
    }
}
