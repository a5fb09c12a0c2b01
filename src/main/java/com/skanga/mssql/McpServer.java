package com.skanga.mssql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skanga.mssql.config.CliUtils;
import com.skanga.mssql.config.ConfigParams;
import com.skanga.mssql.config.ResourceManager;
import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.OperationResult;
import com.skanga.mssql.db.PooledConnectionProvider;
import com.skanga.mssql.routine.RoutineInvoker;
import com.skanga.mssql.tools.DataService;
import com.skanga.mssql.tools.MetadataService;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP server exposing SQL Server catalog, data and routine tools over JSON-RPC 2.0.
 * Supports stdio and HTTP transports.
 *
 * <p>Every tool returns its {@link OperationResult} envelope as a single text content item;
 * {@code isError} mirrors the envelope's {@code success} flag. Protocol problems such as an
 * unknown tool or a missing required argument are reported as JSON-RPC errors instead.
 */
public class McpServer {
    public static final String DEFAULT_PROTOCOL_VERSION = "2025-11-25";
    public static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            DEFAULT_PROTOCOL_VERSION,
            "2025-06-18"
    );
    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final ObjectMapper envelopeMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ConnectionProvider connectionProvider;
    private final int queryTimeoutSeconds;
    private final MetadataService metadataService;
    private final DataService dataService;
    private final RoutineInvoker routineInvoker;
    private final Map<String, Object> serverInfo;

    private enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;
    private ObjectNode clientCapabilities = null;

    /**
     * Creates a server backed by a connection pool built from the configuration.
     *
     * @param configParams database configuration
     * @throws RuntimeException if the pool cannot be initialized
     */
    public McpServer(ConfigParams configParams) {
        this.queryTimeoutSeconds = configParams.queryTimeoutSeconds();
        this.connectionProvider = createConnectionProvider(configParams);
        this.metadataService = new MetadataService(connectionProvider, queryTimeoutSeconds);
        this.dataService = new DataService(connectionProvider, queryTimeoutSeconds);
        this.routineInvoker = new RoutineInvoker(connectionProvider, queryTimeoutSeconds);
        this.serverInfo = createServerInfo();
    }

    /**
     * Creates a server over an existing connection provider.
     *
     * @param connectionProvider  source of connections
     * @param queryTimeoutSeconds per-statement timeout, 0 for none
     */
    public McpServer(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        this.connectionProvider = connectionProvider;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.metadataService = new MetadataService(connectionProvider, queryTimeoutSeconds);
        this.dataService = new DataService(connectionProvider, queryTimeoutSeconds);
        this.routineInvoker = new RoutineInvoker(connectionProvider, queryTimeoutSeconds);
        this.serverInfo = createServerInfo();
    }

    /**
     * Factory for the connection provider. Subclasses may override it to supply their own.
     */
    protected ConnectionProvider createConnectionProvider(ConfigParams configParams) {
        return new PooledConnectionProvider(configParams);
    }

    /**
     * Starts the HTTP transport: {@code POST /mcp} for requests and {@code GET /health}.
     * Blocks the calling thread until it is interrupted.
     *
     * @param bindAddress address to bind to, e.g. {@code localhost} or {@code 0.0.0.0}
     * @param listenPort  port to listen on
     * @throws IOException if the server cannot be started
     */
    public void startHttpMode(String bindAddress, int listenPort) throws IOException {
        logger.info("Starting MSSQL MCP Server in HTTP mode on {}:{}...", bindAddress, listenPort);

        HttpServer httpServer = null;
        try {
            httpServer = HttpServer.create(new InetSocketAddress(bindAddress, listenPort), 0);
            httpServer.createContext("/mcp", new McpHttpHandler(this));
            httpServer.createContext("/health", new HealthCheckHandler(this));
            httpServer.setExecutor(null);
            httpServer.start();

            logger.info("MCP endpoint: http://{}:{}/mcp", bindAddress, listenPort);
            logger.info("Health check: http://{}:{}/health", bindAddress, listenPort);

            try {
                Thread.currentThread().join();
            } catch (InterruptedException e) {
                logger.info("Server interrupted, shutting down...");
                Thread.currentThread().interrupt();
            }
        } catch (BindException e) {
            logger.error(ResourceManager.getErrorMessage("http.server.port.inuse", listenPort));
            throw new IOException(ResourceManager.getErrorMessage("startup.port.inuse"), e);
        } catch (IOException e) {
            logger.error(ResourceManager.getErrorMessage("http.server.generic.error", listenPort, e.getMessage()));
            throw new IOException(ResourceManager.getErrorMessage("http.server.generic.error", listenPort, ""), e);
        } finally {
            if (httpServer != null) {
                httpServer.stop(1);
                logger.info("HTTP server stopped");
            }
        }
    }

    /**
     * Processes one JSON-RPC message.
     *
     * @param requestNode parsed request
     * @return response node, or null for notifications
     */
    public JsonNode handleRequest(JsonNode requestNode) {
        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");

        boolean isNotification = !requestNode.has("id");
        Object requestId = isNotification ? null : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            enforceLifecycleRules(requestMethod);
            JsonNode resultNode = executeMethod(requestMethod, requestParams);
            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            return handleRequestException(e, requestMethod, isNotification, requestId);
        }
    }

    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals("initialize")) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.not.initialized"));
        }

        if (serverState == ServerState.INITIALIZING && !requestMethod.equals("initialize") &&
                !requestMethod.equals("notifications/initialized")) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.initializing"));
        }

        if (serverState == ServerState.SHUTDOWN) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.shutdown"));
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams) throws Exception {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams);
            case "notifications/initialized" -> handleNotificationInitialized();
            case "tools/list" -> handleListTools();
            case "tools/call" -> handleCallTool(requestParams);
            case "ping" -> handlePing();
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod));
        };
    }

    private JsonNode handleRequestException(Exception theException, String requestMethod, boolean isNotification,
                                            Object requestId) {
        if (isNotification) {
            logExceptionForNotification(theException, requestMethod);
            return null;
        }

        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse("invalid_request", theException.getMessage(), requestId);
        }

        if (theException instanceof IllegalArgumentException) {
            return handleIllegalArgumentException((IllegalArgumentException) theException, requestId);
        }

        logger.error("Unexpected error handling request", theException);
        return createErrorResponse("internal_error", "Internal error: " + theException.getMessage(), requestId);
    }

    private JsonNode handleIllegalArgumentException(IllegalArgumentException theException, Object requestId) {
        String message = theException.getMessage();

        if (message.startsWith("Method not found:")) {
            logger.warn("Method not found: {}", message);
            return createErrorResponse("method_not_found", message, requestId);
        }

        if (message.startsWith("Unsupported protocol version:")) {
            logger.warn("Protocol version mismatch: {}", message);
            return createErrorResponse("invalid_request", message, requestId);
        }

        logger.warn("Invalid request parameters: {}", message);
        return createErrorResponse("invalid_params", message, requestId);
    }

    private void logExceptionForNotification(Exception theException, String requestMethod) {
        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation in notification {}: {}", requestMethod, theException.getMessage());
        } else if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid notification {}: {}", requestMethod, theException.getMessage());
        } else {
            logger.error("Unexpected error in notification {}", requestMethod, theException);
        }
    }

    private JsonNode handleNotificationInitialized() {
        if (serverState != ServerState.INITIALIZING) {
            throw new IllegalStateException(
                    "Received 'initialized' notification but server is not in INITIALIZING state: " + serverState);
        }

        serverState = ServerState.INITIALIZED;
        logger.info("Server initialized and ready for operation");
        return null;
    }

    private JsonNode handlePing() {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("x-mssql-timestamp", System.currentTimeMillis());
        result.put("x-mssql-state", serverState.toString());
        return result;
    }

    /**
     * Starts the stdio transport: one JSON-RPC message per line on stdin, responses on stdout.
     * Returns when stdin is closed.
     *
     * @throws IOException if stdin or stdout fails
     */
    public void startStdioMode() throws IOException {
        startStdioMode(System.in, System.out);
    }

    void startStdioMode(InputStream inputStream, OutputStream outputStream) throws IOException {
        logger.info("Starting MSSQL MCP Server in stdio mode...");

        try (BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
             PrintWriter printWriter = new PrintWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), true)) {
            String currLine;
            while ((currLine = bufferedReader.readLine()) != null) {
                if (!currLine.isBlank()) {
                    processStdioRequest(currLine, printWriter);
                }
            }
        }

        logger.info("MSSQL MCP Server stopped.");
    }

    private void processStdioRequest(String requestLine, PrintWriter printWriter) throws JsonProcessingException {
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.error("Error parsing request: {} - Error: {}", requestLine, e.getOriginalMessage());
            JsonNode errorResponse = createErrorResponse("internal_error",
                    "Internal server error: " + e.getOriginalMessage(), null);
            printWriter.println(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        JsonNode responseNode = handleRequest(requestNode);
        if (responseNode != null) {
            printWriter.println(objectMapper.writeValueAsString(responseNode));
            printWriter.flush();
            logger.debug("Response sent for request ID: {}", requestNode.get("id"));
        }
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        if (serverState != ServerState.UNINITIALIZED) {
            throw new IllegalStateException("Server already initialized or in wrong state: " + serverState);
        }

        String clientProtocolVersion = requestParams != null ?
                requestParams.path("protocolVersion").asText("unknown") : "unknown";
        String negotiatedProtocolVersion = negotiateProtocolVersion(clientProtocolVersion);

        serverState = ServerState.INITIALIZING;
        logger.info("Server initializing with protocol {}", negotiatedProtocolVersion);

        if (requestParams != null && requestParams.path("capabilities").isObject()) {
            clientCapabilities = (ObjectNode) requestParams.get("capabilities");
            logger.debug("Client capabilities: {}", clientCapabilities);
        }

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", negotiatedProtocolVersion);
        resultNode.set("capabilities", createCapabilities());
        resultNode.set("serverInfo", objectMapper.valueToTree(serverInfo));
        return resultNode;
    }

    private String negotiateProtocolVersion(String clientProtocolVersion) {
        if (SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)) {
            return clientProtocolVersion;
        }

        String supportedVersions = String.join(", ", SUPPORTED_PROTOCOL_VERSIONS);
        logger.warn("Protocol version mismatch. Client: {}, Supported: {}", clientProtocolVersion, supportedVersions);
        throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                "protocol.unsupported.version", clientProtocolVersion, supportedVersions));
    }

    private JsonNode handleListTools() {
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", ToolCatalog.listTools());
        return resultNode;
    }

    /**
     * Dispatches a {@code tools/call} request.
     *
     * @param paramsNode {@code name} and {@code arguments}
     * @return MCP tool result
     * @throws IllegalArgumentException if the tool is unknown or a required argument is missing
     * @throws JsonProcessingException  if the envelope cannot be rendered
     */
    JsonNode handleCallTool(JsonNode paramsNode) throws JsonProcessingException {
        String toolName = paramsNode.path("name").asText();
        JsonNode argsNode = paramsNode.path("arguments");

        OperationResult operationResult = switch (toolName) {
            case "list_databases" -> metadataService.listDatabases();
            case "list_stored_procedures" -> metadataService.listStoredProcedures(optionalText(argsNode, "database"));
            case "list_functions" -> metadataService.listFunctions(optionalText(argsNode, "database"));
            case "list_views" -> metadataService.listViews(optionalText(argsNode, "database"));
            case "describe_instance" -> metadataService.describeInstance();
            case "describe_database" -> metadataService.describeDatabase(optionalText(argsNode, "database"));
            case "describe_stored_procedure" -> metadataService.describeStoredProcedure(
                    requiredText(toolName, argsNode, "name"), optionalText(argsNode, "database"));
            case "describe_function" -> metadataService.describeFunction(
                    requiredText(toolName, argsNode, "name"), optionalText(argsNode, "database"));
            case "describe_view" -> metadataService.describeView(
                    requiredText(toolName, argsNode, "name"), optionalText(argsNode, "database"));
            case "create_table" -> dataService.createTable(
                    requiredText(toolName, argsNode, "sql"), optionalText(argsNode, "database"));
            case "drop_table" -> dataService.dropTable(
                    requiredText(toolName, argsNode, "name"), optionalText(argsNode, "database"));
            case "insert_data" -> dataService.insertData(
                    requiredText(toolName, argsNode, "sql"), optionalText(argsNode, "database"));
            case "update_data" -> dataService.updateData(
                    requiredText(toolName, argsNode, "sql"), optionalText(argsNode, "database"));
            case "execute_stored_procedure" -> routineInvoker.invokeProcedure(
                    requiredText(toolName, argsNode, "name"), parameterText(argsNode), optionalText(argsNode, "database"));
            case "execute_scalar_function" -> routineInvoker.invokeScalarFunction(
                    requiredText(toolName, argsNode, "name"), parameterText(argsNode), optionalText(argsNode, "database"));
            case "execute_table_function" -> routineInvoker.invokeTableFunction(
                    requiredText(toolName, argsNode, "name"), parameterText(argsNode), optionalText(argsNode, "database"));
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("protocol.tool.unknown", toolName));
        };

        logSecurityEvent("TOOL_CALL", String.format("Tool: %s, Success: %s", toolName, operationResult.success()));
        return createToolResult(operationResult);
    }

    JsonNode createToolResult(OperationResult operationResult) throws JsonProcessingException {
        ObjectNode resultNode = objectMapper.createObjectNode();
        ArrayNode contentArray = resultNode.putArray("content");
        ObjectNode textContent = contentArray.addObject();
        textContent.put("type", "text");
        textContent.put("text", envelopeMapper.writeValueAsString(operationResult));
        resultNode.put("isError", !operationResult.success());
        return resultNode;
    }

    private static String requiredText(String toolName, JsonNode argsNode, String argName) {
        JsonNode argNode = argsNode.path(argName);
        if (!argNode.isTextual() || argNode.asText().isBlank()) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.missing", argName, toolName));
        }
        return argNode.asText();
    }

    private static String optionalText(JsonNode argsNode, String argName) {
        JsonNode argNode = argsNode.path(argName);
        if (argNode.isMissingNode() || argNode.isNull()) {
            return null;
        }
        String argValue = argNode.asText();
        return argValue.isBlank() ? null : argValue;
    }

    // parameters may arrive as a JSON string or as an inline object
    private static String parameterText(JsonNode argsNode) {
        JsonNode parametersNode = argsNode.path("parameters");
        if (parametersNode.isMissingNode() || parametersNode.isNull()) {
            return null;
        }
        if (parametersNode.isTextual()) {
            return parametersNode.asText();
        }
        if (parametersNode.isObject()) {
            return parametersNode.toString();
        }
        throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.parameters.invalid",
                parametersNode.getNodeType()));
    }

    private ObjectNode createCapabilities() {
        ObjectNode capabilitiesNode = objectMapper.createObjectNode();
        ObjectNode toolsNode = objectMapper.createObjectNode();
        toolsNode.put("listChanged", false);
        capabilitiesNode.set("tools", toolsNode);
        return capabilitiesNode;
    }

    private void logSecurityEvent(String securityEvent, String eventDetails) {
        Logger securityLogger = LoggerFactory.getLogger("SECURITY." + McpServer.class.getName());
        securityLogger.info("SECURITY_EVENT: {} - {}", securityEvent, eventDetails);
    }

    private Map<String, Object> createServerInfo() {
        Map<String, Object> infoMap = new LinkedHashMap<>();
        infoMap.put("name", CliUtils.SERVER_NAME);
        infoMap.put("version", CliUtils.SERVER_VERSION);
        infoMap.put("description", CliUtils.SERVER_DESCRIPTION);

        Map<String, Object> capabilityInfo = new LinkedHashMap<>();
        capabilityInfo.put("queryTimeoutSeconds", queryTimeoutSeconds);
        capabilityInfo.put("toolCount", ToolCatalog.listTools().size());
        infoMap.put("capabilities", capabilityInfo);
        return infoMap;
    }

    private JsonNode createSuccessResponse(JsonNode resultNode, Object requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("result", resultNode);
        setRespId(requestId, responseNode);
        return responseNode;
    }

    JsonNode createErrorResponse(String code, String message, Object requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");

        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("code", getErrorCode(code));
        errorNode.put("message", message);
        responseNode.set("error", errorNode);
        setRespId(requestId, responseNode);
        return responseNode;
    }

    // The response id mirrors the request id exactly
    private static void setRespId(Object requestId, ObjectNode responseNode) {
        if (requestId == null) {
            responseNode.putNull("id");
        } else if (requestId instanceof JsonNode) {
            responseNode.set("id", (JsonNode) requestId);
        } else if (requestId instanceof String) {
            responseNode.put("id", (String) requestId);
        } else {
            responseNode.set("id", objectMapper.valueToTree(requestId));
        }
    }

    private int getErrorCode(String codeString) {
        return switch (codeString) {
            case "invalid_request" -> -32600;
            case "method_not_found" -> -32601;
            case "invalid_params" -> -32602;
            case "database_error" -> -32000;
            default -> -32603;
        };
    }

    String getServerState() {
        return serverState.toString();
    }

    /**
     * Shuts the server down and closes the connection provider. Safe to call more than once.
     */
    public void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }

        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;
        try {
            connectionProvider.close();
        } catch (Exception e) {
            logger.warn("Error closing connection provider: {}", e.getMessage(), e);
        }
        logger.info("MCP server shutdown complete");
    }

    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }
        try {
            ConfigParams configParams = CliUtils.loadConfiguration(args);
            logger.info("Loaded configuration: {}", configParams);
            McpServer mcpServer = new McpServer(configParams);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down MSSQL MCP Server...");
                mcpServer.shutdown();
            }));

            if (CliUtils.isHttpMode(args)) {
                mcpServer.startHttpMode(CliUtils.getBindAddress(args), CliUtils.getHttpPort(args));
            } else {
                mcpServer.startStdioMode();
            }
        } catch (IllegalArgumentException e) {
            logger.error("Configuration error: {}", e.getMessage());
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.config.error.format"));
            System.exit(2);
        } catch (IOException e) {
            if (e.getMessage() != null && e.getMessage().contains("configuration file")) {
                logger.error("Configuration error: {}", e.getMessage());
                logger.error("\n{}", ResourceManager.getErrorMessage("startup.config.error.format"));
                System.exit(2);
            }
            logger.error("Failed to start server: {}", e.getMessage());
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.generic.error.reason", e.getMessage()));
            System.exit(1);
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()));
            System.exit(3);
        }
    }
}
