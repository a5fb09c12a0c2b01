package com.skanga.mssql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.mssql.db.ConnectionProvider;
import com.skanga.mssql.db.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McpServerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ConnectionProvider connectionProvider;

    @Mock
    private Connection dbConn;

    @Mock
    private Statement statement;

    private McpServer mcpServer;

    @BeforeEach
    void setUp() {
        mcpServer = new McpServer(connectionProvider, 30);
    }

    private ObjectNode request(Object id, String method) {
        ObjectNode requestNode = objectMapper.createObjectNode();
        requestNode.put("jsonrpc", "2.0");
        if (id instanceof Integer) {
            requestNode.put("id", (Integer) id);
        } else if (id != null) {
            requestNode.put("id", id.toString());
        }
        requestNode.put("method", method);
        return requestNode;
    }

    private ObjectNode initializeRequest(String protocolVersion) {
        ObjectNode requestNode = request(1, "initialize");
        requestNode.putObject("params").put("protocolVersion", protocolVersion);
        return requestNode;
    }

    @Test
    void testInitializeNegotiatesVersion() {
        JsonNode response = mcpServer.handleRequest(initializeRequest("2025-06-18"));

        JsonNode result = response.get("result");
        assertEquals("2025-06-18", result.get("protocolVersion").asText());
        assertFalse(result.get("capabilities").get("tools").get("listChanged").asBoolean());
        assertEquals("MSSQL MCP", result.get("serverInfo").get("name").asText());
        assertEquals(16, result.get("serverInfo").get("capabilities").get("toolCount").asInt());
        assertEquals(30, result.get("serverInfo").get("capabilities").get("queryTimeoutSeconds").asInt());
        assertEquals("INITIALIZING", mcpServer.getServerState());
    }

    @Test
    void testUnsupportedProtocolVersionLeavesServerUninitialized() {
        JsonNode response = mcpServer.handleRequest(initializeRequest("2024-11-05"));

        assertEquals(-32600, response.get("error").get("code").asInt());
        assertTrue(response.get("error").get("message").asText().startsWith("Unsupported protocol version: 2024-11-05"));
        assertEquals("UNINITIALIZED", mcpServer.getServerState());

        assertTrue(mcpServer.handleRequest(initializeRequest("2025-11-25")).has("result"));
    }

    @Test
    void testRequestsBeforeInitializeAreRejected() {
        JsonNode response = mcpServer.handleRequest(request(5, "tools/list"));

        assertEquals(-32600, response.get("error").get("code").asInt());
        assertEquals(5, response.get("id").asInt());
    }

    @Test
    void testRequestsWhileInitializingAreRejected() {
        mcpServer.handleRequest(initializeRequest(McpServer.DEFAULT_PROTOCOL_VERSION));

        JsonNode response = mcpServer.handleRequest(request(2, "tools/list"));

        assertEquals(-32600, response.get("error").get("code").asInt());
        assertEquals("Server is initializing. Waiting for the initialized notification.",
                response.get("error").get("message").asText());
    }

    @Test
    void testSecondInitializeIsRejected() {
        TestUtils.initializeServer(mcpServer, objectMapper);

        JsonNode response = mcpServer.handleRequest(initializeRequest(McpServer.DEFAULT_PROTOCOL_VERSION));
        assertEquals(-32600, response.get("error").get("code").asInt());
    }

    @Test
    void testListToolsReturnsCatalog() {
        TestUtils.initializeServer(mcpServer, objectMapper);

        JsonNode tools = mcpServer.handleRequest(request("list-1", "tools/list")).get("result").get("tools");

        assertEquals(16, tools.size());
        Set<String> toolNames = new HashSet<>();
        for (JsonNode tool : tools) {
            toolNames.add(tool.get("name").asText());
            assertEquals("object", tool.get("inputSchema").get("type").asText());
            assertFalse(tool.get("inputSchema").get("additionalProperties").asBoolean());
        }
        assertTrue(toolNames.containsAll(Set.of("list_databases", "describe_view", "drop_table",
                "execute_stored_procedure", "execute_scalar_function", "execute_table_function")));

        JsonNode scalarTool = findTool(tools, "execute_scalar_function");
        assertEquals("name", scalarTool.get("inputSchema").get("required").get(0).asText());
        assertEquals(2, scalarTool.get("inputSchema").get("properties").get("parameters").get("type").size());
        assertEquals("HIGH", scalarTool.get("security").get("riskLevel").asText());
        assertFalse(findTool(tools, "list_databases").get("inputSchema").has("required"));
    }

    @Test
    void testPing() {
        TestUtils.initializeServer(mcpServer, objectMapper);

        JsonNode result = mcpServer.handleRequest(request(9, "ping")).get("result");

        assertEquals("INITIALIZED", result.get("x-mssql-state").asText());
        assertTrue(result.get("x-mssql-timestamp").asLong() > 0);
    }

    @Test
    void testUnknownMethod() {
        TestUtils.initializeServer(mcpServer, objectMapper);

        JsonNode response = mcpServer.handleRequest(request(3, "resources/list"));

        assertEquals(-32601, response.get("error").get("code").asInt());
        assertEquals("Method not found: resources/list", response.get("error").get("message").asText());
    }

    @Test
    void testUnknownToolIsInvalidParams() {
        TestUtils.initializeServer(mcpServer, objectMapper);

        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("run_sql", objectMapper.createObjectNode(), objectMapper));

        assertEquals(-32602, response.get("error").get("code").asInt());
        assertEquals("Unknown tool: run_sql", response.get("error").get("message").asText());
        assertEquals("test-req-1", response.get("id").asText());
    }

    @Test
    void testMissingRequiredArgumentIsInvalidParams() {
        TestUtils.initializeServer(mcpServer, objectMapper);
        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("name", "  ");

        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("execute_stored_procedure", arguments, objectMapper));

        assertEquals(-32602, response.get("error").get("code").asInt());
        assertEquals("Missing required argument 'name' for tool execute_stored_procedure",
                response.get("error").get("message").asText());
        verifyNoInteractions(connectionProvider);
    }

    @Test
    void testParametersMustBeStringOrObject() {
        TestUtils.initializeServer(mcpServer, objectMapper);
        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("name", "dbo.AddTax");
        arguments.putArray("parameters").add(100);

        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("execute_scalar_function", arguments, objectMapper));

        assertEquals(-32602, response.get("error").get("code").asInt());
    }

    @Test
    void testSuccessfulToolCall() throws Exception {
        TestUtils.initializeServer(mcpServer, objectMapper);
        when(connectionProvider.acquire("Sales")).thenReturn(dbConn);
        when(dbConn.createStatement()).thenReturn(statement);
        when(statement.executeUpdate("INSERT INTO dbo.Orders VALUES (1)")).thenReturn(1);

        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("sql", "INSERT INTO dbo.Orders VALUES (1)");
        arguments.put("database", "Sales");
        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("insert_data", arguments, objectMapper));

        assertFalse(response.get("result").get("isError").asBoolean());
        JsonNode envelope = TestUtils.readEnvelope(response, objectMapper);
        assertTrue(envelope.get("success").asBoolean());
        assertEquals(1, envelope.get("rowsAffected").asInt());
        assertFalse(envelope.has("error"));
        verify(statement).setQueryTimeout(30);
    }

    @Test
    void testFailedToolCallIsFlaggedAsError() throws Exception {
        TestUtils.initializeServer(mcpServer, objectMapper);
        when(connectionProvider.acquire()).thenThrow(new SQLException("Login failed for user 'sa'."));

        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("list_databases", objectMapper.createObjectNode(), objectMapper));

        assertNull(response.get("error"));
        assertTrue(response.get("result").get("isError").asBoolean());
        JsonNode envelope = TestUtils.readEnvelope(response, objectMapper);
        assertFalse(envelope.get("success").asBoolean());
        assertEquals("Login failed for user 'sa'.", envelope.get("error").asText());
        assertFalse(envelope.has("data"));
    }

    @Test
    void testMalformedParametersAreToolErrors() throws Exception {
        TestUtils.initializeServer(mcpServer, objectMapper);
        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("name", "dbo.UpdateOrder");
        arguments.put("parameters", "{\"@OrderId\": ");

        JsonNode response = mcpServer.handleRequest(
                TestUtils.createToolCallRequest("execute_stored_procedure", arguments, objectMapper));

        assertTrue(response.get("result").get("isError").asBoolean());
        assertTrue(TestUtils.readEnvelope(response, objectMapper).get("error").asText()
                .startsWith("Invalid parameter JSON: "));
        verifyNoInteractions(connectionProvider);
    }

    @Test
    void testEnvelopeWritesDatesAsIsoText() throws Exception {
        JsonNode toolResult = mcpServer.createToolResult(
                OperationResult.success(Map.of("result", LocalDateTime.of(2024, 1, 15, 10, 30, 15))));

        JsonNode envelope = objectMapper.readTree(toolResult.get("content").get(0).get("text").asText());
        assertEquals("2024-01-15T10:30:15", envelope.get("data").get("result").asText());
    }

    @Test
    void testNotificationErrorsProduceNoResponse() {
        assertNull(mcpServer.handleRequest(request(null, "tools/list")));
    }

    @Test
    void testShutdownRejectsFurtherRequests() {
        TestUtils.initializeServer(mcpServer, objectMapper);
        mcpServer.shutdown();
        mcpServer.shutdown();

        JsonNode response = mcpServer.handleRequest(request(4, "ping"));
        assertEquals("Server is shutting down", response.get("error").get("message").asText());
        verify(connectionProvider).close();
    }

    @Test
    void testStdioModeAnswersEachLine() throws Exception {
        String requestLines = """
                {"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"2025-11-25"}}

                {"jsonrpc":"2.0","method":"notifications/initialized"}
                {not json
                {"jsonrpc":"2.0","id":"p","method":"ping"}
                """;
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

        mcpServer.startStdioMode(new ByteArrayInputStream(requestLines.getBytes(StandardCharsets.UTF_8)), outputStream);

        String[] responseLines = outputStream.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(3, responseLines.length);
        assertEquals(1, objectMapper.readTree(responseLines[0]).get("id").asInt());
        JsonNode parseError = objectMapper.readTree(responseLines[1]);
        assertEquals(-32603, parseError.get("error").get("code").asInt());
        assertTrue(parseError.get("id").isNull());
        assertEquals("p", objectMapper.readTree(responseLines[2]).get("id").asText());
    }

    private static JsonNode findTool(JsonNode tools, String toolName) {
        for (JsonNode tool : tools) {
            if (toolName.equals(tool.get("name").asText())) {
                return tool;
            }
        }
        throw new AssertionError("Tool not found: " + toolName);
    }
}
