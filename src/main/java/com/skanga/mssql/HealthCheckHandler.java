package com.skanga.mssql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.mssql.config.CliUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Handles {@code GET /health}.
 */
class HealthCheckHandler implements HttpHandler {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final McpServer mcpServer;

    HealthCheckHandler(McpServer mcpServer) {
        this.mcpServer = mcpServer;
    }

    @Override
    public void handle(HttpExchange httpExchange) throws IOException {
        ObjectNode healthNode = objectMapper.createObjectNode();
        healthNode.put("status", "healthy");
        healthNode.put("server", CliUtils.SERVER_NAME);
        healthNode.put("version", CliUtils.SERVER_VERSION);
        healthNode.put("state", mcpServer.getServerState());
        healthNode.put("timestamp", System.currentTimeMillis());

        byte[] responseBytes = objectMapper.writeValueAsBytes(healthNode);
        httpExchange.getResponseHeaders().set("Content-Type", "application/json");
        httpExchange.sendResponseHeaders(200, responseBytes.length);
        try (OutputStream responseBody = httpExchange.getResponseBody()) {
            responseBody.write(responseBytes);
        }
    }
}
