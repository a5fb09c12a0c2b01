package com.skanga.mssql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Handles {@code POST /mcp}. A request is answered with 200 and the JSON-RPC response,
 * a notification with 204 and no body.
 */
class McpHttpHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(McpHttpHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final McpServer mcpServer;

    McpHttpHandler(McpServer mcpServer) {
        this.mcpServer = mcpServer;
    }

    @Override
    public void handle(HttpExchange httpExchange) throws IOException {
        httpExchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
        httpExchange.getResponseHeaders().add("Access-Control-Allow-Methods", "POST, OPTIONS");
        httpExchange.getResponseHeaders().add("Access-Control-Allow-Headers", "Content-Type");

        String requestMethod = httpExchange.getRequestMethod();
        if ("OPTIONS".equals(requestMethod)) {
            httpExchange.sendResponseHeaders(200, -1);
            httpExchange.close();
            return;
        }

        if (!"POST".equals(requestMethod)) {
            JsonNode errorResponse = mcpServer.createErrorResponse("invalid_request",
                    "Method not allowed: " + requestMethod, null);
            sendJson(httpExchange, 405, objectMapper.writeValueAsBytes(errorResponse));
            return;
        }

        try (InputStream requestBody = httpExchange.getRequestBody()) {
            JsonNode requestNode = objectMapper.readTree(new String(requestBody.readAllBytes(), StandardCharsets.UTF_8));
            JsonNode responseNode = mcpServer.handleRequest(requestNode);

            if (responseNode == null) {
                httpExchange.sendResponseHeaders(204, -1);
                httpExchange.close();
            } else {
                sendJson(httpExchange, 200, objectMapper.writeValueAsBytes(responseNode));
            }
        } catch (Exception e) {
            logger.error("Error handling HTTP request: {}", e.getMessage(), e);
            JsonNode errorResponse = mcpServer.createErrorResponse("internal_error",
                    "Internal server error: " + e.getMessage(), null);
            sendJson(httpExchange, 500, objectMapper.writeValueAsBytes(errorResponse));
        }
    }

    private static void sendJson(HttpExchange httpExchange, int statusCode, byte[] responseBytes) throws IOException {
        httpExchange.getResponseHeaders().set("Content-Type", "application/json");
        httpExchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream responseBody = httpExchange.getResponseBody()) {
            responseBody.write(responseBytes);
        }
    }
}
