package at.sv.gateway.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Serves a single API path and HTTP method, writing the {@link ApiResponse} of the given function as JSON.
 */
@Slf4j
final class JsonHandler implements HttpHandler {

    private final ObjectMapper mapper;
    private final String method;
    private final String path;
    private final boolean prefixMatch;
    private final Function<Request, ApiResponse> function;

    private JsonHandler(ObjectMapper mapper, String method, String path, boolean prefixMatch,
                        Function<Request, ApiResponse> function) {
        this.mapper = mapper;
        this.method = method;
        this.path = path;
        this.prefixMatch = prefixMatch;
        this.function = function;
    }

    static JsonHandler exact(ObjectMapper mapper, String method, String path, Function<Request, ApiResponse> function) {
        return new JsonHandler(mapper, method, path, false, function);
    }

    /**
     * Handles every path below the given prefix, passing the remainder as {@link Request#pathRemainder()}.
     */
    static JsonHandler prefix(ObjectMapper mapper, String method, String path, Function<Request, ApiResponse> function) {
        return new JsonHandler(mapper, method, path, true, function);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            ApiResponse response = handleRequest(exchange);
            writeResponse(exchange, response);
        } finally {
            exchange.close();
        }
    }

    private ApiResponse handleRequest(HttpExchange exchange) throws IOException {
        String requestPath = exchange.getRequestURI().getPath();
        String remainder = getPathRemainder(requestPath);
        if (remainder == null) {
            return ApiResponse.error(404, "not_found");
        }
        if (!method.equals(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            return ApiResponse.error(405, "method_not_allowed");
        }
        JsonNode body = readBody(exchange);
        try {
            return function.apply(new Request(body, remainder));
        } catch (RuntimeException e) {
            log.error("Unexpected error handling {} {}", exchange.getRequestMethod(), requestPath, e);
            return ApiResponse.error(500, "internal_error", e.getMessage());
        }
    }

    private String getPathRemainder(String requestPath) {
        if (!prefixMatch) {
            return path.equals(requestPath) ? "" : null;
        }
        if (!requestPath.startsWith(path) || requestPath.length() == path.length()) {
            return null;
        }
        return requestPath.substring(path.length());
    }

    /**
     * Malformed or missing bodies are treated as an empty object.
     */
    private JsonNode readBody(HttpExchange exchange) throws IOException {
        ObjectNode empty = mapper.createObjectNode();
        if (!"POST".equals(exchange.getRequestMethod())) {
            return empty;
        }
        byte[] bytes;
        try (InputStream inputStream = exchange.getRequestBody()) {
            bytes = inputStream.readAllBytes();
        }
        if (bytes.length == 0) {
            return empty;
        }
        try {
            JsonNode body = mapper.readTree(bytes);
            if (body == null || !body.isObject()) {
                return empty;
            }
            return body;
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed request body: {}", e.getOriginalMessage());
            return empty;
        }
    }

    private void writeResponse(HttpExchange exchange, ApiResponse response) throws IOException {
        byte[] bytes;
        if (response.isRaw()) {
            bytes = response.rawJson().getBytes(StandardCharsets.UTF_8);
        } else {
            bytes = mapper.writeValueAsBytes(response.body());
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(bytes);
        }
    }

    /**
     * @param body          the JSON object of a POST request, an empty object otherwise
     * @param pathRemainder the decoded part of the path following a prefix, empty for exact paths
     */
    record Request(JsonNode body, String pathRemainder) {
    }
}
