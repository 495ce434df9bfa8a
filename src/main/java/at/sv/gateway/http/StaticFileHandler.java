package at.sv.gateway.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Serves the files of the web root for GET requests; {@code /} serves {@code index.html}.
 */
@Slf4j
final class StaticFileHandler implements HttpHandler {

    private static final Map<String, String> CONTENT_TYPES = Map.of(
            "html", "text/html; charset=utf-8",
            "js", "text/javascript; charset=utf-8",
            "css", "text/css; charset=utf-8",
            "json", "application/json; charset=utf-8",
            "svg", "image/svg+xml",
            "png", "image/png",
            "ico", "image/x-icon");

    private final Path webRoot;

    StaticFileHandler(Path webRoot) {
        this.webRoot = webRoot.toAbsolutePath().normalize();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equals(exchange.getRequestMethod()) && !"HEAD".equals(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                sendText(exchange, 405, "Method not allowed");
                return;
            }
            Path file = resolve(exchange.getRequestURI().getPath());
            if (file == null || !Files.isRegularFile(file) || !Files.isReadable(file)) {
                sendText(exchange, 404, "Not found");
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", getContentType(file));
            if ("HEAD".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(200, -1);
                return;
            }
            exchange.sendResponseHeaders(200, Files.size(file));
            try (OutputStream outputStream = exchange.getResponseBody()) {
                Files.copy(file, outputStream);
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * @return the file for the given request path, or null if the path points outside the web root
     */
    Path resolve(String requestPath) {
        String relative = requestPath == null ? "" : requestPath.replaceFirst("^/+", "");
        if (relative.isEmpty()) {
            relative = "index.html";
        }
        try {
            Path file = webRoot.resolve(relative).normalize();
            if (!file.startsWith(webRoot)) {
                log.warn("Rejected path outside web root: {}", requestPath);
                return null;
            }
            return file;
        } catch (InvalidPathException e) {
            log.debug("Invalid path '{}': {}", requestPath, e.getMessage());
            return null;
        }
    }

    private static String getContentType(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot == -1) {
            return "application/octet-stream";
        }
        return CONTENT_TYPES.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), "application/octet-stream");
    }

    private static void sendText(HttpExchange exchange, int status, String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(bytes);
        }
    }
}
