package at.sv.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Embedded HTTP server exposing the node API and the static web frontend.
 */
@Slf4j
public class GatewayServer {

    private final HttpServer server;
    private final ExecutorService executor;
    private final RequestLoggingFilter loggingFilter = new RequestLoggingFilter();

    public GatewayServer(InetSocketAddress address, int threads, NodeController controller, Path webRoot)
            throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        server = HttpServer.create(address, 0);
        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);

        createContext("/api/nodes", JsonHandler.exact(mapper, "GET", "/api/nodes",
                request -> controller.listNodes()));
        createContext("/api/action", JsonHandler.exact(mapper, "POST", "/api/action",
                request -> controller.performAction(request.body())));
        createContext("/api/set_number", JsonHandler.exact(mapper, "POST", "/api/set_number",
                request -> controller.setNumber(request.body())));
        createContext("/api/state/", JsonHandler.prefix(mapper, "GET", "/api/state/",
                request -> controller.getState(request.pathRemainder())));
        createContext("/", new StaticFileHandler(webRoot));
    }

    private void createContext(String path, HttpHandler handler) {
        HttpContext context = server.createContext(path, handler);
        context.getFilters().add(loggingFilter);
    }

    public void start() {
        server.start();
        log.info("Listening on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public void stop() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped");
    }
}
