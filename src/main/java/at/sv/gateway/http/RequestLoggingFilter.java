package at.sv.gateway.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.InetSocketAddress;

@Slf4j
final class RequestLoggingFilter extends Filter {

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        MDC.put("context", method + " " + path);
        try {
            log.info("REQ {} {} from {}", method, path, getRemoteAddress(exchange));
            chain.doFilter(exchange);
        } finally {
            MDC.remove("context");
        }
    }

    private static String getRemoteAddress(HttpExchange exchange) {
        InetSocketAddress remoteAddress = exchange.getRemoteAddress();
        if (remoteAddress == null || remoteAddress.getAddress() == null) {
            return "unknown";
        }
        return remoteAddress.getAddress().getHostAddress();
    }

    @Override
    public String description() {
        return "Logs every request and sets the MDC context";
    }
}
