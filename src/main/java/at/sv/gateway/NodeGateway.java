package at.sv.gateway;

import at.sv.gateway.api.HassHttpClientFactory;
import at.sv.gateway.api.HttpResourceProviderImpl;
import at.sv.gateway.api.hass.HassApi;
import at.sv.gateway.api.hass.HassApiImpl;
import at.sv.gateway.http.GatewayServer;
import at.sv.gateway.http.NodeController;
import at.sv.gateway.node.NodeDiscovery;
import at.sv.gateway.node.StateSnapshotProvider;
import com.github.benmanes.caffeine.cache.Ticker;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Command(name = "HassNodeGateway", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class NodeGateway implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(NodeGateway.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--api-url", paramLabel = "<url>",
            defaultValue = "${env:HA_PROXY:-http://supervisor/core/api}",
            description = "The base URL of the Home Assistant REST API, including the '/api' path. " +
                          "Default: ${DEFAULT-VALUE}")
    String apiUrl;
    @Option(names = "--token", paramLabel = "<token>",
            defaultValue = "${env:SUPERVISOR_TOKEN}",
            description = "The access token sent as bearer token with every Home Assistant call.")
    String accessToken;
    @Option(names = "--port",
            defaultValue = "${env:PORT:-8199}",
            description = "The port to listen on. Default: ${DEFAULT-VALUE}")
    int port;
    @Option(names = "--www-dir", paramLabel = "<dir>",
            defaultValue = "${env:WWW_DIR:-.}",
            description = "The directory of the static web frontend. Default: ${DEFAULT-VALUE}")
    Path webRoot;
    @Option(names = "--domains", paramLabel = "<domain>", split = ",",
            defaultValue = "${env:NODE_DOMAINS:-switch,sensor,number,light,binary_sensor}",
            description = "The entity domains considered when grouping entities into nodes. Default: ${DEFAULT-VALUE}")
    List<String> domains;
    @Option(names = "--state-cache-ttl", paramLabel = "<seconds>",
            defaultValue = "${env:STATE_CACHE_TTL:-3}",
            description = "How long the list of all states is reused before it is fetched again. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int stateCacheTtlInSeconds;
    @Option(names = "--request-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:REQUEST_TIMEOUT:-10}",
            description = "The timeout of a single Home Assistant call. Default: ${DEFAULT-VALUE} seconds.")
    int requestTimeoutInSeconds;
    @Option(names = "--server-threads", paramLabel = "<threads>",
            defaultValue = "${env:SERVER_THREADS:-4}",
            description = "The number of threads handling incoming requests. Default: ${DEFAULT-VALUE}")
    int serverThreads;

    public static void main(String[] args) {
        int execute = new CommandLine(new NodeGateway()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        GatewayServer server = createServer();
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown"));
        MDC.remove("context");
    }

    GatewayServer createServer() {
        OkHttpClient httpClient = HassHttpClientFactory.createHttpClient(accessToken,
                Duration.ofSeconds(requestTimeoutInSeconds));
        HassApi api = new HassApiImpl(apiUrl, new HttpResourceProviderImpl(httpClient));
        StateSnapshotProvider snapshotProvider = new StateSnapshotProvider(api, Ticker.systemTicker(),
                Duration.ofSeconds(stateCacheTtlInSeconds));
        NodeDiscovery nodeDiscovery = new NodeDiscovery(snapshotProvider, getDomainWhitelist());
        LOG.info("Using Home Assistant API at {}, domains {}", apiUrl, getDomainWhitelist());
        try {
            return new GatewayServer(new InetSocketAddress(port), serverThreads, new NodeController(nodeDiscovery, api),
                    webRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start server on port " + port, e);
        }
    }

    Set<String> getDomainWhitelist() {
        Set<String> whitelist = new LinkedHashSet<>();
        for (String domain : domains) {
            String trimmed = domain.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                whitelist.add(trimmed);
            }
        }
        return whitelist;
    }

    void assertConfigurationParameters() {
        if (port < 0 || port > 65535) {
            fail("--port must be within [0,65535]");
        }
        if (apiUrl == null || apiUrl.isBlank()) {
            fail("--api-url must not be empty");
        }
        if (HttpUrl.parse(apiUrl) == null) {
            fail("--api-url must be a valid http or https url: " + apiUrl);
        }
        if (domains == null || getDomainWhitelist().isEmpty()) {
            fail("--domains must contain at least one domain");
        }
        if (stateCacheTtlInSeconds < 0) {
            fail("--state-cache-ttl must be >= 0");
        }
        if (requestTimeoutInSeconds <= 0) {
            fail("--request-timeout must be > 0");
        }
        if (serverThreads <= 0) {
            fail("--server-threads must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
