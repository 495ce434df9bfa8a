package at.sv.gateway.http;

import at.sv.gateway.api.HassHttpClientFactory;
import at.sv.gateway.api.HttpResourceProviderImpl;
import at.sv.gateway.api.hass.HassApi;
import at.sv.gateway.api.hass.HassApiImpl;
import at.sv.gateway.node.NodeDiscovery;
import at.sv.gateway.node.NodeMapper;
import at.sv.gateway.node.StateSnapshotProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Slf4j
class GatewayServerTest {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    @TempDir
    Path webRoot;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, MockResponse> upstreamResponses = new ConcurrentHashMap<>();
    private MockWebServer upstream;
    private GatewayServer server;
    private OkHttpClient client;
    private String gatewayUrl;

    @BeforeEach
    void setUp() throws IOException {
        upstream = new MockWebServer();
        upstream.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                MockResponse response = upstreamResponses.get(request.getMethod() + " " + request.getPath());
                if (response == null) {
                    return new MockResponse().setResponseCode(404).setBody("{\"message\":\"Entity not found.\"}");
                }
                return response;
            }
        });
        upstream.start();

        OkHttpClient upstreamClient = HassHttpClientFactory.createHttpClient("test-token", Duration.ofSeconds(2));
        HassApi api = new HassApiImpl(upstream.url("/api").toString(), new HttpResourceProviderImpl(upstreamClient));
        StateSnapshotProvider snapshotProvider = new StateSnapshotProvider(api, System::nanoTime, Duration.ofSeconds(3));
        NodeController controller = new NodeController(new NodeDiscovery(snapshotProvider, NodeMapper.DEFAULT_DOMAINS), api);
        server = new GatewayServer(new InetSocketAddress("localhost", 0), 2, controller, webRoot);
        server.start();

        client = new OkHttpClient.Builder().build();
        gatewayUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        try {
            upstream.shutdown();
        } catch (IOException e) {
            log.error("MockWebServer shutdown error (ignored): {}", e.getMessage());
        }
    }

    private void setUpstream(String methodAndPath, @Language("JSON") String body) {
        upstreamResponses.put(methodAndPath, new MockResponse().setBody(body));
    }

    private Response get(String path) throws IOException {
        return client.newCall(new Request.Builder().url(gatewayUrl + path).build()).execute();
    }

    private Response post(String path, String body) throws IOException {
        return client.newCall(new Request.Builder().url(gatewayUrl + path)
                                                   .post(RequestBody.create(body, JSON))
                                                   .build()).execute();
    }

    private JsonNode readJson(Response response) throws IOException {
        return mapper.readTree(response.body().string());
    }

    @Test
    void nodes_onlyBinarySensor_oneNodeWithNullFields() throws IOException {
        setUpstream("GET /api/states", """
                [
                  {
                    "entity_id": "binary_sensor.door_open",
                    "state": "off",
                    "attributes": {"friendly_name": "Door"}
                  }
                ]
                """);

        try (Response response = get("/api/nodes")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Type")).startsWith("application/json");
            JsonNode nodes = readJson(response);
            assertThat(nodes.size()).isEqualTo(1);
            JsonNode door = nodes.get(0);
            assertThat(door.get("node").asText()).isEqualTo("door");
            assertThat(door.has("switch")).isTrue();
            assertThat(door.get("switch").isNull()).isTrue();
            assertThat(door.get("number").isNull()).isTrue();
            assertThat(door.get("sensor").isNull()).isTrue();
            assertThat(door.get("number_attrs").isNull()).isTrue();
            assertThat(door.get("switch_state").isNull()).isTrue();
        }
    }

    @Test
    void nodes_readsLiveStateOfRepresentatives() throws IOException {
        setUpstream("GET /api/states", """
                [
                  {"entity_id": "switch.pump_1", "state": "off", "attributes": {}},
                  {"entity_id": "number.pump_speed", "state": "10", "attributes": {}}
                ]
                """);
        setUpstream("GET /api/states/switch.pump_1", """
                {"entity_id": "switch.pump_1", "state": "on", "attributes": {"friendly_name": "Pump"}}
                """);
        setUpstream("GET /api/states/number.pump_speed", """
                {"entity_id": "number.pump_speed", "state": "40", "attributes": {"min": 0, "max": 100}}
                """);

        try (Response response = get("/api/nodes")) {
            JsonNode pump = readJson(response).get(0);
            assertThat(pump.get("node").asText()).isEqualTo("pump");
            assertThat(pump.get("switch").asText()).isEqualTo("switch.pump_1");
            assertThat(pump.get("switch_name").asText()).isEqualTo("Pump");
            assertThat(pump.get("switch_state").asText()).isEqualTo("on");
            assertThat(pump.get("number_name").asText()).isEqualTo("number.pump_speed");
            assertThat(pump.get("number_attrs").get("max").asInt()).isEqualTo(100);
        }
    }

    @Test
    void nodes_upstreamDown_500() throws IOException {
        upstreamResponses.put("GET /api/states", new MockResponse().setResponseCode(502).setBody("Bad gateway"));

        try (Response response = get("/api/nodes")) {
            assertThat(response.code()).isEqualTo(500);
            JsonNode body = readJson(response);
            assertThat(body.get("error").asText()).isEqualTo("discover_failed");
            assertThat(body.get("message").asText()).contains("Bad gateway");
        }
    }

    @Test
    void nodes_upstreamReturnsNull_discoverFailed() throws IOException {
        setUpstream("GET /api/states", "null");

        try (Response response = get("/api/nodes")) {
            assertThat(response.code()).isEqualTo(500);
            assertThat(readJson(response).get("error").asText()).isEqualTo("discover_failed");
        }
    }

    @Test
    void action_on_callsServiceWithBearerToken() throws Exception {
        setUpstream("GET /api/states", """
                [{"entity_id": "switch.pump_1", "state": "off", "attributes": {}}]
                """);
        setUpstream("POST /api/services/switch/turn_on", """
                [{"entity_id": "switch.pump_1", "state": "on", "attributes": {}}]
                """);

        try (Response response = post("/api/action", "{\"node\": \"pump\", \"action\": \"on\"}")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = readJson(response);
            assertThat(body.get("status").asText()).isEqualTo("ok");
            assertThat(body.get("entity").asText()).isEqualTo("switch.pump_1");
            assertThat(body.get("action").asText()).isEqualTo("on");
            assertThat(body.get("result").get(0).get("state").asText()).isEqualTo("on");
        }

        RecordedRequest states = upstream.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest service = upstream.takeRequest(1, TimeUnit.SECONDS);
        assertThat(states.getPath()).isEqualTo("/api/states");
        assertThat(service.getPath()).isEqualTo("/api/services/switch/turn_on");
        assertThat(service.getHeader("Authorization")).isEqualTo("Bearer test-token");
        assertThat(service.getBody().readUtf8()).isEqualTo("{\"entity_id\":\"switch.pump_1\"}");
    }

    @Test
    void action_invalidAction_400() throws IOException {
        try (Response response = post("/api/action", "{\"node\": \"pump\", \"action\": \"spin\"}")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(readJson(response).get("error").asText()).isEqualTo("invalid_action");
        }
        assertThat(upstream.getRequestCount()).isZero();
    }

    @Test
    void action_malformedBody_noNode() throws IOException {
        try (Response response = post("/api/action", "not json")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(readJson(response).get("error").asText()).isEqualTo("no_node");
        }
    }

    @Test
    void action_get_methodNotAllowed() throws IOException {
        try (Response response = get("/api/action")) {
            assertThat(response.code()).isEqualTo(405);
            assertThat(response.header("Allow")).isEqualTo("POST");
            assertThat(readJson(response).get("error").asText()).isEqualTo("method_not_allowed");
        }
    }

    @Test
    void setNumber_invalidValue_400() throws IOException {
        try (Response response = post("/api/set_number", "{\"node\": \"pump\", \"value\": \"abc\"}")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(readJson(response).get("error").asText()).isEqualTo("invalid_value");
        }
    }

    @Test
    void setNumber_emptyUpstreamResponse_statusCodeResult() throws Exception {
        setUpstream("GET /api/states", """
                [{"entity_id": "number.pump_speed", "state": "10", "attributes": {}}]
                """);
        upstreamResponses.put("POST /api/services/number/set_value", new MockResponse().setResponseCode(200));

        try (Response response = post("/api/set_number", "{\"node\": \"pump\", \"value\": \"55.5\"}")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = readJson(response);
            assertThat(body.get("entity").asText()).isEqualTo("number.pump_speed");
            assertThat(body.get("value").asDouble()).isEqualTo(55.5);
            assertThat(body.get("result").get("status_code").asInt()).isEqualTo(200);
        }
    }

    @Test
    void actionAndSetNumber_shareCachedSnapshot() throws IOException {
        setUpstream("GET /api/states", """
                [
                  {"entity_id": "switch.pump_1", "state": "off", "attributes": {}},
                  {"entity_id": "number.pump_speed", "state": "10", "attributes": {}}
                ]
                """);
        setUpstream("POST /api/services/switch/toggle", "[]");
        setUpstream("POST /api/services/number/set_value", "[]");

        try (Response response = post("/api/action", "{\"node\": \"pump\"}")) {
            assertThat(response.code()).isEqualTo(200);
        }
        try (Response response = post("/api/set_number", "{\"node\": \"pump\", \"value\": 3}")) {
            assertThat(response.code()).isEqualTo(200);
        }

        assertThat(upstream.getRequestCount()).isEqualTo(3);
    }

    @Test
    void state_passesThroughUpstreamBody() throws IOException {
        String body = "{\"entity_id\":\"sensor.pump1_temp\",\"state\":\"21.5\",\"attributes\":{\"unit_of_measurement\":\"°C\"}}";
        setUpstream("GET /api/states/sensor.pump1_temp", body);

        try (Response response = get("/api/state/sensor.pump1_temp")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().string()).isEqualTo(body);
        }
    }

    @Test
    void state_encodedQueryCharacters_stayInEntityIdSegment() throws IOException {
        setUpstream("GET /api/states/sensor.pump%3Fx%23y", """
                {"entity_id": "sensor.pump?x#y", "state": "1", "attributes": {}}
                """);

        try (Response response = get("/api/state/sensor.pump%3Fx%23y")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(readJson(response).get("state").asText()).isEqualTo("1");
        }
    }

    @Test
    void state_unknownEntity_500WithMessage() throws IOException {
        try (Response response = get("/api/state/sensor.unknown")) {
            assertThat(response.code()).isEqualTo(500);
            JsonNode body = readJson(response);
            assertThat(body.get("error").asText()).isEqualTo("failed");
            assertThat(body.get("message").asText()).contains("Entity not found.");
        }
    }

    @Test
    void staticFiles_indexAndAssets() throws IOException {
        Files.writeString(webRoot.resolve("index.html"), "<html>nodes</html>");
        Files.writeString(webRoot.resolve("app.js"), "console.log('nodes');");

        try (Response response = get("/")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Type")).startsWith("text/html");
            assertThat(response.body().string()).isEqualTo("<html>nodes</html>");
        }
        try (Response response = get("/index.html")) {
            assertThat(response.body().string()).isEqualTo("<html>nodes</html>");
        }
        try (Response response = get("/app.js")) {
            assertThat(response.header("Content-Type")).startsWith("text/javascript");
            assertThat(response.body().string()).isEqualTo("console.log('nodes');");
        }
    }

    @Test
    void staticFiles_missingFile_404() throws IOException {
        try (Response response = get("/missing.css")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }
}
