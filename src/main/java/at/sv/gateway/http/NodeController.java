package at.sv.gateway.http;

import at.sv.gateway.api.ApiResult;
import at.sv.gateway.api.hass.HassApi;
import at.sv.gateway.api.hass.HassApiUtils;
import at.sv.gateway.api.hass.State;
import at.sv.gateway.node.Node;
import at.sv.gateway.node.NodeDiscovery;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates the simplified node API into Home Assistant calls. Never throws for upstream failures, they are
 * reported as error responses.
 */
@Slf4j
public class NodeController {

    private static final Map<String, String> ACTION_SERVICES = Map.of(
            "on", "turn_on",
            "off", "turn_off",
            "toggle", "toggle");
    private static final String DIGITS = "[0-9](?:_?[0-9])*";
    private static final Pattern DECIMAL_NUMBER = Pattern.compile(
            "[+-]?(?:(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?" +
            "|inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private final NodeDiscovery nodeDiscovery;
    private final HassApi api;

    public NodeController(NodeDiscovery nodeDiscovery, HassApi api) {
        this.nodeDiscovery = nodeDiscovery;
        this.api = api;
    }

    public ApiResponse listNodes() {
        ApiResult<Map<String, Node>> nodes = nodeDiscovery.discoverNodes();
        if (!nodes.isSuccess()) {
            return ApiResponse.error(500, "discover_failed", nodes.getFailureMessage());
        }
        List<NodeSummary> summaries = nodes.getValue().values().stream()
                                           .sorted(Comparator.comparing(Node::getToken))
                                           .map(this::createSummary)
                                           .collect(Collectors.toList());
        return ApiResponse.ok(summaries);
    }

    private NodeSummary createSummary(Node node) {
        NodeSummary summary = new NodeSummary();
        summary.setNode(node.getToken());
        summary.setSwitch_entity(node.getRepresentative("switch"));
        summary.setSensor(node.getRepresentative("sensor"));
        summary.setNumber(node.getRepresentative("number"));
        summary.setLight(node.getRepresentative("light"));
        State switchState = lookupState(summary.getSwitch_entity());
        if (switchState != null) {
            summary.setSwitch_name(switchState.getFriendlyName());
            summary.setSwitch_state(switchState.getState());
        }
        State numberState = lookupState(summary.getNumber());
        if (numberState != null) {
            summary.setNumber_name(numberState.getFriendlyName());
            summary.setNumber_state(numberState.getState());
            summary.setNumber_attrs(numberState.getAttributes() != null ? numberState.getAttributes() : Map.of());
        }
        State sensorState = lookupState(summary.getSensor());
        if (sensorState != null) {
            summary.setSensor_name(sensorState.getFriendlyName());
            summary.setSensor_state(sensorState.getState());
        }
        return summary;
    }

    private State lookupState(String entityId) {
        if (entityId == null) {
            return null;
        }
        ApiResult<State> state = api.getState(entityId);
        if (!state.isSuccess()) {
            log.error("Failed to fetch state for {}: {}", entityId, state.getFailureMessage());
            return null;
        }
        return state.getValue();
    }

    public ApiResponse performAction(JsonNode request) {
        String node = getText(request, "node");
        if (node == null || node.isEmpty()) {
            return ApiResponse.error(400, "no_node");
        }
        String action = getText(request, "action");
        if (action == null || action.isEmpty()) {
            action = "toggle";
        }
        action = action.toLowerCase(Locale.ROOT);
        String service = ACTION_SERVICES.get(action);
        if (service == null) {
            return ApiResponse.error(400, "invalid_action");
        }

        ApiResult<Node> resolved = resolveNode(node);
        if (!resolved.isSuccess()) {
            return ApiResponse.error(500, "discover_failed", resolved.getFailureMessage());
        }
        if (resolved.getValue() == null) {
            return ApiResponse.error(404, "node_not_found");
        }
        String switchEntity = resolved.getValue().getRepresentative("switch");
        if (switchEntity == null) {
            return ApiResponse.error(400, "no_switch_for_node");
        }

        String domain = HassApiUtils.getDomain(switchEntity);
        ApiResult<JsonNode> result = api.callService(domain, service, Map.of("entity_id", switchEntity));
        if (!result.isSuccess()) {
            log.error("Service call {}.{} for {} failed: {}", domain, service, switchEntity, result.getFailureMessage());
            return ApiResponse.error(500, "service_failed", result.getFailureMessage());
        }
        log.info("Performed '{}' on {}", action, switchEntity);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("entity", switchEntity);
        body.put("action", action);
        body.put("result", result.getValue());
        return ApiResponse.ok(body);
    }

    public ApiResponse setNumber(JsonNode request) {
        String node = getText(request, "node");
        if (node == null || node.isEmpty()) {
            return ApiResponse.error(400, "no_node");
        }
        Double value = parseNumber(request.get("value"));
        if (value == null) {
            return ApiResponse.error(400, "invalid_value");
        }

        ApiResult<Node> resolved = resolveNode(node);
        if (!resolved.isSuccess()) {
            return ApiResponse.error(500, "discover_failed", resolved.getFailureMessage());
        }
        if (resolved.getValue() == null) {
            return ApiResponse.error(404, "node_not_found");
        }
        String numberEntity = resolved.getValue().getRepresentative("number");
        if (numberEntity == null) {
            return ApiResponse.error(400, "no_number_for_node");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entity_id", numberEntity);
        data.put("value", value);
        ApiResult<JsonNode> result = api.callService("number", "set_value", data);
        if (!result.isSuccess()) {
            log.error("Number service call for {} failed: {}", numberEntity, result.getFailureMessage());
            return ApiResponse.error(500, "service_failed", result.getFailureMessage());
        }
        log.info("Set {} to {}", numberEntity, value);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("entity", numberEntity);
        body.put("value", value);
        body.put("result", result.getValue());
        return ApiResponse.ok(body);
    }

    public ApiResponse getState(String entityId) {
        ApiResult<String> state = api.getRawState(entityId);
        if (!state.isSuccess()) {
            return ApiResponse.error(500, "failed", state.getFailureMessage());
        }
        return ApiResponse.raw(state.getValue());
    }

    /**
     * @return the node with the given token, a successful null if it does not exist, or the failure of the discovery
     */
    private ApiResult<Node> resolveNode(String token) {
        return nodeDiscovery.discoverNodes().map(nodes -> nodes.get(token));
    }

    private static String getText(JsonNode request, String field) {
        JsonNode value = request.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Accepts JSON numbers and strings holding a decimal floating point number, optionally with an exponent,
     * single underscores between digits, or one of the keywords {@code inf}, {@code infinity} and {@code nan}.
     * Java specific literals like {@code 1.5f} or hex floats are rejected.
     */
    static Double parseNumber(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.textValue().strip();
        if (!DECIMAL_NUMBER.matcher(text).matches()) {
            return null;
        }
        String unsigned = text.replaceFirst("^[+-]", "").toLowerCase(Locale.ROOT);
        boolean negative = text.startsWith("-");
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }
        if (unsigned.startsWith("inf")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(text.replace("_", ""));
    }
}
