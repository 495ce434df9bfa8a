package at.sv.gateway.api.hass;

import at.sv.gateway.api.ApiResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * The two primitives of the Home Assistant REST API this gateway relies on: reading states and calling services.
 * Every method performs exactly one HTTP call and never throws for upstream failures.
 */
public interface HassApi {

    /**
     * @return all entity states, in the order Home Assistant reported them
     */
    ApiResult<List<State>> getStates();

    ApiResult<State> getState(String entityId);

    /**
     * @return the unparsed JSON body of the state of the given entity
     */
    ApiResult<String> getRawState(String entityId);

    /**
     * Calls {@code /services/<domain>/<service>}.
     *
     * @param data the service data, usually containing at least {@code entity_id}
     * @return the JSON response of Home Assistant, or {@code {"status_code": 200}} if it did not answer with JSON
     */
    ApiResult<JsonNode> callService(String domain, String service, Map<String, Object> data);
}
