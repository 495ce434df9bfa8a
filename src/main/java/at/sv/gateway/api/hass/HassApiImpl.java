package at.sv.gateway.api.hass;

import at.sv.gateway.api.ApiFailure;
import at.sv.gateway.api.ApiResult;
import at.sv.gateway.api.HassAuthenticationFailure;
import at.sv.gateway.api.HassConnectionFailure;
import at.sv.gateway.api.HttpResourceProvider;
import at.sv.gateway.api.ResourceNotFoundException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
public class HassApiImpl implements HassApi {

    private final HttpResourceProvider httpResourceProvider;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;

    /**
     * @param baseUrl the REST API base, including the {@code /api} path, e.g. {@code http://supervisor/core/api}
     * @throws IllegalArgumentException if the base url is no valid http or https url
     */
    public HassApiImpl(String baseUrl, HttpResourceProvider httpResourceProvider) {
        this.baseUrl = HttpUrl.get(stripTrailingSlash(baseUrl));
        this.httpResourceProvider = httpResourceProvider;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private static String stripTrailingSlash(String url) {
        if (url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }

    @Override
    public ApiResult<List<State>> getStates() {
        return call("states lookup", () -> {
            String response = httpResourceProvider.getResource(createUrl("states"));
            List<State> states;
            try {
                states = mapper.readValue(response, new TypeReference<List<State>>() {
                });
            } catch (JsonProcessingException e) {
                throw new ApiFailure("Failed to parse states response '" + response + "': " + e.getOriginalMessage());
            }
            if (states == null) {
                throw new ApiFailure("Failed to parse states response '" + response + "': no state list");
            }
            return states;
        });
    }

    @Override
    public ApiResult<State> getState(String entityId) {
        return call("state lookup of " + entityId, () -> {
            String response = httpResourceProvider.getResource(createUrl("states", entityId));
            State state;
            try {
                state = mapper.readValue(response, State.class);
            } catch (JsonProcessingException e) {
                throw new ApiFailure("Failed to parse state response '" + response + "' for id " + entityId + ": " +
                                     e.getOriginalMessage());
            }
            if (state == null) {
                throw new ApiFailure("Failed to parse state response '" + response + "' for id " + entityId);
            }
            return state;
        });
    }

    @Override
    public ApiResult<String> getRawState(String entityId) {
        return call("state lookup of " + entityId,
                () -> httpResourceProvider.getResource(createUrl("states", entityId)));
    }

    @Override
    public ApiResult<JsonNode> callService(String domain, String service, Map<String, Object> data) {
        return call("service call " + domain + "." + service, () -> {
            String response = httpResourceProvider.postResource(createUrl("services", domain, service),
                    getBody(data));
            return parseServiceResponse(response);
        });
    }

    private JsonNode parseServiceResponse(String response) {
        if (response.isBlank()) {
            return createStatusCodeNode();
        }
        try {
            return mapper.readTree(response);
        } catch (JsonProcessingException e) {
            log.debug("Service response is no JSON: {}", response);
            return createStatusCodeNode();
        }
    }

    private ObjectNode createStatusCodeNode() {
        return mapper.createObjectNode().put("status_code", 200);
    }

    private <T> ApiResult<T> call(String description, Supplier<T> supplier) {
        try {
            return ApiResult.success(supplier.get());
        } catch (ApiFailure | HassConnectionFailure | HassAuthenticationFailure | ResourceNotFoundException |
                 IllegalArgumentException e) {
            log.warn("Failed {}: {}", description, e.getMessage());
            return ApiResult.failure(e.getMessage(), e);
        }
    }

    /**
     * Appends the given segments to the base url, escaping them. Dot segments are rejected, as they would address
     * other resources than the requested one.
     */
    private HttpUrl createUrl(String... pathSegments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : pathSegments) {
            if (segment == null || segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Failed to construct API url for path segment '" + segment + "'");
            }
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private String getBody(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to create service body", e);
        }
    }
}
