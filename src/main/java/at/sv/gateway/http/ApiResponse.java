package at.sv.gateway.http;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status code and JSON body of an API call. The body is either an object serialized by Jackson, or, for
 * pass-through responses, an already serialized JSON string.
 */
public record ApiResponse(int status, Object body, String rawJson) {

    public static ApiResponse ok(Object body) {
        return new ApiResponse(200, body, null);
    }

    public static ApiResponse raw(String json) {
        return new ApiResponse(200, null, json);
    }

    public static ApiResponse error(int status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return new ApiResponse(status, body, null);
    }

    public static ApiResponse error(int status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return new ApiResponse(status, body, null);
    }

    public boolean isRaw() {
        return rawJson != null;
    }
}
