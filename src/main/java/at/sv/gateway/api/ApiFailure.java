package at.sv.gateway.api;

/**
 * Exception to signal a backend error of the Home Assistant API (5xx, 429). Or when its response could not be parsed.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }
}
