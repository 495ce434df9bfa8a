package at.sv.gateway.api;

/**
 * Exception to signal that Home Assistant could not be reached, the call timed out, or it answered with an
 * unexpected status code.
 */
public final class HassConnectionFailure extends RuntimeException {

    public HassConnectionFailure(String message) {
        super(message);
    }

    public HassConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
