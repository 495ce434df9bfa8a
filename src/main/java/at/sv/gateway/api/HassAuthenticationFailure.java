package at.sv.gateway.api;

public final class HassAuthenticationFailure extends RuntimeException {
    public HassAuthenticationFailure() {
        super("Access token was rejected by Home Assistant");
    }
}
