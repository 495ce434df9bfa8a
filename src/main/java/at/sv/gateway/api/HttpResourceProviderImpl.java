package at.sv.gateway.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_TRACED_BODY_LENGTH = 150;

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getResource(HttpUrl url) {
        log.trace("GET {}", url);
        return execute(new Request.Builder().url(url).get().build());
    }

    @Override
    public String postResource(HttpUrl url, String body) {
        log.trace("POST {}: {}", url, abbreviate(body));
        return execute(new Request.Builder().url(url).post(RequestBody.create(body, JSON_MEDIA_TYPE)).build());
    }

    private String execute(Request request) {
        String call = request.method() + " " + request.url();
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response.body());
            if (response.isSuccessful()) {
                return body;
            }
            throw toFailure(call, response.code(), body);
        } catch (IOException e) {
            log.warn("Failed '{}': {}", call, e.getLocalizedMessage());
            throw new HassConnectionFailure("Failed '" + call + "': " + e.getLocalizedMessage(), e);
        }
    }

    private static RuntimeException toFailure(String call, int code, String body) {
        return switch (code) {
            case 401, 403 -> new HassAuthenticationFailure();
            case 404 -> new ResourceNotFoundException("Resource not found: " + body);
            case 429 -> new ApiFailure("Rate limit exceeded: " + body);
            default -> code >= 500 ? new ApiFailure("Server error: " + body) : unexpectedCode(call, code, body);
        };
    }

    private static HassConnectionFailure unexpectedCode(String call, int code, String body) {
        log.warn("Unexpected return code {} for '{}'", code, call);
        return new HassConnectionFailure("Failed '" + call + "': Unexpected return code " + code + ". " + body);
    }

    private static String readBody(ResponseBody body) throws IOException {
        return body == null ? "" : body.string();
    }

    private static String abbreviate(String body) {
        if (body.length() <= MAX_TRACED_BODY_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_TRACED_BODY_LENGTH) + "...";
    }
}
