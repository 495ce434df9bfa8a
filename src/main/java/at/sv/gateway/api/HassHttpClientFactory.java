package at.sv.gateway.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Duration;

@Slf4j
public final class HassHttpClientFactory {

    private HassHttpClientFactory() {
    }

    /**
     * Creates a client that authenticates every call with the given bearer token and aborts calls exceeding the
     * given timeout. A missing token only logs a warning, as some setups inject it through a proxy.
     */
    public static OkHttpClient createHttpClient(String accessToken, Duration callTimeout) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .callTimeout(callTimeout);
        if (accessToken == null || accessToken.isBlank()) {
            log.warn("No access token configured; Home Assistant calls may fail.");
            return builder.build();
        }
        return builder.addInterceptor(chain -> {
                          Request request = chain.request().newBuilder()
                                                 .header("Authorization", "Bearer " + accessToken)
                                                 .build();
                          return chain.proceed(request);
                      })
                      .build();
    }
}
