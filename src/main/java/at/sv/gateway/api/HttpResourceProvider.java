package at.sv.gateway.api;

import okhttp3.HttpUrl;

/**
 * Performs plain JSON calls against Home Assistant. Every non-2xx answer is reported as one of the failure
 * exceptions of this package:
 * <ul>
 *     <li>{@link HassAuthenticationFailure} for 401 and 403</li>
 *     <li>{@link ResourceNotFoundException} for 404</li>
 *     <li>{@link ApiFailure} for 429 and 5xx</li>
 *     <li>{@link HassConnectionFailure} for other codes, I/O errors and timeouts</li>
 * </ul>
 */
public interface HttpResourceProvider {

    /**
     * @return the response body, never null
     */
    String getResource(HttpUrl url);

    /**
     * @param body the JSON payload
     * @return the response body, never null but possibly empty
     */
    String postResource(HttpUrl url, String body);
}
