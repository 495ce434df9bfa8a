package at.sv.gateway.node;

import at.sv.gateway.api.ApiResult;
import at.sv.gateway.api.hass.HassApi;
import at.sv.gateway.api.hass.State;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves the state list of Home Assistant, fetching it at most once per time to live. Concurrent requests may
 * fetch redundantly, the last successful fetch wins.
 */
@Slf4j
public class StateSnapshotProvider {

    private final HassApi api;
    private final Ticker ticker;
    private final long ttlInNanos;
    private final AtomicReference<StateSnapshotCache> cache = new AtomicReference<>(StateSnapshotCache.EMPTY);

    public StateSnapshotProvider(HassApi api, Ticker ticker, Duration timeToLive) {
        this.api = api;
        this.ticker = ticker;
        this.ttlInNanos = timeToLive.toNanos();
    }

    public ApiResult<List<State>> getStates() {
        StateSnapshotCache current = cache.get();
        return current.refresh(ticker.read(), ttlInNanos, this::fetchStates)
                      .map(refresh -> {
                          if (refresh.cache() != current) {
                              cache.set(refresh.cache());
                          }
                          return refresh.snapshot();
                      });
    }

    private ApiResult<List<State>> fetchStates() {
        log.debug("Fetching state snapshot");
        return api.getStates();
    }
}
