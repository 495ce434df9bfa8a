package at.sv.gateway.node;

import at.sv.gateway.api.ApiResult;
import at.sv.gateway.api.hass.State;

import java.util.List;
import java.util.function.Supplier;

/**
 * Immutable snapshot of all entity states together with the time it was fetched. Refreshing never modifies a
 * cache, it returns a new one, so holders can swap it atomically.
 *
 * @param fetchedAt the ticker value in nanoseconds at the time of the fetch
 * @param snapshot  the fetched states, or null if nothing was fetched yet
 */
public record StateSnapshotCache(long fetchedAt, List<State> snapshot) {

    public static final StateSnapshotCache EMPTY = new StateSnapshotCache(0, null);

    public StateSnapshotCache {
        if (snapshot != null) {
            snapshot = List.copyOf(snapshot);
        }
    }

    public boolean isStale(long now, long ttlInNanos) {
        return snapshot == null || now - fetchedAt > ttlInNanos;
    }

    /**
     * Returns this cache and its snapshot if still fresh, otherwise fetches a new snapshot.
     *
     * @return the cache to keep using and the snapshot to serve, or the failure of the fetch
     */
    public ApiResult<Refresh> refresh(long now, long ttlInNanos, Supplier<ApiResult<List<State>>> fetcher) {
        if (!isStale(now, ttlInNanos)) {
            return ApiResult.success(new Refresh(this, snapshot));
        }
        return fetcher.get().map(states -> {
            StateSnapshotCache refreshed = new StateSnapshotCache(now, states);
            return new Refresh(refreshed, refreshed.snapshot);
        });
    }

    public record Refresh(StateSnapshotCache cache, List<State> snapshot) {
    }
}
