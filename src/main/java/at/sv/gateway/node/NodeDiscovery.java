package at.sv.gateway.node;

import at.sv.gateway.api.ApiResult;

import java.util.Map;
import java.util.Set;

/**
 * Derives the current nodes from the (possibly cached) state snapshot.
 */
public class NodeDiscovery {

    private final StateSnapshotProvider snapshotProvider;
    private final Set<String> domainWhitelist;

    public NodeDiscovery(StateSnapshotProvider snapshotProvider, Set<String> domainWhitelist) {
        this.snapshotProvider = snapshotProvider;
        this.domainWhitelist = Set.copyOf(domainWhitelist);
    }

    public ApiResult<Map<String, Node>> discoverNodes() {
        return snapshotProvider.getStates()
                               .map(states -> NodeMapper.buildNodeMap(states, domainWhitelist));
    }
}
