package at.sv.gateway.node;

import at.sv.gateway.api.hass.HassApiUtils;
import at.sv.gateway.api.hass.State;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups entity ids into nodes by the first underscore delimited segment of their object id, and picks one
 * representative entity per domain and node.
 * <p>
 * Naming conventions differ between integrations ({@code switch.pump_1}, {@code sensor.pump1_temp},
 * {@code light.pump}), so the representative is selected by a cascade of increasingly loose rules. The rule
 * order must stay as it is, clients rely on which entity gets picked.
 */
public final class NodeMapper {

    public static final Set<String> DEFAULT_DOMAINS = Set.of("switch", "sensor", "number", "light", "binary_sensor");

    private NodeMapper() {
    }

    /**
     * @param snapshot        the entity states to group
     * @param domainWhitelist the domains to consider, entities of other domains are ignored
     * @return the nodes by token, in the order their first entity appeared in the snapshot
     */
    public static Map<String, Node> buildNodeMap(List<State> snapshot, Set<String> domainWhitelist) {
        Map<String, Node> nodeMap = new LinkedHashMap<>();
        for (State state : snapshot) {
            if (state == null) {
                continue;
            }
            String entityId = state.getEntity_id();
            String domain = HassApiUtils.getDomain(entityId);
            if (domain == null || !domainWhitelist.contains(domain)) {
                continue;
            }
            String token = getToken(HassApiUtils.getObjectId(entityId));
            if (token.isEmpty()) {
                continue;
            }
            nodeMap.computeIfAbsent(token, Node::new).addEntity(domain, entityId);
        }
        nodeMap.values().forEach(NodeMapper::assignRepresentatives);
        return nodeMap;
    }

    static String getToken(String objectId) {
        int underscoreIndex = objectId.indexOf('_');
        if (underscoreIndex == -1) {
            return objectId;
        }
        return objectId.substring(0, underscoreIndex);
    }

    private static void assignRepresentatives(Node node) {
        node.getEntities().forEach((domain, entityIds) -> {
            String representative = pickRepresentative(entityIds, node.getToken());
            if (representative != null) {
                node.setRepresentative(domain, representative);
            }
        });
    }

    static String pickRepresentative(List<String> entityIds, String token) {
        if (entityIds.isEmpty()) {
            return null;
        }
        for (String entityId : entityIds) {
            if (HassApiUtils.getObjectId(entityId).startsWith(token + "_")) {
                return entityId;
            }
        }
        for (String entityId : entityIds) {
            if (entityId.contains("." + token + ".")) {
                return entityId;
            }
        }
        for (String entityId : entityIds) {
            if (HassApiUtils.getObjectId(entityId).startsWith(token)) {
                return entityId;
            }
        }
        for (String entityId : entityIds) {
            if (entityId.contains(token)) {
                return entityId;
            }
        }
        return entityIds.get(0);
    }
}
