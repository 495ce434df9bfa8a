package at.sv.gateway.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A logical device: all whitelisted entities whose object id starts with the same token.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Node {

    private final String token;
    private final Map<String, List<String>> entities = new LinkedHashMap<>();
    private final Map<String, String> representatives = new LinkedHashMap<>();

    Node(String token) {
        this.token = token;
    }

    void addEntity(String domain, String entityId) {
        entities.computeIfAbsent(domain, d -> new ArrayList<>()).add(entityId);
    }

    void setRepresentative(String domain, String entityId) {
        representatives.put(domain, entityId);
    }

    public Map<String, List<String>> getEntities() {
        return Collections.unmodifiableMap(entities);
    }

    public Map<String, String> getRepresentatives() {
        return Collections.unmodifiableMap(representatives);
    }

    /**
     * @return the entity acting on behalf of this node for the given domain, or null if the node has none
     */
    public String getRepresentative(String domain) {
        return representatives.get(domain);
    }
}
