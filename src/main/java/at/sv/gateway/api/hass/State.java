package at.sv.gateway.api.hass;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class State {
    String entity_id;
    String state;
    Map<String, Object> attributes;

    public String getDomain() {
        return HassApiUtils.getDomain(entity_id);
    }

    public String getObjectId() {
        return HassApiUtils.getObjectId(entity_id);
    }

    /**
     * @return the {@code friendly_name} attribute, or the entity id if there is none
     */
    public String getFriendlyName() {
        if (attributes != null && attributes.get("friendly_name") instanceof String name && !name.isEmpty()) {
            return name;
        }
        return entity_id;
    }
}
