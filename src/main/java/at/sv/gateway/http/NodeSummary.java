package at.sv.gateway.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.Map;

/**
 * Entry of the node list. Fields stay null if the node has no entity of the domain, or if its state could not be
 * read.
 */
@Data
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"node", "switch", "sensor", "number", "light",
        "switch_name", "switch_state", "number_name", "number_state", "number_attrs",
        "sensor_name", "sensor_state"})
public final class NodeSummary {
    String node;
    @JsonProperty("switch")
    String switch_entity;
    String sensor;
    String number;
    String light;
    String switch_name;
    String switch_state;
    String number_name;
    String number_state;
    Map<String, Object> number_attrs;
    String sensor_name;
    String sensor_state;
}
