package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Passthrough for item kinds this engine does not interpret. All fields are
 * kept verbatim except provider metadata.
 */
@EqualsAndHashCode
@ToString
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnknownItem implements ProtocolItem {

    @Getter
    @Setter
    private String type;
    private Map<String, Object> properties = new LinkedHashMap<>();

    public UnknownItem(String type, Map<String, Object> properties) {
        this.type = type;
        properties.forEach(this::setProperty);
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    @JsonAnySetter
    public void setProperty(String name, Object value) {
        if ("providerData".equals(name) || "provider_data".equals(name)) {
            return;
        }
        properties.put(name, value);
    }

    @Override
    public String itemId() {
        Object id = properties.get("id");
        return id instanceof String s ? s : null;
    }

    @Override
    public String callId() {
        Object callId = properties.containsKey("callId") ? properties.get("callId") : properties.get("call_id");
        return callId instanceof String s ? s : null;
    }

    @Override
    public boolean carriesOutput() {
        return properties.containsKey("output");
    }
}
