package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Call to a hosted capability (remote shell, patch application, computer use,
 * local shell). The {@code type} field tells which one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class HostedToolCall implements ProtocolItem {

    private String type;
    private String id;
    @JsonAlias("call_id")
    private String callId;
    private Map<String, Object> action;
    private String status;

    @Override
    public String itemId() {
        return id;
    }

    @Override
    public String callId() {
        return callId;
    }

    public HostedToolKind kind() {
        return HostedToolKind.fromCallType(type)
                .orElseThrow(() -> new IllegalStateException("Not a hosted tool call type: " + type));
    }
}
