package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class HostedToolCallOutput implements ProtocolItem {

    private String type;
    private String id;
    @JsonAlias("call_id")
    private String callId;
    private String output;

    @Override
    public String itemId() {
        return id;
    }

    @Override
    public String callId() {
        return callId;
    }

    @Override
    public boolean carriesOutput() {
        return true;
    }

    public static HostedToolCallOutput of(HostedToolKind kind, String callId, String output) {
        return HostedToolCallOutput.builder()
                .type(kind.getOutputType())
                .callId(callId)
                .output(output)
                .build();
    }
}
