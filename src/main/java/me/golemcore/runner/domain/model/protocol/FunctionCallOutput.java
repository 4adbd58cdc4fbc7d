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
public class FunctionCallOutput implements ProtocolItem {

    public static final String TYPE = "function_call_output";

    private String id;
    @JsonAlias("call_id")
    private String callId;
    private String output;

    @Override
    public String getType() {
        return TYPE;
    }

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

    public static FunctionCallOutput of(String callId, String output) {
        return FunctionCallOutput.builder().callId(callId).output(output).build();
    }
}
