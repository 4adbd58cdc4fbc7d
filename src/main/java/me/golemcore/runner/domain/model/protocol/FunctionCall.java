package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Function-style tool call requested by the model. Arguments are the raw JSON
 * text the model produced; they are parsed only when the call runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class FunctionCall implements ProtocolItem {

    public static final String TYPE = "function_call";

    private String id;
    @JsonAlias("call_id")
    private String callId;
    private String name;
    private String arguments;
    private String status;

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
}
