package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text message in the conversation. Role is one of {@code user},
 * {@code assistant}, {@code system} or {@code developer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class Message implements ProtocolItem {

    public static final String TYPE = "message";

    private String id;
    private String role;
    private String content;
    private String status;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String itemId() {
        return id;
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String id, String content) {
        return Message.builder().id(id).role("assistant").content(content).status("completed").build();
    }

    @JsonIgnore
    public boolean isAssistant() {
        return "assistant".equals(role);
    }
}
