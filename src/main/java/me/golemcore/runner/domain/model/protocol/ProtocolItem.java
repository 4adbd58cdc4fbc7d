package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Protocol-shaped payload exchanged with a model provider: the items a model
 * emits in a response and the items sent back to it as input.
 *
 * <p>
 * Every item kind is a concrete class keyed by its {@code type} discriminator.
 * Item kinds this engine does not understand are kept as {@link UnknownItem} so
 * that they survive a round-trip through the provider and through run state
 * snapshots untouched.
 *
 * <p>
 * Field names are written in camelCase. Snake-case spellings used by some
 * providers are accepted on read, and provider side-channel metadata is dropped.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true, defaultImpl = UnknownItem.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Message.class, name = Message.TYPE),
        @JsonSubTypes.Type(value = Reasoning.class, name = Reasoning.TYPE),
        @JsonSubTypes.Type(value = FunctionCall.class, name = FunctionCall.TYPE),
        @JsonSubTypes.Type(value = FunctionCallOutput.class, name = FunctionCallOutput.TYPE),
        @JsonSubTypes.Type(value = HostedToolCall.class, names = { "shell_call", "apply_patch_call", "computer_call",
                "local_shell_call" }),
        @JsonSubTypes.Type(value = HostedToolCallOutput.class, names = { "shell_call_output",
                "apply_patch_call_output", "computer_call_output", "local_shell_call_output" }),
        @JsonSubTypes.Type(value = McpApprovalRequest.class, name = McpApprovalRequest.TYPE),
        @JsonSubTypes.Type(value = McpApprovalResponse.class, name = McpApprovalResponse.TYPE),
        @JsonSubTypes.Type(value = McpListTools.class, name = McpListTools.TYPE)
})
public interface ProtocolItem {

    /**
     * Returns the wire discriminator of this item.
     */
    String getType();

    /**
     * Server-assigned item id, if the provider assigned one.
     */
    default String itemId() {
        return null;
    }

    /**
     * Call id correlating a call with its output, if this item takes part in a
     * call.
     */
    default String callId() {
        return null;
    }

    /**
     * Whether this item is the output half of a call.
     */
    default boolean carriesOutput() {
        return false;
    }
}
