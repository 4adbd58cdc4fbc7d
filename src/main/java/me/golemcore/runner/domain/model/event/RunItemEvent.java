package me.golemcore.runner.domain.model.event;

import me.golemcore.runner.domain.model.item.RunItem;

/**
 * A run item was recorded. {@code name} is one of the constants below.
 */
public record RunItemEvent(String name, RunItem item) implements RunEvent {

    public static final String MESSAGE_OUTPUT_CREATED = "message_output_created";
    public static final String TOOL_CALLED = "tool_called";
    public static final String TOOL_OUTPUT = "tool_output";
    public static final String HANDOFF_REQUESTED = "handoff_requested";
    public static final String HANDOFF_OCCURED = "handoff_occured";
    public static final String TOOL_APPROVAL_REQUESTED = "tool_approval_requested";
    public static final String MCP_APPROVAL_REQUESTED = "mcp_approval_requested";
    public static final String MCP_APPROVAL_RESPONSE = "mcp_approval_response";
    public static final String MCP_LIST_TOOLS = "mcp_list_tools";
    public static final String REASONING_ITEM_CREATED = "reasoning_item_created";

    @Override
    public String getType() {
        return "run_item_stream_event";
    }
}
