package me.golemcore.runner.domain.model.event;

public record ToolDeltaEvent(String toolName, String callId, Object delta) implements RunEvent {

    @Override
    public String getType() {
        return "tool_delta";
    }
}
