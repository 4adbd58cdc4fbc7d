package me.golemcore.runner.domain.model.event;

public record ToolStartedEvent(String toolName, String callId) implements RunEvent {

    @Override
    public String getType() {
        return "tool_started";
    }
}
