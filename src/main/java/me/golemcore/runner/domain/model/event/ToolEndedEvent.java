package me.golemcore.runner.domain.model.event;

public record ToolEndedEvent(String toolName, String callId, String output) implements RunEvent {

    @Override
    public String getType() {
        return "tool_ended";
    }
}
