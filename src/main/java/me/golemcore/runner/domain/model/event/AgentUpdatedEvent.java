package me.golemcore.runner.domain.model.event;

import me.golemcore.runner.domain.model.Agent;

public record AgentUpdatedEvent(Agent newAgent) implements RunEvent {

    @Override
    public String getType() {
        return "agent_updated_stream_event";
    }
}
