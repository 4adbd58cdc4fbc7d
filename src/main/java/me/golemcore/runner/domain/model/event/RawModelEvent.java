package me.golemcore.runner.domain.model.event;

import me.golemcore.runner.domain.model.ModelStreamEvent;

public record RawModelEvent(ModelStreamEvent data) implements RunEvent {

    @Override
    public String getType() {
        return "raw_response_event";
    }
}
