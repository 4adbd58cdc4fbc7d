package me.golemcore.runner.domain.model.event;

@FunctionalInterface
public interface RunEventListener {

    RunEventListener NOOP = event -> {
    };

    void onEvent(RunEvent event);
}
