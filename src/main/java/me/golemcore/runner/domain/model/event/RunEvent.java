package me.golemcore.runner.domain.model.event;

/**
 * Event emitted while a run progresses.
 */
public interface RunEvent {

    String getType();
}
