package me.golemcore.runner.domain.model.event;

import me.golemcore.runner.domain.state.RunResult;

/**
 * Last event of a streamed run. Also emitted when the run pauses for
 * approvals; the result then carries the interruptions.
 */
public record RunCompletedEvent(RunResult result) implements RunEvent {

    @Override
    public String getType() {
        return "run_completed";
    }
}
