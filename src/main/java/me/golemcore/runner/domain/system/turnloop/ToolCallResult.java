package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;

/**
 * Outcome of one tool call in a batch: either the recorded output item or an
 * approval placeholder.
 */
record ToolCallResult(String toolName, String callId, RunItem runItem, Object output) {

    boolean isInterruption() {
        return runItem instanceof ToolApprovalItem;
    }
}
