package me.golemcore.runner.domain.system.turnloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.event.AgentUpdatedEvent;
import me.golemcore.runner.domain.model.event.RunEvent;
import me.golemcore.runner.domain.model.event.RunEventListener;
import me.golemcore.runner.domain.model.event.RunItemEvent;
import me.golemcore.runner.domain.model.event.ToolDeltaEvent;
import me.golemcore.runner.domain.model.event.ToolEndedEvent;
import me.golemcore.runner.domain.model.event.ToolStartedEvent;
import me.golemcore.runner.domain.model.item.RunItem;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Serializes events of one run onto its listener. Tool events arrive from the
 * tool executor threads, item events from the turn loop.
 */
@Slf4j
public class RunEventEmitter {

    private final RunEventListener listener;
    private final Set<RunItem> recorded = Collections.newSetFromMap(new IdentityHashMap<>());

    public RunEventEmitter(RunEventListener listener) {
        this.listener = listener != null ? listener : RunEventListener.NOOP;
    }

    public synchronized void emit(RunEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[TurnLoop] Event listener failed on {}: {}", event.getType(), e.getMessage());
        }
    }

    void agentUpdated(Agent agent) {
        emit(new AgentUpdatedEvent(agent));
    }

    void toolStarted(String toolName, String callId) {
        emit(new ToolStartedEvent(toolName, callId));
    }

    void toolDelta(String toolName, String callId, Object delta) {
        emit(new ToolDeltaEvent(toolName, callId, delta));
    }

    void toolEnded(String toolName, String callId, String output) {
        emit(new ToolEndedEvent(toolName, callId, output));
    }

    /**
     * Emits one item event per item; items already emitted are skipped.
     */
    synchronized void itemsRecorded(List<RunItem> items) {
        for (RunItem item : items) {
            if (recorded.add(item)) {
                emit(new RunItemEvent(eventName(item), item));
            }
        }
    }

    static String eventName(RunItem item) {
        return switch (item.getType()) {
        case MESSAGE_OUTPUT -> RunItemEvent.MESSAGE_OUTPUT_CREATED;
        case TOOL_CALL -> RunItemEvent.TOOL_CALLED;
        case TOOL_CALL_OUTPUT -> RunItemEvent.TOOL_OUTPUT;
        case HANDOFF_CALL -> RunItemEvent.HANDOFF_REQUESTED;
        case HANDOFF_OUTPUT -> RunItemEvent.HANDOFF_OCCURED;
        case TOOL_APPROVAL -> RunItemEvent.TOOL_APPROVAL_REQUESTED;
        case MCP_APPROVAL_REQUEST -> RunItemEvent.MCP_APPROVAL_REQUESTED;
        case MCP_APPROVAL_RESPONSE -> RunItemEvent.MCP_APPROVAL_RESPONSE;
        case MCP_LIST_TOOLS -> RunItemEvent.MCP_LIST_TOOLS;
        case REASONING -> RunItemEvent.REASONING_ITEM_CREATED;
        };
    }
}
