package me.golemcore.runner.domain.system.turnloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.exception.RunPhase;
import me.golemcore.runner.domain.exception.UserErrorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ApprovalStatus;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.SingleStepResult;
import me.golemcore.runner.domain.model.item.HandoffOutputItem;
import me.golemcore.runner.domain.model.item.McpApprovalResponseItem;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Finishes a turn that was paused for approvals, using the decisions recorded
 * in the approval ledger since the pause.
 *
 * <p>
 * Approved calls run, rejected calls get a rejection output, calls that
 * already have an output are left alone, and calls still without a decision
 * stay pending. Hosted MCP requests answered by a callback are only processed
 * once nothing else is pending.
 */
@Slf4j
public class InterruptedTurnResolver {

    private final ToolExecutionCoordinator coordinator;
    private final ToolCallInvoker invoker;

    public InterruptedTurnResolver(ToolExecutionCoordinator coordinator, ToolCallInvoker invoker) {
        this.coordinator = coordinator;
        this.invoker = invoker;
    }

    SingleStepResult resolve(TurnContext turn, List<ProtocolItem> originalInput, List<RunItem> generatedItems,
            ModelResponse lastResponse, ProcessedResponse processed, List<ToolApprovalItem> pending) {
        Agent agent = turn.agent();
        Map<String, ToolApprovalItem> pendingByCallId = new LinkedHashMap<>();
        for (ToolApprovalItem item : pending) {
            pendingByCallId.putIfAbsent(item.callId(), item);
        }

        // The placeholders of the paused turn are replaced by what is decided now.
        List<RunItem> preStepItems = new ArrayList<>();
        for (RunItem item : generatedItems) {
            if (item instanceof ToolApprovalItem approval && pendingByCallId.containsKey(approval.callId())) {
                continue;
            }
            preStepItems.add(item);
        }

        Set<String> answeredCallIds = new HashSet<>();
        Set<String> answeredMcpRequests = new HashSet<>();
        for (RunItem item : preStepItems) {
            if (item instanceof ToolCallOutputItem || item instanceof HandoffOutputItem) {
                answeredCallIds.add(item.callId());
            } else if (item instanceof McpApprovalResponseItem response) {
                answeredMcpRequests.add(response.getRawItem().getApprovalRequestId());
            }
        }

        List<Supplier<ToolCallResult>> calls = new ArrayList<>();
        List<ToolApprovalItem> stillPending = new ArrayList<>();

        for (ProcessedResponse.FunctionRun run : functionRuns(agent, processed, pending)) {
            String callId = run.toolCall().getCallId();
            if (answeredCallIds.contains(callId)) {
                continue;
            }
            ToolApprovalItem placeholder = pendingByCallId.get(callId);
            ApprovalStatus status = turn.context().getApprovalStatus(run.tool().getToolName(), callId);
            if (placeholder != null && status == ApprovalStatus.UNKNOWN) {
                stillPending.add(placeholder);
            } else if (status == ApprovalStatus.REJECTED) {
                calls.add(() -> invoker.rejectedFunction(agent, run.tool().getToolName(), run.toolCall(),
                        run.tool().getOrigin()));
            } else {
                calls.add(() -> invoker.invokeFunction(agent, run.tool(), run.toolCall(), turn.context(),
                        turn.hooks(), turn.emitter()));
            }
        }

        for (ProcessedResponse.HostedRun run : processed.getHostedCalls()) {
            String callId = run.toolCall().getCallId();
            if (answeredCallIds.contains(callId)) {
                continue;
            }
            ToolApprovalItem placeholder = pendingByCallId.get(callId);
            ApprovalStatus status = turn.context().getApprovalStatus(run.tool().getName(), callId);
            if (placeholder != null && status == ApprovalStatus.UNKNOWN) {
                stillPending.add(placeholder);
            } else if (status == ApprovalStatus.REJECTED) {
                calls.add(() -> invoker.rejectedHosted(agent, run.tool().getName(), run.toolCall()));
            } else {
                calls.add(() -> invoker.invokeHosted(agent, run.tool(), run.toolCall(), turn.context(),
                        turn.hooks(), turn.emitter()));
            }
        }

        List<RunItem> newItems = new ArrayList<>();
        for (ToolCallResult result : coordinator.runConcurrently(calls)) {
            newItems.add(result.runItem());
            if (result.isInterruption()) {
                stillPending.add((ToolApprovalItem) result.runItem());
            }
        }

        List<ProcessedResponse.McpApprovalRun> withCallback = new ArrayList<>();
        for (ProcessedResponse.McpApprovalRun run : processed.getMcpApprovalRequests()) {
            if (answeredMcpRequests.contains(run.request().getId())) {
                continue;
            }
            if (run.tool().hasApprovalCallback()) {
                withCallback.add(run);
                continue;
            }
            RunItem item = coordinator.resolveMcpWithoutCallback(turn, run, pendingByCallId.get(run.request().getId()));
            if (item instanceof ToolApprovalItem approval) {
                stillPending.add(approval);
            } else {
                newItems.add(item);
            }
        }

        processed.getInterruptions().clear();
        if (!stillPending.isEmpty()) {
            processed.getInterruptions().addAll(stillPending);
            newItems.addAll(stillPending);
            log.info("[TurnLoop] Agent {} still waiting for {} approvals", agent.getName(), stillPending.size());
            return new SingleStepResult(originalInput, lastResponse, preStepItems, newItems,
                    new NextStep.Interruption(List.copyOf(stillPending)), processed);
        }

        newItems.addAll(coordinator.runMcpCallbacks(turn, withCallback));

        List<ProcessedResponse.HandoffRun> pendingHandoffs = processed.getHandoffs().stream()
                .filter(run -> !answeredCallIds.contains(run.toolCall().getCallId()))
                .toList();
        if (!pendingHandoffs.isEmpty()) {
            return coordinator.executeHandoffs(turn, originalInput, preStepItems, newItems, lastResponse,
                    processed, pendingHandoffs);
        }

        List<ToolCallResult> functionResults = functionResultsInCallOrder(processed, preStepItems, newItems);
        Optional<ToolCallResult> toolFinal = coordinator.toolUseFinalOutput(agent, processed, functionResults);
        if (toolFinal.isPresent()) {
            return new SingleStepResult(originalInput, lastResponse, preStepItems, newItems,
                    new NextStep.FinalOutput(toolFinal.get().output()), processed);
        }

        log.info("[TurnLoop] Agent {} resumed with all approvals decided", agent.getName());
        return new SingleStepResult(originalInput, lastResponse, preStepItems, newItems, new NextStep.RunAgain(),
                processed);
    }

    /**
     * Function runs of the paused turn. A state loaded without its processed
     * response still has the approval placeholders, from which the gated runs
     * are rebuilt.
     */
    private List<ProcessedResponse.FunctionRun> functionRuns(Agent agent, ProcessedResponse processed,
            List<ToolApprovalItem> pending) {
        if (!processed.getFunctions().isEmpty()) {
            return processed.getFunctions();
        }
        Map<String, ToolComponent> tools = new LinkedHashMap<>();
        for (Component component : agent.getEnabledTools()) {
            if (component instanceof ToolComponent tool) {
                tools.putIfAbsent(tool.getToolName(), tool);
            }
        }
        List<ProcessedResponse.FunctionRun> rebuilt = new ArrayList<>();
        for (ToolApprovalItem item : pending) {
            if (!(item.getRawItem() instanceof FunctionCall call)) {
                continue;
            }
            ToolComponent tool = tools.get(item.getToolName());
            if (tool == null) {
                throw new UserErrorException(RunPhase.RESUME, "Tool " + item.getToolName()
                        + " of the paused run is not available on agent " + agent.getName());
            }
            rebuilt.add(new ProcessedResponse.FunctionRun(call, tool));
        }
        processed.getFunctions().addAll(rebuilt);
        return rebuilt;
    }

    /**
     * Results of every function call of the turn, aligned with
     * {@code processed.getFunctions()}, whether the output was recorded before
     * the pause or just now.
     */
    private List<ToolCallResult> functionResultsInCallOrder(ProcessedResponse processed,
            List<RunItem> preStepItems, List<RunItem> newItems) {
        Map<String, ToolCallOutputItem> outputs = new LinkedHashMap<>();
        for (List<RunItem> items : List.of(preStepItems, newItems)) {
            for (RunItem item : items) {
                if (item instanceof ToolCallOutputItem output) {
                    outputs.put(output.callId(), output);
                }
            }
        }
        List<ToolCallResult> results = new ArrayList<>();
        for (ProcessedResponse.FunctionRun run : processed.getFunctions()) {
            ToolCallOutputItem output = outputs.get(run.toolCall().getCallId());
            if (output != null) {
                results.add(new ToolCallResult(run.tool().getToolName(), output.callId(), output,
                        output.getOutput()));
            } else {
                results.add(new ToolCallResult(run.tool().getToolName(), run.toolCall().getCallId(),
                        new ToolApprovalItem(null, run.toolCall(), run.tool().getToolName(), run.tool().getOrigin()),
                        null));
            }
        }
        return results;
    }
}
