package me.golemcore.runner.domain.system.turnloop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.McpApprovalDecision;
import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.RunPhase;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ApprovalStatus;
import me.golemcore.runner.domain.model.Handoff;
import me.golemcore.runner.domain.model.HandoffInputData;
import me.golemcore.runner.domain.model.HandoffInputFilter;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.OutputSchema;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.SingleStepResult;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolUseBehavior;
import me.golemcore.runner.domain.model.item.HandoffOutputItem;
import me.golemcore.runner.domain.model.item.McpApprovalResponseItem;
import me.golemcore.runner.domain.model.item.MessageOutputItem;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;
import me.golemcore.runner.domain.model.protocol.McpApprovalResponse;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Executes what the decoder classified in one model response and decides the
 * next step.
 *
 * <p>
 * Order of work in a turn:
 * <ol>
 * <li>function and hosted tool calls run concurrently; results are recorded in
 * call order</li>
 * <li>undecided approval-gated calls pause the turn</li>
 * <li>hosted MCP approval callbacks</li>
 * <li>the first handoff, if any</li>
 * <li>tool-use final output, then final output from the assistant message</li>
 * </ol>
 */
@Slf4j
public class ToolExecutionCoordinator {

    static final String MULTIPLE_HANDOFFS_MESSAGE = "Multiple handoffs detected, ignoring this one.";

    private final ToolCallInvoker invoker;
    private final ExecutorService toolExecutor;
    private final boolean autoApproveHostedWithoutCallback;

    public ToolExecutionCoordinator(ToolCallInvoker invoker, ExecutorService toolExecutor,
            boolean autoApproveHostedWithoutCallback) {
        this.invoker = invoker;
        this.toolExecutor = toolExecutor;
        this.autoApproveHostedWithoutCallback = autoApproveHostedWithoutCallback;
    }

    SingleStepResult execute(TurnContext turn, List<ProtocolItem> originalInput, List<RunItem> preStepItems,
            ModelResponse response, ProcessedResponse processed) {
        Agent agent = turn.agent();
        List<RunItem> newItems = new ArrayList<>(processed.getNewItems());

        List<Supplier<ToolCallResult>> functionCalls = processed.getFunctions().stream()
                .<Supplier<ToolCallResult>>map(run -> () -> invoker.invokeFunction(agent, run.tool(),
                        run.toolCall(), turn.context(), turn.hooks(), turn.emitter()))
                .toList();
        List<Supplier<ToolCallResult>> hostedCalls = processed.getHostedCalls().stream()
                .<Supplier<ToolCallResult>>map(run -> () -> invoker.invokeHosted(agent, run.tool(),
                        run.toolCall(), turn.context(), turn.hooks(), turn.emitter()))
                .toList();
        List<Supplier<ToolCallResult>> all = new ArrayList<>(functionCalls);
        all.addAll(hostedCalls);
        List<ToolCallResult> results = runConcurrently(all);
        List<ToolCallResult> functionResults = results.subList(0, functionCalls.size());

        List<ToolApprovalItem> interruptions = new ArrayList<>();
        for (ToolCallResult result : results) {
            newItems.add(result.runItem());
            if (result.isInterruption()) {
                interruptions.add((ToolApprovalItem) result.runItem());
            }
        }

        List<ProcessedResponse.McpApprovalRun> withCallback = new ArrayList<>();
        for (ProcessedResponse.McpApprovalRun run : processed.getMcpApprovalRequests()) {
            if (run.tool().hasApprovalCallback()) {
                withCallback.add(run);
            } else {
                RunItem item = resolveMcpWithoutCallback(turn, run, null);
                newItems.add(item);
                if (item instanceof ToolApprovalItem approval) {
                    interruptions.add(approval);
                }
            }
        }

        Optional<ToolCallResult> toolFinal = toolUseFinalOutput(agent, processed, functionResults);
        processed.getInterruptions().clear();
        if (!interruptions.isEmpty()) {
            if (toolFinal.isPresent()) {
                log.info("[TurnLoop] Agent {} produced a final tool output, dropping {} pending approvals",
                        agent.getName(), interruptions.size());
                newItems.removeIf(ToolApprovalItem.class::isInstance);
                return step(originalInput, response, preStepItems, newItems,
                        new NextStep.FinalOutput(toolFinal.get().output()), processed);
            }
            processed.getInterruptions().addAll(interruptions);
            log.info("[TurnLoop] Agent {} paused: {} calls waiting for approval", agent.getName(),
                    interruptions.size());
            return step(originalInput, response, preStepItems, newItems,
                    new NextStep.Interruption(List.copyOf(interruptions)), processed);
        }

        newItems.addAll(runMcpCallbacks(turn, withCallback));

        if (!processed.getHandoffs().isEmpty()) {
            return executeHandoffs(turn, originalInput, preStepItems, newItems, response, processed,
                    processed.getHandoffs());
        }

        if (toolFinal.isPresent()) {
            return step(originalInput, response, preStepItems, newItems,
                    new NextStep.FinalOutput(toolFinal.get().output()), processed);
        }

        return step(originalInput, response, preStepItems, newItems,
                messageFinalOutput(agent, processed), processed);
    }

    /**
     * Runs the calls on the tool executor and returns their results in call
     * order. If any call fails, the first failure in call order propagates
     * after every call has finished.
     */
    List<ToolCallResult> runConcurrently(List<Supplier<ToolCallResult>> calls) {
        List<CompletableFuture<ToolCallResult>> futures = calls.stream()
                .map(call -> CompletableFuture.supplyAsync(call, toolExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(error -> null)
                .join();

        List<ToolCallResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ToolCallResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                throw asRunException(ToolCallInvoker.unwrap(e));
            }
        }
        return results;
    }

    RunItem resolveMcpWithoutCallback(TurnContext turn, ProcessedResponse.McpApprovalRun run,
            ToolApprovalItem existingApproval) {
        McpApprovalRequest request = run.request();
        if (autoApproveHostedWithoutCallback) {
            log.warn("[Tools] MCP server {} has no approval callback, approving request {} ({})",
                    request.getServerLabel(), request.getId(), request.getName());
            return mcpResponse(turn.agent(), request, McpApprovalDecision.approved());
        }
        ApprovalStatus status = turn.context().getApprovalStatus(request.getName(), request.getId());
        return switch (status) {
        case APPROVED -> mcpResponse(turn.agent(), request, McpApprovalDecision.approved());
        case REJECTED -> mcpResponse(turn.agent(), request, McpApprovalDecision.rejected(null));
        case UNKNOWN -> existingApproval != null
                ? existingApproval
                : new ToolApprovalItem(turn.agent(), request, request.getName(),
                        ToolOrigin.protocolTool(request.getServerLabel()));
        };
    }

    List<RunItem> runMcpCallbacks(TurnContext turn, List<ProcessedResponse.McpApprovalRun> runs) {
        List<CompletableFuture<McpApprovalDecision>> futures = runs.stream()
                .map(run -> run.tool().getApprovalCallback().onApprovalRequest(turn.context(), run.request()))
                .toList();
        List<RunItem> items = new ArrayList<>();
        for (int i = 0; i < runs.size(); i++) {
            McpApprovalDecision decision;
            try {
                decision = futures.get(i).join();
            } catch (CompletionException e) {
                throw asRunException(ToolCallInvoker.unwrap(e));
            }
            if (decision == null) {
                decision = McpApprovalDecision.rejected("Approval callback returned no decision");
            }
            items.add(mcpResponse(turn.agent(), runs.get(i).request(), decision));
        }
        return items;
    }

    SingleStepResult executeHandoffs(TurnContext turn, List<ProtocolItem> originalInput,
            List<RunItem> preStepItems, List<RunItem> newItems, ModelResponse response,
            ProcessedResponse processed, List<ProcessedResponse.HandoffRun> handoffs) {
        Agent agent = turn.agent();
        ProcessedResponse.HandoffRun chosen = handoffs.get(0);
        for (ProcessedResponse.HandoffRun ignored : handoffs.subList(1, handoffs.size())) {
            log.warn("[TurnLoop] Agent {} requested several handoffs, ignoring {}", agent.getName(),
                    ignored.handoff().getToolName());
            FunctionCallOutput raw = FunctionCallOutput.of(ignored.toolCall().getCallId(),
                    MULTIPLE_HANDOFFS_MESSAGE);
            newItems.add(new ToolCallOutputItem(agent, raw, MULTIPLE_HANDOFFS_MESSAGE, ToolOrigin.function()));
        }

        Handoff handoff = chosen.handoff();
        Agent target = handoff.getTarget();
        if (handoff.getOnHandoff() != null) {
            try {
                handoff.getOnHandoff().onHandoff(turn.context(), chosen.toolCall().getArguments());
            } catch (AgentRunException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AgentRunException(RunPhase.EXECUTE, "Handoff callback to " + target.getName()
                        + " failed: " + ToolCallInvoker.safeCauseMessage(e), e);
            }
        }

        FunctionCallOutput transfer = FunctionCallOutput.of(chosen.toolCall().getCallId(),
                handoff.getTransferMessage());
        newItems.add(new HandoffOutputItem(agent, transfer, agent, target));

        turn.hooks().forEach(hook -> hook.onHandoff(turn.context(), agent, target));
        if (target.getHooks() != null) {
            target.getHooks().onHandoff(turn.context(), agent, target);
        }

        List<ProtocolItem> input = originalInput;
        List<RunItem> before = preStepItems;
        List<RunItem> during = newItems;
        HandoffInputFilter filter = handoff.getInputFilter() != null ? handoff.getInputFilter()
                : turn.runInputFilter();
        if (filter != null) {
            HandoffInputData filtered = filter.filter(new HandoffInputData(List.copyOf(originalInput),
                    List.copyOf(preStepItems), List.copyOf(newItems)));
            input = new ArrayList<>(filtered.inputHistory());
            before = new ArrayList<>(filtered.preHandoffItems());
            during = new ArrayList<>(filtered.newItems());
        }

        log.info("[TurnLoop] Handoff from {} to {}", agent.getName(), target.getName());
        return step(input, response, before, during, new NextStep.Handoff(target), processed);
    }

    /**
     * Final output produced by tools: a structured-output json tool call, or
     * the first function output when the agent stops on its first tool.
     */
    Optional<ToolCallResult> toolUseFinalOutput(Agent agent, ProcessedResponse processed,
            List<ToolCallResult> functionResults) {
        for (int i = 0; i < functionResults.size(); i++) {
            ToolCallResult result = functionResults.get(i);
            if (!result.isInterruption() && processed.getFunctions().get(i).tool() instanceof JsonToolCallTool) {
                return Optional.of(result);
            }
        }
        if (agent.getToolUseBehavior() == ToolUseBehavior.STOP_ON_FIRST_TOOL) {
            return functionResults.stream().filter(result -> !result.isInterruption()).findFirst();
        }
        return Optional.empty();
    }

    NextStep messageFinalOutput(Agent agent, ProcessedResponse processed) {
        if (processed.hasToolsOrApprovalsToRun()) {
            return new NextStep.RunAgain();
        }
        String text = null;
        for (RunItem item : processed.getNewItems()) {
            if (item instanceof MessageOutputItem message && message.getRawItem().isAssistant()) {
                text = message.text();
            }
        }
        OutputSchema schema = agent.getOutputSchema();
        if (schema == null || schema.isPlainText()) {
            return new NextStep.FinalOutput(text != null ? text : "");
        }
        if (text != null) {
            return new NextStep.FinalOutput(schema.validate(text));
        }
        return new NextStep.RunAgain();
    }

    private McpApprovalResponseItem mcpResponse(Agent agent, McpApprovalRequest request,
            McpApprovalDecision decision) {
        McpApprovalResponse raw = McpApprovalResponse.builder()
                .approvalRequestId(request.getId())
                .approve(decision.approve())
                .reason(decision.reason())
                .build();
        return new McpApprovalResponseItem(agent, raw);
    }

    private static SingleStepResult step(List<ProtocolItem> originalInput, ModelResponse response,
            List<RunItem> preStepItems, List<RunItem> newItems, NextStep nextStep, ProcessedResponse processed) {
        return new SingleStepResult(originalInput, response, preStepItems, newItems, nextStep, processed);
    }

    private static RuntimeException asRunException(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new AgentRunException(RunPhase.EXECUTE, "Tool call failed: "
                + ToolCallInvoker.safeCauseMessage(cause), cause);
    }
}
