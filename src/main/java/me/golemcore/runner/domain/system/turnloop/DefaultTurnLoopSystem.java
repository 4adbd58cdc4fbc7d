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

import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.MaxTurnsExceededException;
import me.golemcore.runner.domain.exception.ModelBehaviorException;
import me.golemcore.runner.domain.exception.RunPhase;
import me.golemcore.runner.domain.exception.UserErrorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.Handoff;
import me.golemcore.runner.domain.model.ModelRequest;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ModelStreamEvent;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.SingleStepResult;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.event.RawModelEvent;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolCallItem;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.domain.state.RunState;
import me.golemcore.runner.infrastructure.config.RunnerProperties;
import me.golemcore.runner.port.outbound.ConversationLockedException;
import me.golemcore.runner.port.outbound.ModelPort;
import me.golemcore.runner.port.outbound.SessionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Turn controller: calls the model, decodes its response, executes what it
 * asked for and repeats until a final output, an interruption or the turn
 * limit.
 *
 * <p>
 * One turn is exactly one model call. The state is updated only between
 * turns, so a state handed out with an interruption or a turn-limit error can
 * always be resumed.
 */
public class DefaultTurnLoopSystem implements TurnLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultTurnLoopSystem.class);

    static final String TOOL_CHOICE_NONE = "none";

    private final ResponseDecoder decoder;
    private final ToolExecutionCoordinator coordinator;
    private final InterruptedTurnResolver resolver;
    private final HistoryWriter historyWriter;
    private final RunnerProperties.TurnProperties turnSettings;
    private final RunnerProperties.ConversationProperties conversationSettings;
    private final ModelPort defaultModel;

    public DefaultTurnLoopSystem(ResponseDecoder decoder, ToolExecutionCoordinator coordinator,
            InterruptedTurnResolver resolver, HistoryWriter historyWriter, RunnerProperties.TurnProperties turnSettings,
            RunnerProperties.ConversationProperties conversationSettings, ModelPort defaultModel) {
        this.decoder = decoder;
        this.coordinator = coordinator;
        this.resolver = resolver;
        this.historyWriter = historyWriter;
        this.turnSettings = turnSettings;
        this.conversationSettings = conversationSettings;
        this.defaultModel = defaultModel;
    }

    @Override
    public RunResult run(Agent agent, List<ProtocolItem> input, RunConfig config) {
        Objects.requireNonNull(agent, "agent");
        RunConfig runConfig = config != null ? config : RunConfig.defaults();
        RunContext context = new RunContext(runConfig.getContext());
        int maxTurns = runConfig.getMaxTurns() != null ? runConfig.getMaxTurns()
                : turnSettings != null ? turnSettings.getMaxTurns() : 10;

        List<ProtocolItem> newInput = input != null ? input : List.of();
        List<ProtocolItem> originalInput = new ArrayList<>();
        SessionPort session = runConfig.getSession();
        if (session != null) {
            if (!runConfig.isServerManagedConversation()) {
                originalInput.addAll(historyWriter.loadHistory(session));
            } else {
                log.debug("[TurnLoop] Conversation is server-managed, not seeding input from the session");
            }
            historyWriter.appendInput(session, newInput);
        }
        originalInput.addAll(newInput);

        RunState state = new RunState(agent, originalInput, context, maxTurns);
        state.setConversationId(runConfig.getConversationId());
        state.setPreviousResponseId(runConfig.getPreviousResponseId());
        state.setAutoPreviousResponseId(runConfig.isAutoPreviousResponseId());

        log.info("[TurnLoop] Starting run of agent {} (max turns {})", agent.getName(), maxTurns);
        return execute(state, runConfig, false);
    }

    @Override
    public RunResult resume(RunState state, RunConfig config) {
        Objects.requireNonNull(state, "state");
        if (state.getCurrentStep() instanceof NextStep.FinalOutput) {
            throw new UserErrorException(RunPhase.RESUME, "Run already produced its final output, nothing to resume");
        }
        RunConfig runConfig = config != null ? config : RunConfig.defaults();
        if (runConfig.getConversationId() != null) {
            state.setConversationId(runConfig.getConversationId());
        }
        if (runConfig.getPreviousResponseId() != null) {
            state.setPreviousResponseId(runConfig.getPreviousResponseId());
        }
        if (runConfig.isAutoPreviousResponseId()) {
            state.setAutoPreviousResponseId(true);
        }

        log.info("[TurnLoop] Resuming agent {} at turn {} ({} pending approvals)", state.getCurrentAgent().getName(),
                state.getCurrentTurn(), state.getInterruptions().size());
        return execute(state, runConfig, true);
    }

    private RunResult execute(RunState state, RunConfig config, boolean resuming) {
        RunScope scope = openScope(state, config, resuming);

        if (state.getCurrentStep() instanceof NextStep.Interruption interruption) {
            TurnContext turn = scope.turn(state.getCurrentAgent());
            ProcessedResponse processed = state.getLastProcessedResponse() != null
                    ? state.getLastProcessedResponse()
                    : ProcessedResponse.builder().build();
            SingleStepResult step = resolver.resolve(turn, state.getOriginalInput(), state.getGeneratedItems(),
                    state.getLastModelResponse(), processed, interruption.interruptions());
            RunResult result = applyStep(scope, step);
            if (result != null) {
                return result;
            }
        }

        Agent startedAgent = null;
        while (true) {
            Agent agent = state.getCurrentAgent();
            TurnContext turn = scope.turn(agent);
            if (agent != startedAgent) {
                turn.hooks().forEach(hook -> hook.onAgentStart(state.getContext(), agent));
                startedAgent = agent;
            }

            if (state.getCurrentTurn() + 1 > state.getMaxTurns()) {
                log.warn("[TurnLoop] Agent {} reached the turn limit ({})", agent.getName(), state.getMaxTurns());
                throw new MaxTurnsExceededException(state.getMaxTurns(), state,
                        (paused, instruction) -> forceFinalOutput(paused, config, instruction));
            }
            state.setCurrentTurn(state.getCurrentTurn() + 1);
            log.debug("[TurnLoop] Turn {} of agent {}", state.getCurrentTurn(), agent.getName());

            ModelRequest request = buildRequest(agent, state, scope, false);
            ModelResponse response = callModel(scope, turn, request);

            ProcessedResponse processed = decoder.decode(agent, agent.getEnabledTools(), response,
                    agent.getOutputSchema(), agent.getEnabledHandoffs());
            // Model output items go out before their tools start.
            scope.emitter.itemsRecorded(processed.getNewItems());
            SingleStepResult step = coordinator.execute(turn, state.getOriginalInput(), state.getGeneratedItems(),
                    response, processed);
            RunResult result = applyStep(scope, step);
            if (result != null) {
                return result;
            }
        }
    }

    /**
     * Makes one more model call with tool use disabled and takes its answer as
     * the final output. Used after the turn limit was hit.
     */
    RunResult forceFinalOutput(RunState state, RunConfig config, String extraInstruction) {
        RunConfig runConfig = config != null ? config : RunConfig.defaults();
        RunScope scope = openScope(state, runConfig, true);
        Agent agent = state.getCurrentAgent();
        TurnContext turn = scope.turn(agent);

        Message instruction = null;
        if (extraInstruction != null && !extraInstruction.isBlank()) {
            instruction = Message.user(extraInstruction);
            List<ProtocolItem> input = new ArrayList<>(state.getOriginalInput());
            input.add(instruction);
            state.setOriginalInput(input);
        }
        if (scope.tracker != null) {
            // The hydrated tracker treats the whole state as delivered, but the limit stopped the run
            // before the last turn's tool outputs and the instruction reached the server.
            List<ProtocolItem> pending = unsentToolOutputs(state);
            if (instruction != null) {
                pending.add(instruction);
            }
            scope.tracker.addPendingInput(pending);
        }
        state.setCurrentTurn(state.getCurrentTurn() + 1);
        log.info("[TurnLoop] Forcing final output of agent {} at turn {}", agent.getName(), state.getCurrentTurn());

        ModelRequest request = buildRequest(agent, state, scope, true);
        ModelResponse response = callModel(scope, turn, request);
        ProcessedResponse processed = decoder.decode(agent, List.of(), response, agent.getOutputSchema(),
                List.of());
        NextStep next = coordinator.messageFinalOutput(agent, processed);
        if (!(next instanceof NextStep.FinalOutput)) {
            throw new ModelBehaviorException("Agent " + agent.getName()
                    + " produced no final output after the turn limit");
        }
        SingleStepResult step = new SingleStepResult(state.getOriginalInput(), response,
                state.getGeneratedItems(), processed.getNewItems(), next, processed);
        return applyStep(scope, step);
    }

    private static List<ProtocolItem> unsentToolOutputs(RunState state) {
        List<ProtocolItem> pending = new ArrayList<>();
        List<ModelResponse> responses = state.getModelResponses();
        if (responses.isEmpty()) {
            return pending;
        }
        Set<String> lastCallIds = new HashSet<>();
        for (ProtocolItem item : responses.get(responses.size() - 1).getOutput()) {
            if (item != null && item.callId() != null && !item.carriesOutput()) {
                lastCallIds.add(item.callId());
            }
        }
        for (RunItem item : state.getGeneratedItems()) {
            ProtocolItem raw = item.getRawItem();
            if (raw != null && raw.carriesOutput() && lastCallIds.contains(raw.callId())) {
                ProtocolItem input = item.toInputItem();
                if (input != null) {
                    pending.add(input);
                }
            }
        }
        return pending;
    }

    private RunScope openScope(RunState state, RunConfig config, boolean resuming) {
        ServerConversationTracker tracker = null;
        if (state.getConversationId() != null || state.getPreviousResponseId() != null
                || state.isAutoPreviousResponseId()) {
            tracker = new ServerConversationTracker(state.getConversationId(), state.getPreviousResponseId(),
                    state.isAutoPreviousResponseId());
            if (resuming) {
                List<ProtocolItem> sessionItems = config.getSession() != null
                        ? historyWriter.loadHistory(config.getSession())
                        : null;
                tracker.hydrateFromState(state.getOriginalInput(), state.getGeneratedItems(),
                        state.getModelResponses(), sessionItems);
            }
        }
        return new RunScope(state, config, new RunEventEmitter(config.getEventListener()), tracker);
    }

    private ModelRequest buildRequest(Agent agent, RunState state, RunScope scope, boolean toolsDisabled) {
        List<ProtocolItem> input;
        if (scope.tracker != null) {
            input = scope.tracker.prepareInput(state.getOriginalInput(), state.getGeneratedItems());
        } else {
            input = new ArrayList<>(state.getOriginalInput());
            state.getGeneratedItems().stream()
                    .map(RunItem::toInputItem)
                    .filter(Objects::nonNull)
                    .forEach(input::add);
        }

        ModelRequest.ModelRequestBuilder builder = ModelRequest.builder()
                .agentName(agent.getName())
                .model(scope.config.getModel())
                .systemInstructions(agent.getInstructions())
                .input(input)
                .outputSchema(agent.getOutputSchema());
        if (toolsDisabled) {
            builder.tools(List.of()).handoffs(List.of()).toolChoice(TOOL_CHOICE_NONE);
        } else {
            builder.tools(toolDefinitions(agent))
                    .handoffs(agent.getEnabledHandoffs().stream().map(Handoff::toDefinition).toList())
                    .toolChoice(toolChoice(agent, state));
        }
        if (scope.tracker != null) {
            builder.conversationId(scope.tracker.getConversationId())
                    .previousResponseId(scope.tracker.getPreviousResponseId());
        }
        return builder.build();
    }

    private static List<ToolDefinition> toolDefinitions(Agent agent) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (Component component : agent.getEnabledTools()) {
            if (component instanceof ToolComponent tool) {
                definitions.add(tool.getDefinition());
            } else if (component instanceof HostedToolComponent hosted) {
                definitions.add(ToolDefinition.simple(hosted.getKind().getCallType(),
                        "Provider-hosted tool " + hosted.getName()));
            } else if (component instanceof HostedMcpTool mcp) {
                definitions.add(ToolDefinition.simple("mcp:" + mcp.getServerLabel(),
                        "Hosted MCP server " + mcp.getServerLabel()));
            }
        }
        return definitions;
    }

    // A forced tool choice is dropped once the agent has used tools, otherwise it would loop on the same tool.
    private static String toolChoice(Agent agent, RunState state) {
        if (agent.getToolChoice() == null || !agent.isResetToolChoice()) {
            return agent.getToolChoice();
        }
        boolean usedTools = state.getGeneratedItems().stream()
                .anyMatch(item -> item instanceof ToolCallItem && item.getAgent() == agent);
        return usedTools ? null : agent.getToolChoice();
    }

    private ModelResponse callModel(RunScope scope, TurnContext turn, ModelRequest request) {
        Agent agent = turn.agent();
        ModelPort model = new UsageTrackingModelPortDecorator(resolveModel(agent, scope.config),
                scope.state.getContext().getUsage());

        turn.hooks().forEach(hook -> hook.onModelStart(turn.context(), agent, request));
        if (scope.tracker != null) {
            scope.tracker.markInputAsSent(request.getInput());
        }

        ModelResponse response = invokeWithLockRetry(model, request, scope);
        if (response == null) {
            throw new AgentRunException(RunPhase.MODEL, "Model returned no response for agent " + agent.getName());
        }

        turn.hooks().forEach(hook -> hook.onModelEnd(turn.context(), agent, response));
        scope.state.getModelResponses().add(response);
        if (scope.tracker != null) {
            scope.tracker.trackServerItems(response);
            scope.state.setPreviousResponseId(scope.tracker.getPreviousResponseId());
        }
        return response;
    }

    // A locked conversation gets exactly one retry with the same input.
    private ModelResponse invokeWithLockRetry(ModelPort model, ModelRequest request, RunScope scope) {
        try {
            return invokeModel(model, request, scope);
        } catch (ConversationLockedException e) {
            if (scope.tracker == null || conversationSettings == null || !conversationSettings.isRetryOnLock()) {
                throw e;
            }
            log.warn("[TurnLoop] {}, retrying once", e.getMessage());
            scope.tracker.rewindInput(request.getInput());
            ModelResponse response = invokeModel(model, request, scope);
            scope.tracker.markInputAsSent(request.getInput());
            return response;
        }
    }

    private ModelResponse invokeModel(ModelPort model, ModelRequest request, RunScope scope) {
        try {
            if (scope.config.isStreaming() && model.supportsStreaming()) {
                return model.stream(request)
                        .doOnNext(event -> scope.emitter.emit(new RawModelEvent(event)))
                        .filter(ModelStreamEvent::isCompleted)
                        .next()
                        .map(ModelStreamEvent::response)
                        .blockOptional()
                        .orElseThrow(() -> new AgentRunException(RunPhase.MODEL,
                                "Model stream ended without a completed response"));
            }
            return model.call(request).join();
        } catch (CompletionException e) {
            throw asModelException(ToolCallInvoker.unwrap(e));
        } catch (AgentRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw asModelException(Exceptions.unwrap(e));
        }
    }

    private ModelPort resolveModel(Agent agent, RunConfig config) {
        if (config.getModelPort() != null) {
            return config.getModelPort();
        }
        if (agent.getModel() != null) {
            return agent.getModel();
        }
        if (defaultModel != null) {
            return defaultModel;
        }
        throw new UserErrorException("No model configured for agent " + agent.getName());
    }

    private RunResult applyStep(RunScope scope, SingleStepResult step) {
        RunState state = scope.state;
        Agent agent = state.getCurrentAgent();
        state.setOriginalInput(new ArrayList<>(step.originalInput()));
        state.setGeneratedItems(step.generatedItems());
        state.setLastProcessedResponse(step.processedResponse());
        state.setCurrentStep(step.nextStep());

        scope.emitter.itemsRecorded(step.newStepItems());
        if (scope.config.getSession() != null) {
            historyWriter.appendTurnItems(scope.config.getSession(), step.newStepItems());
        }

        NextStep next = step.nextStep();
        if (next instanceof NextStep.FinalOutput finalOutput) {
            TurnContext turn = scope.turn(agent);
            turn.hooks().forEach(hook -> hook.onAgentEnd(state.getContext(), agent, finalOutput.output()));
            log.info("[TurnLoop] Agent {} finished after {} turns", agent.getName(), state.getCurrentTurn());
            return buildResult(state, finalOutput.output());
        }
        if (next instanceof NextStep.Interruption interruption) {
            log.info("[TurnLoop] Run paused at turn {}: {} calls waiting for approval", state.getCurrentTurn(),
                    interruption.interruptions().size());
            return buildResult(state, null);
        }
        if (next instanceof NextStep.Handoff handoff) {
            state.setCurrentAgent(handoff.newAgent());
            scope.emitter.agentUpdated(handoff.newAgent());
        }
        return null;
    }

    private static RunResult buildResult(RunState state, Object finalOutput) {
        return RunResult.builder()
                .finalOutput(finalOutput)
                .input(List.copyOf(state.getOriginalInput()))
                .newItems(List.copyOf(state.getGeneratedItems()))
                .interruptions(state.getInterruptions())
                .rawResponses(List.copyOf(state.getModelResponses()))
                .lastAgent(state.getCurrentAgent())
                .currentTurn(state.getCurrentTurn())
                .context(state.getContext())
                .state(state)
                .build();
    }

    private static AgentRunException asModelException(Throwable cause) {
        if (cause instanceof AgentRunException runException) {
            return runException;
        }
        return new AgentRunException(RunPhase.MODEL, "Model call failed: " + ToolCallInvoker.safeCauseMessage(cause),
                cause);
    }

    private static final class RunScope {
        private final RunState state;
        private final RunConfig config;
        private final RunEventEmitter emitter;
        private final ServerConversationTracker tracker;

        private RunScope(RunState state, RunConfig config, RunEventEmitter emitter,
                ServerConversationTracker tracker) {
            this.state = state;
            this.config = config;
            this.emitter = emitter;
            this.tracker = tracker;
        }

        private TurnContext turn(Agent agent) {
            return TurnContext.of(agent, state.getContext(), config.getHooks(), emitter,
                    config.getHandoffInputFilter());
        }
    }
}
