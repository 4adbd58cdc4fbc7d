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

import me.golemcore.runner.adapter.outbound.session.InMemorySessionAdapter;
import me.golemcore.runner.domain.component.FunctionTool;
import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.MaxTurnsExceededException;
import me.golemcore.runner.domain.exception.ModelBehaviorException;
import me.golemcore.runner.domain.exception.RunPhase;
import me.golemcore.runner.domain.exception.UserErrorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.JsonOutputSchema;
import me.golemcore.runner.domain.model.ModelRequest;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.RunHooks;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.ToolUseBehavior;
import me.golemcore.runner.domain.model.item.HandoffOutputItem;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.RunItemType;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.domain.state.RunState;
import me.golemcore.runner.port.outbound.ConversationLockedException;
import me.golemcore.runner.testsupport.ScriptedModelPort;
import me.golemcore.runner.testsupport.TurnLoopFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static me.golemcore.runner.testsupport.ScriptedModelPort.functionCall;
import static me.golemcore.runner.testsupport.ScriptedModelPort.message;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultTurnLoopSystemTest {

    private static final String ECHO = "echo";
    private static final String ECHO_ARGS = "{\"x\":\"hi\"}";

    private TurnLoopFixture fixture;
    private ScriptedModelPort model;
    private AtomicInteger echoCalls;

    @BeforeEach
    void setUp() {
        fixture = new TurnLoopFixture();
        model = ScriptedModelPort.create();
        echoCalls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private FunctionTool echoTool(boolean needsApproval) {
        return FunctionTool.builder()
                .name(ECHO)
                .description("Echoes x")
                .parameters(Map.of("type", "object", "properties", Map.of("x", Map.of("type", "string"))))
                .handler((ctx, args) -> {
                    echoCalls.incrementAndGet();
                    return ToolResult.success(String.valueOf(args.get("x")));
                })
                .approvalPolicy((ctx, args) -> needsApproval)
                .build();
    }

    private Agent agentWith(FunctionTool tool) {
        return Agent.builder()
                .name("assistant")
                .instructions("Be helpful")
                .tools(List.of(tool))
                .build();
    }

    private RunConfig config() {
        return RunConfig.builder().modelPort(model).build();
    }

    private static List<RunItemType> types(List<RunItem> items) {
        return items.stream().map(RunItem::getType).toList();
    }

    // ==================== Final output ====================

    @Test
    void shouldReturnAssistantMessageAsFinalOutput() {
        model.respond(message("Hello"));
        Agent agent = Agent.builder().name("assistant").instructions("Be brief").build();

        RunResult result = fixture.runner().run(agent, "Hi", config());

        assertEquals("Hello", result.getFinalOutput());
        assertEquals(1, result.getCurrentTurn());
        assertEquals(1, result.getUsage().getRequests());
        assertEquals(List.of(RunItemType.MESSAGE_OUTPUT), types(result.getNewItems()));
        assertFalse(result.isInterrupted());

        ModelRequest request = model.lastRequest();
        assertEquals("Be brief", request.getSystemInstructions());
        assertEquals(List.of(Message.user("Hi")), request.getInput());
    }

    @Test
    void shouldRunToolAndCallModelAgain() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(message("done"));

        RunResult result = fixture.runner().run(agentWith(echoTool(false)), "Say hi", config());

        assertEquals("done", result.getFinalOutput());
        assertEquals(2, result.getCurrentTurn());
        assertEquals(List.of(RunItemType.TOOL_CALL, RunItemType.TOOL_CALL_OUTPUT, RunItemType.MESSAGE_OUTPUT),
                types(result.getNewItems()));

        List<ProtocolItem> secondInput = model.getRequests().get(1).getInput();
        assertEquals(3, secondInput.size());
        FunctionCallOutput output = assertInstanceOf(FunctionCallOutput.class, secondInput.get(2));
        assertEquals("c1", output.getCallId());
        assertEquals("hi", output.getOutput());
        assertEquals(ECHO, model.getRequests().get(0).getTools().get(0).getName());
    }

    @Test
    void shouldCountOneTurnPerModelCall() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(functionCall("c2", ECHO, ECHO_ARGS))
                .respond(message("done"));

        RunResult result = fixture.runner().run(agentWith(echoTool(false)), "go", config());

        assertEquals(3, result.getCurrentTurn());
        assertEquals(3, model.getRequests().size());
        assertEquals(3, result.getUsage().getRequests());
        assertEquals(30, result.getUsage().getInputTokens());
        assertEquals(3, result.getRawResponses().size());
        assertEquals(result.getRawResponses().get(2).getResponseId(), result.getLastResponseId());
    }

    @Test
    void shouldStopOnFirstToolWhenAgentAsksForIt() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS));
        Agent agent = Agent.builder()
                .name("assistant")
                .tools(List.of(echoTool(false)))
                .toolUseBehavior(ToolUseBehavior.STOP_ON_FIRST_TOOL)
                .build();

        RunResult result = fixture.runner().run(agent, "go", config());

        assertEquals("hi", result.getFinalOutput());
        assertEquals(1, model.getRequests().size());
    }

    @Test
    void shouldResetForcedToolChoiceAfterToolUse() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(message("done"));
        Agent agent = Agent.builder()
                .name("assistant")
                .tools(List.of(echoTool(false)))
                .toolChoice("required")
                .build();

        fixture.runner().run(agent, "go", config());

        assertEquals("required", model.getRequests().get(0).getToolChoice());
        assertNull(model.getRequests().get(1).getToolChoice());
    }

    // ==================== Structured output ====================

    public record Answer(String value) {
    }

    private Agent structuredAgent() {
        return Agent.builder()
                .name("structured")
                .outputSchema(JsonOutputSchema.of(Answer.class, Map.of(
                        "type", "object",
                        "properties", Map.of("value", Map.of("type", "string")),
                        "required", List.of("value"))))
                .build();
    }

    @Test
    void shouldValidateStructuredFinalOutput() {
        model.respond(message("{\"value\":\"42\"}"));

        RunResult result = fixture.runner().run(structuredAgent(), "answer", config());

        assertEquals(new Answer("42"), result.finalOutputAs(Answer.class));
        assertNotNull(model.lastRequest().getOutputSchema());
    }

    @Test
    void shouldFailWhenStructuredOutputMissesRequiredField() {
        model.respond(message("{\"other\":1}"));

        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> fixture.runner().run(structuredAgent(), "answer", config()));

        assertEquals(RunPhase.DECODE, error.getPhase());
        assertTrue(error.getMessage().contains("missing required field 'value'"));
    }

    @Test
    void shouldAcceptJsonToolCallAsStructuredOutput() {
        model.respond(functionCall("j1", JsonToolCallTool.NAME, "{\"value\":\"7\"}"));

        RunResult result = fixture.runner().run(structuredAgent(), "answer", config());

        assertEquals(new Answer("7"), result.getFinalOutput());
        assertEquals(1, result.getCurrentTurn());
    }

    // ==================== Approvals ====================

    @Test
    void shouldPauseOnGatedCallAndRunItAfterApproval() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS));
        Agent agent = agentWith(echoTool(true));

        RunResult paused = fixture.runner().run(agent, "Say hi", config());

        assertTrue(paused.isInterrupted());
        assertEquals(1, paused.getInterruptions().size());
        assertNull(paused.getFinalOutput());
        assertEquals(1, paused.getCurrentTurn());
        assertEquals(0, echoCalls.get());

        RunState state = paused.toState();
        ToolApprovalItem pending = state.getInterruptions().get(0);
        assertEquals(ECHO, pending.getToolName());
        state.approve(pending);

        model.respond(message("done"));
        RunResult resumed = fixture.runner().resume(state, config());

        assertEquals("done", resumed.getFinalOutput());
        assertEquals(2, resumed.getCurrentTurn());
        assertEquals(2, resumed.getUsage().getRequests());
        assertEquals(1, echoCalls.get());
        assertEquals(List.of(RunItemType.TOOL_CALL, RunItemType.TOOL_CALL_OUTPUT, RunItemType.MESSAGE_OUTPUT),
                types(resumed.getNewItems()));
        ToolCallOutputItem output = (ToolCallOutputItem) resumed.getNewItems().get(1);
        assertEquals("hi", output.getOutput());
    }

    @Test
    void shouldRecordRejectionWithoutRunningTool() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS));
        RunResult paused = fixture.runner().run(agentWith(echoTool(true)), "Say hi", config());
        RunState state = paused.toState();
        state.reject(state.getInterruptions().get(0));

        model.respond(message("ok, not running it"));
        RunResult resumed = fixture.runner().resume(state, config());

        assertEquals(0, echoCalls.get());
        FunctionCallOutput output = (FunctionCallOutput) resumed.getNewItems().get(1).getRawItem();
        assertEquals(ToolCallInvoker.REJECTION_MESSAGE, output.getOutput());
        assertEquals("ok, not running it", resumed.getFinalOutput());
    }

    @Test
    void shouldStayPausedWhileApprovalIsUndecided() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS));
        RunResult paused = fixture.runner().run(agentWith(echoTool(true)), "Say hi", config());

        RunResult stillPaused = fixture.runner().resume(paused.toState(), config());

        assertTrue(stillPaused.isInterrupted());
        assertEquals(1, model.getRequests().size());
        assertEquals(1, stillPaused.getNewItems().stream().filter(ToolApprovalItem.class::isInstance).count());
    }

    @Test
    void shouldRejectResumingFinishedRun() {
        model.respond(message("Hello"));
        RunResult result = fixture.runner().run(Agent.builder().name("assistant").build(), "Hi", config());

        assertThrows(UserErrorException.class, () -> fixture.runner().resume(result.toState(), config()));
    }

    // ==================== Turn limit ====================

    @Test
    void shouldStopAtTurnLimitAndFinishWithToolsDisabled() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(functionCall("c2", ECHO, ECHO_ARGS));
        RunConfig limited = config().toBuilder().maxTurns(2).build();

        MaxTurnsExceededException error = assertThrows(MaxTurnsExceededException.class,
                () -> fixture.runner().run(agentWith(echoTool(false)), "loop", limited));

        assertEquals("Max turns (2) exceeded", error.getMessage());
        assertEquals(2, error.getRunState().getCurrentTurn());
        assertEquals(2, model.getRequests().size());

        model.respond(message("final answer"));
        RunResult result = error.resume("Answer now");

        assertEquals("final answer", result.getFinalOutput());
        assertEquals(3, result.getCurrentTurn());
        ModelRequest last = model.lastRequest();
        assertTrue(last.getTools().isEmpty());
        assertTrue(last.getHandoffs().isEmpty());
        assertEquals(DefaultTurnLoopSystem.TOOL_CHOICE_NONE, last.getToolChoice());
        assertTrue(last.getInput().contains(Message.user("Answer now")));
    }

    @Test
    void shouldSendInstructionAndLastOutputsWhenForcingFinalAnswerInServerConversation() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(functionCall("c2", ECHO, ECHO_ARGS));
        RunConfig managed = config().toBuilder().maxTurns(2).conversationId("conv_1").build();

        MaxTurnsExceededException error = assertThrows(MaxTurnsExceededException.class,
                () -> fixture.runner().run(agentWith(echoTool(false)), "loop", managed));
        model.respond(message("final answer"));
        RunResult result = error.resume("Answer now");

        assertEquals("final answer", result.getFinalOutput());
        ModelRequest last = model.lastRequest();
        assertEquals("conv_1", last.getConversationId());
        assertEquals(2, last.getInput().size());
        FunctionCallOutput output = assertInstanceOf(FunctionCallOutput.class, last.getInput().get(0));
        assertEquals("c2", output.getCallId());
        assertEquals(Message.user("Answer now"), last.getInput().get(1));
    }

    // ==================== Handoffs ====================

    @Test
    void shouldHandOffToTargetAgent() {
        Agent billing = Agent.builder().name("billing").handoffDescription("Handles invoices").build();
        Agent triage = Agent.builder().name("triage").build();
        triage.addHandoff(billing);
        List<String> handoffs = new ArrayList<>();
        RunHooks hooks = new RunHooks() {
            @Override
            public void onHandoff(RunContext context, Agent fromAgent, Agent toAgent) {
                handoffs.add(fromAgent.getName() + "->" + toAgent.getName());
            }
        };

        model.respond(functionCall("h1", "transfer_to_billing", "{}"))
                .respond(message("billing here"));
        RunResult result = fixture.runner().run(triage, "invoice?", config().toBuilder().hooks(hooks).build());

        assertEquals("billing here", result.getFinalOutput());
        assertEquals("billing", result.getLastAgent().getName());
        assertEquals(List.of(RunItemType.HANDOFF_CALL, RunItemType.HANDOFF_OUTPUT, RunItemType.MESSAGE_OUTPUT),
                types(result.getNewItems()));
        HandoffOutputItem transfer = (HandoffOutputItem) result.getNewItems().get(1);
        assertEquals("{\"assistant\": \"billing\"}", ((FunctionCallOutput) transfer.getRawItem()).getOutput());
        assertEquals(List.of("triage->billing"), handoffs);
        assertEquals("billing", model.lastRequest().getAgentName());
        assertEquals("transfer_to_billing", model.getRequests().get(0).getHandoffs().get(0).getName());
    }

    // ==================== Sessions ====================

    @Test
    void shouldSeedInputFromSessionAndPersistNewItems() {
        InMemorySessionAdapter session = new InMemorySessionAdapter("s1", fixture.objectMapper());
        RunConfig withSession = config().toBuilder().session(session).build();
        Agent agent = Agent.builder().name("assistant").build();

        model.respond(message("Hello"));
        fixture.runner().run(agent, "Hi", withSession);
        assertEquals(2, session.getItems(0).size());

        model.respond(message("Again hello"));
        fixture.runner().run(agent, "Again", withSession);

        List<ProtocolItem> input = model.lastRequest().getInput();
        assertEquals(3, input.size());
        assertEquals("Hi", ((Message) input.get(0)).getContent());
        assertEquals("Again", ((Message) input.get(2)).getContent());
        assertEquals(4, session.getItems(0).size());
    }

    @Test
    void shouldNotPersistApprovalPlaceholders() {
        InMemorySessionAdapter session = new InMemorySessionAdapter("s2", fixture.objectMapper());
        model.respond(functionCall("c1", ECHO, ECHO_ARGS));

        fixture.runner().run(agentWith(echoTool(true)), "Say hi", config().toBuilder().session(session).build());

        List<ProtocolItem> stored = session.getItems(0);
        assertEquals(2, stored.size());
        assertEquals("function_call", stored.get(1).getType());
    }

    // ==================== Server-managed conversations ====================

    @Test
    void shouldSendOnlyUnseenItemsInServerManagedConversation() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(message("done"));
        RunConfig managed = config().toBuilder().conversationId("conv_1").build();

        fixture.runner().run(agentWith(echoTool(false)), "Say hi", managed);

        assertEquals(List.of(Message.user("Say hi")), model.getRequests().get(0).getInput());
        List<ProtocolItem> second = model.getRequests().get(1).getInput();
        assertEquals(1, second.size());
        assertInstanceOf(FunctionCallOutput.class, second.get(0));
        assertEquals("conv_1", model.getRequests().get(1).getConversationId());
    }

    @Test
    void shouldChainPreviousResponseIdWhenAutomatic() {
        model.respond(functionCall("c1", ECHO, ECHO_ARGS))
                .respond(message("done"));
        RunConfig chained = config().toBuilder().autoPreviousResponseId(true).build();

        RunResult result = fixture.runner().run(agentWith(echoTool(false)), "Say hi", chained);

        assertNull(model.getRequests().get(0).getPreviousResponseId());
        assertEquals(result.getRawResponses().get(0).getResponseId(),
                model.getRequests().get(1).getPreviousResponseId());
        assertEquals(result.getLastResponseId(), result.toState().getPreviousResponseId());
    }

    @Test
    void shouldRetryOnceWhenConversationIsLocked() {
        model.fail(new ConversationLockedException("conv_1"))
                .respond(message("ok"));
        RunConfig managed = config().toBuilder().conversationId("conv_1").build();

        RunResult result = fixture.runner().run(Agent.builder().name("assistant").build(), "Hi", managed);

        assertEquals("ok", result.getFinalOutput());
        assertEquals(2, model.getRequests().size());
        assertEquals(model.getRequests().get(0).getInput(), model.getRequests().get(1).getInput());
        assertEquals(1, result.getCurrentTurn());
    }

    @Test
    void shouldFailWhenConversationIsStillLockedAfterRetry() {
        model.fail(new ConversationLockedException("conv_1"))
                .fail(new ConversationLockedException("conv_1"))
                .respond(message("never sent"));
        RunConfig managed = config().toBuilder().conversationId("conv_1").build();

        assertThrows(ConversationLockedException.class,
                () -> fixture.runner().run(Agent.builder().name("assistant").build(), "Hi", managed));
        assertEquals(2, model.getRequests().size());
    }

    @Test
    void shouldPropagateLockWithoutServerManagedConversation() {
        model.fail(new ConversationLockedException("conv_1"));

        assertThrows(ConversationLockedException.class,
                () -> fixture.runner().run(Agent.builder().name("assistant").build(), "Hi", config()));
    }

    // ==================== Failures ====================

    @Test
    void shouldWrapModelFailure() {
        model.fail(new IllegalStateException("provider down"));

        AgentRunException error = assertThrows(AgentRunException.class,
                () -> fixture.runner().run(Agent.builder().name("assistant").build(), "Hi", config()));

        assertEquals(RunPhase.MODEL, error.getPhase());
        assertTrue(error.getMessage().contains("provider down"));
    }

    @Test
    void shouldFailOnUnknownTool() {
        model.respond(functionCall("c1", "missing", "{}"));

        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> fixture.runner().run(agentWith(echoTool(false)), "go", config()));

        assertEquals("Tool missing not found in agent assistant", error.getMessage());
    }

    @Test
    void shouldRequireModel() {
        Agent agent = Agent.builder().name("assistant").build();

        assertThrows(UserErrorException.class, () -> fixture.runner().run(agent, "Hi", RunConfig.defaults()));
    }
}
