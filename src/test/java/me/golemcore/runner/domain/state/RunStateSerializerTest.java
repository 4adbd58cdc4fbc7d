package me.golemcore.runner.domain.state;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.runner.domain.component.FunctionTool;
import me.golemcore.runner.domain.exception.RunStateSnapshotException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ApprovalStatus;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.ToolFailureKind;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.ToolUseBehavior;
import me.golemcore.runner.domain.model.item.HandoffOutputItem;
import me.golemcore.runner.domain.model.item.MessageOutputItem;
import me.golemcore.runner.domain.model.item.RunItemType;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.Message;
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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunStateSerializerTest {

    private TurnLoopFixture fixture;
    private ScriptedModelPort model;
    private RunStateSerializer serializer;
    private ObjectMapper objectMapper;
    private AtomicInteger deletions;
    private Agent agent;

    @BeforeEach
    void setUp() {
        fixture = new TurnLoopFixture();
        model = ScriptedModelPort.create();
        objectMapper = fixture.objectMapper();
        serializer = new RunStateSerializer(objectMapper);
        deletions = new AtomicInteger();
        agent = Agent.builder()
                .name("files")
                .tools(List.of(FunctionTool.builder()
                        .name("delete_file")
                        .description("Deletes a file")
                        .handler((ctx, args) -> {
                            deletions.incrementAndGet();
                            return ToolResult.success("deleted " + args.get("path"));
                        })
                        .approvalPolicy((ctx, args) -> true)
                        .build()))
                .build();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private RunConfig config() {
        return RunConfig.builder().modelPort(model).context(Map.of("user", "u1")).build();
    }

    private RunState pausedState() {
        model.respond(functionCall("c1", "delete_file", "{\"path\":\"a.txt\"}"));
        RunResult paused = fixture.runner().run(agent, "Delete a.txt", config());
        assertTrue(paused.isInterrupted());
        return paused.toState();
    }

    // ==================== Round trip ====================

    @Test
    void shouldRestorePausedRun() {
        RunState original = pausedState();

        RunState restored = serializer.fromDocument(serializer.toDocument(original), agent);

        assertSame(agent, restored.getCurrentAgent());
        assertEquals(1, restored.getCurrentTurn());
        assertEquals(original.getMaxTurns(), restored.getMaxTurns());
        assertEquals(original.getOriginalInput(), restored.getOriginalInput());
        assertEquals(List.of(RunItemType.TOOL_CALL, RunItemType.TOOL_APPROVAL),
                restored.getGeneratedItems().stream().map(item -> item.getType()).toList());
        assertInstanceOf(NextStep.Interruption.class, restored.getCurrentStep());
        assertEquals(1, restored.getInterruptions().size());
        assertEquals("delete_file", restored.getInterruptions().get(0).getToolName());
        assertEquals(1, restored.getLastProcessedResponse().getFunctions().size());
        assertEquals(Map.of("user", "u1"), restored.getContext().getPayload());
        assertEquals(1, restored.getContext().getUsage().getRequests());
        assertEquals(original.getLastModelResponse().getResponseId(),
                restored.getLastModelResponse().getResponseId());
    }

    @Test
    void shouldResumeLoadedStateAfterApproval() {
        String document = pausedState().toDocument();

        RunState restored = RunState.fromDocument(document, agent);
        ToolApprovalItem pending = restored.getInterruptions().get(0);
        restored.approve(pending);
        model.respond(message("Deleted a.txt"));
        RunResult result = fixture.runner().resume(restored, config());

        assertEquals("Deleted a.txt", result.getFinalOutput());
        assertEquals(1, deletions.get());
        assertEquals(2, result.getCurrentTurn());
        assertEquals(2, result.getUsage().getRequests());
    }

    @Test
    void shouldKeepApprovalDecisionsInDocument() {
        RunState paused = pausedState();
        paused.approve(paused.getInterruptions().get(0), true);

        RunState restored = serializer.fromDocument(serializer.toDocument(paused), agent);

        assertEquals(ApprovalStatus.APPROVED, restored.getContext().getApprovalStatus("delete_file", "other"));
    }

    @Test
    void shouldUseContextOverride() {
        RunContext override = new RunContext("fresh");

        RunState restored = serializer.fromDocument(serializer.toDocument(pausedState()), agent, override);

        assertSame(override, restored.getContext());
    }

    @Test
    void shouldRestoreFinalOutputStep() {
        model.respond(message("done"));
        RunResult result = fixture.runner().run(Agent.builder().name("files").build(), "hi", config());

        RunState restored = serializer.fromDocument(serializer.toDocument(result.toState()), agent);

        NextStep.FinalOutput step = assertInstanceOf(NextStep.FinalOutput.class, restored.getCurrentStep());
        assertEquals("done", step.output());
    }

    public record Forecast(String city, int degrees) {
    }

    @Test
    void shouldKeepToolOriginsAndAlwaysFlags() {
        RunContext context = new RunContext(null);
        context.getApprovals().approve("search", "c1", true);
        context.getApprovals().reject("translate", "c2", true);
        ToolResult denied = ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED,
                "Tool execution was not approved.");
        RunState state = new RunState(agent, List.of(Message.user("hi")), context, 5);
        state.setGeneratedItems(new ArrayList<>(List.of(
                new ToolCallItem(agent, functionCall("c1", "search", "{}"), ToolOrigin.protocolTool("docs")),
                new ToolCallOutputItem(agent, FunctionCallOutput.of("c1", "found"), "found",
                        ToolOrigin.protocolTool("docs")),
                new ToolCallItem(agent, functionCall("c2", "translate", "{}"),
                        ToolOrigin.agentAsTool("French Translator")),
                new ToolCallOutputItem(agent, FunctionCallOutput.of("c2", denied.getError()), denied,
                        ToolOrigin.agentAsTool("French Translator")))));

        RunState restored = serializer.fromDocument(serializer.toDocument(state), agent);

        List<ToolOrigin> origins = restored.getGeneratedItems().stream()
                .map(item -> item instanceof ToolCallItem call ? call.getOrigin()
                        : ((ToolCallOutputItem) item).getOrigin())
                .toList();
        assertEquals(List.of(ToolOrigin.protocolTool("docs"), ToolOrigin.protocolTool("docs"),
                ToolOrigin.agentAsTool("French Translator"), ToolOrigin.agentAsTool("French Translator")), origins);
        assertEquals(denied, ((ToolCallOutputItem) restored.getGeneratedItems().get(3)).getOutput());
        assertEquals(context.getApprovals().snapshot(), restored.getContext().getApprovals().snapshot());
        assertEquals(ApprovalStatus.APPROVED, restored.getContext().getApprovalStatus("search", "c7"));
        assertEquals(ApprovalStatus.REJECTED, restored.getContext().getApprovalStatus("translate", "c8"));
    }

    @Test
    void shouldRestoreTypedToolOutputAndFinalOutput() {
        Agent forecaster = Agent.builder()
                .name("files")
                .toolUseBehavior(ToolUseBehavior.STOP_ON_FIRST_TOOL)
                .tools(List.of(FunctionTool.builder()
                        .name("forecast")
                        .handler((ctx, args) -> ToolResult.success("Oslo 4", new Forecast("Oslo", 4)))
                        .build()))
                .build();
        model.respond(functionCall("c1", "forecast", "{}"));
        RunResult result = fixture.runner().run(forecaster, "Weather?", config());
        assertEquals(new Forecast("Oslo", 4), result.getFinalOutput());

        RunState restored = serializer.fromDocument(serializer.toDocument(result.toState()), forecaster);

        NextStep.FinalOutput step = assertInstanceOf(NextStep.FinalOutput.class, restored.getCurrentStep());
        assertEquals(new Forecast("Oslo", 4), step.output());
        ToolCallOutputItem output = (ToolCallOutputItem) restored.getGeneratedItems().get(1);
        assertEquals(new Forecast("Oslo", 4), output.getOutput());
    }

    @Test
    void shouldSkipHandoffOutputToAgentOutsideGraph() {
        Agent billing = Agent.builder().name("billing").build();
        RunState state = new RunState(agent, List.of(Message.user("hi")), new RunContext(null), 5);
        state.setGeneratedItems(new ArrayList<>(List.of(
                new HandoffOutputItem(agent, FunctionCallOutput.of("h1", "{\"assistant\": \"billing\"}"), agent,
                        billing),
                new MessageOutputItem(agent, Message.assistant("msg_1", "done")))));

        RunState restored = serializer.fromDocument(serializer.toDocument(state), agent);

        assertEquals(List.of(RunItemType.MESSAGE_OUTPUT),
                restored.getGeneratedItems().stream().map(item -> item.getType()).toList());
    }

    // ==================== Agent graph ====================

    @Test
    void shouldResolveAgentsThroughHandoffCycles() {
        Agent billing = Agent.builder().name("billing").build();
        Agent triage = Agent.builder().name("triage").build();
        triage.addHandoff(billing);
        billing.addHandoff(triage);

        Map<String, Agent> agents = RunStateSerializer.agentsByName(triage);

        assertEquals(2, agents.size());
        assertSame(billing, agents.get("billing"));
    }

    @Test
    void shouldFailWhenCurrentAgentIsUnknown() {
        String document = serializer.toDocument(pausedState());
        Agent other = Agent.builder().name("other").build();

        RunStateSnapshotException error = assertThrows(RunStateSnapshotException.class,
                () -> serializer.fromDocument(document, other));

        assertEquals("Agent files not found in the agent graph of other", error.getMessage());
    }

    // ==================== Malformed documents ====================

    @Test
    void shouldRejectMissingSchemaVersion() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree(serializer.toDocument(pausedState()));
        root.remove(RunStateSerializer.SCHEMA_VERSION_KEY);

        RunStateSnapshotException error = assertThrows(RunStateSnapshotException.class,
                () -> serializer.fromDocument(objectMapper.writeValueAsString(root), agent));

        assertEquals("Run state is missing schema version", error.getMessage());
    }

    @Test
    void shouldRejectUnsupportedSchemaVersion() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree(serializer.toDocument(pausedState()));
        root.put(RunStateSerializer.SCHEMA_VERSION_KEY, "2.0");

        RunStateSnapshotException error = assertThrows(RunStateSnapshotException.class,
                () -> serializer.fromDocument(objectMapper.writeValueAsString(root), agent));

        assertEquals("Run state schema version 2.0 is not supported. Please use version 1.0", error.getMessage());
    }

    @Test
    void shouldRejectInvalidJson() {
        assertThrows(RunStateSnapshotException.class, () -> serializer.fromDocument("{not json", agent));
    }

    @Test
    void shouldSkipItemsOfUnknownType() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree(serializer.toDocument(pausedState()));
        ArrayNode items = (ArrayNode) root.get("generatedItems");
        items.addObject().put("type", "future_item").putObject("agent").put("name", "files");

        RunState restored = serializer.fromDocument(objectMapper.writeValueAsString(root), agent);

        assertEquals(2, restored.getGeneratedItems().size());
    }
}
