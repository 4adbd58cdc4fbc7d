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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.exception.RunStateSnapshotException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ApprovalLedger;
import me.golemcore.runner.domain.model.Handoff;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.Usage;
import me.golemcore.runner.domain.model.item.HandoffCallItem;
import me.golemcore.runner.domain.model.item.HandoffOutputItem;
import me.golemcore.runner.domain.model.item.McpApprovalRequestItem;
import me.golemcore.runner.domain.model.item.McpApprovalResponseItem;
import me.golemcore.runner.domain.model.item.McpListToolsItem;
import me.golemcore.runner.domain.model.item.MessageOutputItem;
import me.golemcore.runner.domain.model.item.ReasoningItem;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.RunItemType;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;
import me.golemcore.runner.domain.model.protocol.McpApprovalResponse;
import me.golemcore.runner.domain.model.protocol.McpListTools;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.model.protocol.Reasoning;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON snapshot codec of {@link RunState}.
 *
 * <p>
 * Agents are stored by name and resolved on load against the graph reachable
 * from the given root agent through handoffs. Tools are not serialized; a
 * loaded state binds to the tools the resolved agents carry. Items that cannot
 * be restored are skipped with a warning, an unknown current agent or schema
 * version fails the load.
 */
@Slf4j
public class RunStateSerializer {

    static final String SCHEMA_VERSION_KEY = "$schemaVersion";

    private static final String STEP_RUN_AGAIN = "next_step_run_again";
    private static final String STEP_FINAL_OUTPUT = "next_step_final_output";
    private static final String STEP_INTERRUPTION = "next_step_interruption";
    private static final String STEP_HANDOFF = "next_step_handoff";

    private static final TypeReference<List<ProtocolItem>> ITEM_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<ModelResponse>> RESPONSE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, ApprovalLedger.ToolApprovals>> APPROVALS = new TypeReference<>() {
    };

    private static final RunStateSerializer SHARED = new RunStateSerializer(defaultObjectMapper());

    private final ObjectMapper objectMapper;

    public RunStateSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Instance used by {@link RunState#toDocument()} and
     * {@link RunState#fromDocument(String, Agent)}.
     */
    public static RunStateSerializer shared() {
        return SHARED;
    }

    // ==================== write ====================

    public String toDocument(RunState state) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(SCHEMA_VERSION_KEY, RunState.CURRENT_SCHEMA_VERSION);
        root.put("currentTurn", state.getCurrentTurn());
        root.set("currentAgent", agentRef(state.getCurrentAgent()));
        root.set("originalInput", objectMapper.valueToTree(state.getOriginalInput()));
        root.put("maxTurns", state.getMaxTurns());
        root.set("modelResponses", objectMapper.valueToTree(state.getModelResponses()));
        root.set("lastModelResponse", objectMapper.valueToTree(state.getLastModelResponse()));
        root.set("generatedItems", writeItems(state.getGeneratedItems()));
        root.set("lastProcessedResponse", writeProcessedResponse(state.getLastProcessedResponse()));
        root.set("currentStep", writeStep(state.getCurrentStep()));
        root.set("context", writeContext(state.getContext()));
        root.put("conversationId", state.getConversationId());
        root.put("previousResponseId", state.getPreviousResponseId());
        root.put("autoPreviousResponseId", state.isAutoPreviousResponseId());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new RunStateSnapshotException("Failed to write run state: " + e.getOriginalMessage(), e);
        }
    }

    private ArrayNode writeItems(List<? extends RunItem> items) {
        ArrayNode array = objectMapper.createArrayNode();
        if (items != null) {
            items.forEach(item -> array.add(writeItem(item)));
        }
        return array;
    }

    private ObjectNode writeItem(RunItem item) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", item.getType().getWireName());
        node.set("agent", agentRef(item.getAgent()));
        node.set("rawItem", objectMapper.valueToTree(item.getRawItem()));
        if (item instanceof ToolCallItem call) {
            node.set("origin", objectMapper.valueToTree(call.getOrigin()));
        } else if (item instanceof ToolCallOutputItem output) {
            node.set("origin", objectMapper.valueToTree(output.getOrigin()));
            node.set("output", writeValue(output.getOutput(), "tool output"));
            node.put("outputType", valueType(output.getOutput()));
        } else if (item instanceof ToolApprovalItem approval) {
            node.put("toolName", approval.getToolName());
            node.set("origin", objectMapper.valueToTree(approval.getOrigin()));
        } else if (item instanceof HandoffOutputItem handoff) {
            node.set("sourceAgent", agentRef(handoff.getSourceAgent()));
            node.set("targetAgent", agentRef(handoff.getTargetAgent()));
        }
        return node;
    }

    private JsonNode writeProcessedResponse(ProcessedResponse processed) {
        if (processed == null) {
            return NullNode.getInstance();
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.set("newItems", writeItems(processed.getNewItems()));
        node.set("toolsUsed", objectMapper.valueToTree(processed.getToolsUsed()));

        ArrayNode functions = node.putArray("functions");
        processed.getFunctions().forEach(run -> functions.add(runRef(run.toolCall().getCallId(),
                run.tool().getToolName())));
        ArrayNode handoffs = node.putArray("handoffs");
        processed.getHandoffs().forEach(run -> handoffs.add(runRef(run.toolCall().getCallId(),
                run.handoff().getToolName())));
        ArrayNode hosted = node.putArray("hostedCalls");
        processed.getHostedCalls().forEach(run -> hosted.add(runRef(run.toolCall().getCallId(),
                run.tool().getName())));
        ArrayNode mcp = node.putArray("mcpApprovalRequests");
        processed.getMcpApprovalRequests().forEach(run -> mcp.add(runRef(run.request().getId(),
                run.tool().getServerLabel())));

        node.set("interruptions", writeItems(processed.getInterruptions()));
        return node;
    }

    private ObjectNode runRef(String callId, String toolName) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("callId", callId);
        node.put("toolName", toolName);
        return node;
    }

    private JsonNode writeStep(NextStep step) {
        if (step == null) {
            return NullNode.getInstance();
        }
        ObjectNode node = objectMapper.createObjectNode();
        if (step instanceof NextStep.Interruption interruption) {
            node.put("type", STEP_INTERRUPTION);
            node.putObject("data").set("interruptions", writeItems(interruption.interruptions()));
        } else if (step instanceof NextStep.FinalOutput finalOutput) {
            node.put("type", STEP_FINAL_OUTPUT);
            node.set("output", writeValue(finalOutput.output(), "final output"));
            node.put("outputType", valueType(finalOutput.output()));
        } else if (step instanceof NextStep.Handoff handoff) {
            node.put("type", STEP_HANDOFF);
            node.set("newAgent", agentRef(handoff.newAgent()));
        } else {
            node.put("type", STEP_RUN_AGAIN);
        }
        return node;
    }

    private ObjectNode writeContext(RunContext context) {
        ObjectNode node = objectMapper.createObjectNode();
        if (context == null) {
            return node;
        }
        node.set("usage", objectMapper.valueToTree(context.getUsage()));
        node.set("approvals", objectMapper.valueToTree(context.getApprovals().snapshot()));
        node.set("payload", writeValue(context.getPayload(), "context payload"));
        return node;
    }

    private JsonNode writeValue(Object value, String what) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new RunStateSnapshotException("Run state " + what + " is not serializable: " + e.getMessage(), e);
        }
    }

    private JsonNode agentRef(Agent agent) {
        if (agent == null) {
            return NullNode.getInstance();
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", agent.getName());
        return node;
    }

    // ==================== read ====================

    public RunState fromDocument(String document, Agent rootAgent) {
        return fromDocument(document, rootAgent, null);
    }

    /**
     * Loads a snapshot.
     *
     * @param contextOverride
     *            context to use instead of the serialized one, or {@code null}
     *            to restore usage, approvals and payload from the document
     */
    public RunState fromDocument(String document, Agent rootAgent, RunContext contextOverride) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new RunStateSnapshotException("Run state document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RunStateSnapshotException("Run state document must be a JSON object");
        }

        JsonNode version = root.get(SCHEMA_VERSION_KEY);
        if (version == null || version.isNull() || version.asText().isBlank()) {
            throw new RunStateSnapshotException("Run state is missing schema version");
        }
        if (!RunState.CURRENT_SCHEMA_VERSION.equals(version.asText())) {
            throw new RunStateSnapshotException("Run state schema version " + version.asText()
                    + " is not supported. Please use version " + RunState.CURRENT_SCHEMA_VERSION);
        }

        Map<String, Agent> agents = agentsByName(rootAgent);
        String currentName = root.path("currentAgent").path("name").asText(null);
        Agent currentAgent = currentName != null ? agents.get(currentName) : null;
        if (currentAgent == null) {
            throw new RunStateSnapshotException("Agent " + currentName + " not found in the agent graph of "
                    + (rootAgent != null ? rootAgent.getName() : null));
        }

        RunContext context = contextOverride != null ? contextOverride : readContext(root.path("context"));
        List<ProtocolItem> originalInput = read(root.get("originalInput"), ITEM_LIST, "original input");
        RunState state = new RunState(currentAgent, originalInput != null ? originalInput : List.of(), context,
                root.path("maxTurns").asInt(0));
        state.setCurrentTurn(root.path("currentTurn").asInt(0));

        List<ModelResponse> responses = read(root.get("modelResponses"), RESPONSE_LIST, "model responses");
        if (responses != null) {
            state.setModelResponses(new ArrayList<>(responses));
        }
        ModelResponse lastResponse = read(root.get("lastModelResponse"), ModelResponse.class, "last response");
        if (lastResponse != null && state.getModelResponses().isEmpty()) {
            state.getModelResponses().add(lastResponse);
        }

        List<RunItem> generated = readItems(root.path("generatedItems"), agents, List.of());
        ProcessedResponse processed = readProcessedResponse(root.path("lastProcessedResponse"), currentAgent,
                agents, generated);
        state.setGeneratedItems(mergeGeneratedItems(generated, processed));
        state.setLastProcessedResponse(processed);
        state.setCurrentStep(readStep(root.path("currentStep"), agents, state.getGeneratedItems()));

        state.setConversationId(root.path("conversationId").asText(null));
        state.setPreviousResponseId(root.path("previousResponseId").asText(null));
        state.setAutoPreviousResponseId(root.path("autoPreviousResponseId").asBoolean(false));

        log.debug("[RunState] Loaded state of agent {} at turn {} ({} items)", currentAgent.getName(),
                state.getCurrentTurn(), state.getGeneratedItems().size());
        return state;
    }

    private List<RunItem> readItems(JsonNode array, Map<String, Agent> agents, List<RunItem> known) {
        List<RunItem> items = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            readItem(node, agents).ifPresent(item -> items.add(sameItem(item, known).orElse(item)));
        }
        return items;
    }

    private Optional<RunItem> readItem(JsonNode node, Map<String, Agent> agents) {
        String typeName = node.path("type").asText(null);
        Optional<RunItemType> type = RunItemType.fromWireName(typeName);
        if (type.isEmpty()) {
            log.warn("[RunState] Skipping item of unknown type '{}'", typeName);
            return Optional.empty();
        }
        String agentName = node.path("agent").path("name").asText(null);
        Agent agent = agents.get(agentName);
        if (agent == null) {
            log.warn("[RunState] Skipping {} of unknown agent '{}'", typeName, agentName);
            return Optional.empty();
        }

        Agent sourceAgent = null;
        Agent targetAgent = null;
        if (type.get() == RunItemType.HANDOFF_OUTPUT) {
            String sourceName = node.path("sourceAgent").path("name").asText(null);
            String targetName = node.path("targetAgent").path("name").asText(null);
            sourceAgent = agents.get(sourceName);
            targetAgent = agents.get(targetName);
            if (sourceAgent == null || targetAgent == null) {
                log.warn("[RunState] Skipping handoff output from '{}' to '{}': agent not in the graph", sourceName,
                        targetName);
                return Optional.empty();
            }
        }

        try {
            ProtocolItem raw = objectMapper.treeToValue(node.get("rawItem"), ProtocolItem.class);
            return Optional.of(switch (type.get()) {
            case MESSAGE_OUTPUT -> new MessageOutputItem(agent, cast(raw, Message.class));
            case REASONING -> new ReasoningItem(agent, cast(raw, Reasoning.class));
            case TOOL_CALL -> new ToolCallItem(agent, raw, readOrigin(node));
            case TOOL_CALL_OUTPUT -> new ToolCallOutputItem(agent, raw,
                    readValue(node.get("output"), node.path("outputType").asText(null)), readOrigin(node));
            case HANDOFF_CALL -> new HandoffCallItem(agent, cast(raw, FunctionCall.class));
            case HANDOFF_OUTPUT -> new HandoffOutputItem(agent, cast(raw, FunctionCallOutput.class), sourceAgent,
                    targetAgent);
            case TOOL_APPROVAL -> new ToolApprovalItem(agent, raw, node.path("toolName").asText(null),
                    readOrigin(node));
            case MCP_LIST_TOOLS -> new McpListToolsItem(agent, cast(raw, McpListTools.class));
            case MCP_APPROVAL_REQUEST -> new McpApprovalRequestItem(agent, cast(raw, McpApprovalRequest.class));
            case MCP_APPROVAL_RESPONSE -> new McpApprovalResponseItem(agent, cast(raw, McpApprovalResponse.class));
            });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[RunState] Skipping malformed {}: {}", typeName, e.getMessage());
            return Optional.empty();
        }
    }

    private ToolOrigin readOrigin(JsonNode node) throws JsonProcessingException {
        JsonNode origin = node.get("origin");
        if (origin == null || origin.isNull()) {
            return ToolOrigin.function();
        }
        return objectMapper.treeToValue(origin, ToolOrigin.class);
    }

    private ProcessedResponse readProcessedResponse(JsonNode node, Agent agent, Map<String, Agent> agents,
            List<RunItem> generated) {
        if (node == null || !node.isObject()) {
            return null;
        }
        ProcessedResponse processed = ProcessedResponse.builder().build();
        processed.getNewItems().addAll(readItems(node.path("newItems"), agents, generated));
        for (JsonNode name : node.path("toolsUsed")) {
            processed.getToolsUsed().add(name.asText());
        }

        Map<String, ToolComponent> functions = new LinkedHashMap<>();
        Map<String, HostedToolComponent> hosted = new LinkedHashMap<>();
        Map<String, HostedMcpTool> mcpServers = new LinkedHashMap<>();
        for (Component component : agent.getEnabledTools()) {
            if (component instanceof ToolComponent tool) {
                functions.putIfAbsent(tool.getToolName(), tool);
            } else if (component instanceof HostedToolComponent hostedTool) {
                hosted.putIfAbsent(hostedTool.getName(), hostedTool);
            } else if (component instanceof HostedMcpTool mcpTool) {
                mcpServers.putIfAbsent(mcpTool.getServerLabel(), mcpTool);
            }
        }
        Map<String, Handoff> handoffs = new LinkedHashMap<>();
        agent.getEnabledHandoffs().forEach(handoff -> handoffs.putIfAbsent(handoff.getToolName(), handoff));

        for (JsonNode ref : node.path("functions")) {
            ToolComponent tool = functions.get(ref.path("toolName").asText());
            Optional<FunctionCall> call = rawCall(processed, ref, FunctionCall.class);
            if (tool != null && call.isPresent()) {
                processed.getFunctions().add(new ProcessedResponse.FunctionRun(call.get(), tool));
            } else {
                log.warn("[RunState] Cannot rebind function call {} to tool {} of agent {}",
                        ref.path("callId").asText(), ref.path("toolName").asText(), agent.getName());
            }
        }
        for (JsonNode ref : node.path("handoffs")) {
            Handoff handoff = handoffs.get(ref.path("toolName").asText());
            Optional<FunctionCall> call = rawCall(processed, ref, FunctionCall.class);
            if (handoff != null && call.isPresent()) {
                processed.getHandoffs().add(new ProcessedResponse.HandoffRun(call.get(), handoff));
            } else {
                log.warn("[RunState] Cannot rebind handoff {} of agent {}", ref.path("toolName").asText(),
                        agent.getName());
            }
        }
        for (JsonNode ref : node.path("hostedCalls")) {
            HostedToolComponent tool = hosted.get(ref.path("toolName").asText());
            Optional<HostedToolCall> call = rawCall(processed, ref, HostedToolCall.class);
            if (tool != null && call.isPresent()) {
                processed.getHostedCalls().add(new ProcessedResponse.HostedRun(call.get(), tool));
            } else {
                log.warn("[RunState] Cannot rebind hosted call {} of agent {}", ref.path("callId").asText(),
                        agent.getName());
            }
        }
        for (JsonNode ref : node.path("mcpApprovalRequests")) {
            HostedMcpTool tool = mcpServers.get(ref.path("toolName").asText());
            Optional<McpApprovalRequest> request = rawCall(processed, ref, McpApprovalRequest.class);
            if (tool != null && request.isPresent()) {
                processed.getMcpApprovalRequests().add(new ProcessedResponse.McpApprovalRun(request.get(), tool));
            } else {
                log.warn("[RunState] Cannot rebind MCP approval request {} of agent {}",
                        ref.path("callId").asText(), agent.getName());
            }
        }

        for (RunItem item : readItems(node.path("interruptions"), agents, generated)) {
            if (item instanceof ToolApprovalItem approval) {
                processed.getInterruptions().add(approval);
            }
        }
        return processed;
    }

    private static <T extends ProtocolItem> Optional<T> rawCall(ProcessedResponse processed, JsonNode ref,
            Class<T> type) {
        String callId = ref.path("callId").asText(null);
        return processed.getNewItems().stream()
                .map(RunItem::getRawItem)
                .filter(type::isInstance)
                .map(type::cast)
                .filter(raw -> callId != null && callId.equals(raw.callId()))
                .findFirst();
    }

    /**
     * Items of the paused turn that are missing from the generated items are
     * appended, so that both views share one instance per call.
     */
    private static List<RunItem> mergeGeneratedItems(List<RunItem> generated, ProcessedResponse processed) {
        List<RunItem> merged = new ArrayList<>(generated);
        if (processed == null) {
            return merged;
        }
        for (RunItem item : processed.getNewItems()) {
            if (merged.stream().noneMatch(existing -> existing == item)) {
                merged.add(item);
            }
        }
        return merged;
    }

    private static Optional<RunItem> sameItem(RunItem item, List<RunItem> known) {
        if (item.callId() == null) {
            return known.stream()
                    .filter(existing -> existing.getType() == item.getType()
                            && existing.getRawItem() != null
                            && existing.getRawItem().equals(item.getRawItem()))
                    .findFirst();
        }
        return known.stream()
                .filter(existing -> existing.getType() == item.getType() && item.callId().equals(existing.callId()))
                .findFirst();
    }

    private NextStep readStep(JsonNode node, Map<String, Agent> agents, List<RunItem> generated) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String type = node.path("type").asText("");
        return switch (type) {
        case STEP_INTERRUPTION -> {
            List<ToolApprovalItem> interruptions = new ArrayList<>();
            for (RunItem item : readItems(node.path("data").path("interruptions"), agents, generated)) {
                if (item instanceof ToolApprovalItem approval) {
                    interruptions.add(approval);
                }
            }
            yield new NextStep.Interruption(List.copyOf(interruptions));
        }
        case STEP_FINAL_OUTPUT -> new NextStep.FinalOutput(readFinalOutput(node));
        case STEP_HANDOFF -> {
            Agent target = agents.get(node.path("newAgent").path("name").asText(null));
            if (target == null) {
                throw new RunStateSnapshotException("Handoff target of the run state is not in the agent graph");
            }
            yield new NextStep.Handoff(target);
        }
        case STEP_RUN_AGAIN -> new NextStep.RunAgain();
        default -> {
            log.warn("[RunState] Unknown step type '{}', treating the run as runnable", type);
            yield new NextStep.RunAgain();
        }
        };
    }

    private Object readFinalOutput(JsonNode node) {
        try {
            return readValue(node.get("output"), node.path("outputType").asText(null));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RunStateSnapshotException("Run state final output is malformed: " + e.getMessage(), e);
        }
    }

    private Object readValue(JsonNode node, String typeName) throws JsonProcessingException {
        if (node == null || node.isNull()) {
            return null;
        }
        Class<?> type = restorableType(typeName);
        Class<?> targetType = type != null ? type : Object.class;
        return objectMapper.treeToValue(node, targetType);
    }

    private static String valueType(Object value) {
        return value != null ? value.getClass().getName() : null;
    }

    // Only simple values, tool results and records are rebuilt by class name; anything else stays a JSON tree.
    private static Class<?> restorableType(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return null;
        }
        Class<?> type;
        try {
            type = Class.forName(typeName, false, RunStateSerializer.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            log.warn("[RunState] Value type {} is not available, keeping it as JSON", typeName);
            return null;
        }
        boolean simple = type == String.class || type == Boolean.class
                || (Number.class.isAssignableFrom(type) && type.getName().startsWith("java."));
        if (simple || type == ToolResult.class || type.isRecord()) {
            return type;
        }
        log.debug("[RunState] Value type {} is not restorable, keeping it as JSON", typeName);
        return null;
    }

    private RunContext readContext(JsonNode node) {
        Usage usage = read(node.get("usage"), Usage.class, "usage");
        ApprovalLedger ledger = new ApprovalLedger();
        ledger.restore(read(node.get("approvals"), APPROVALS, "approvals"));
        Object payload = read(node.get("payload"), Object.class, "context payload");
        return new RunContext(payload, usage != null ? usage : new Usage(), ledger);
    }

    private <T> T read(JsonNode node, Class<T> type, String what) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RunStateSnapshotException("Run state " + what + " is malformed: " + e.getMessage(), e);
        }
    }

    private <T> T read(JsonNode node, TypeReference<T> type, String what) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new RunStateSnapshotException("Run state " + what + " is malformed: " + e.getMessage(), e);
        }
    }

    private static <T> T cast(ProtocolItem raw, Class<T> type) {
        if (!type.isInstance(raw)) {
            throw new IllegalArgumentException("expected " + type.getSimpleName() + " but got "
                    + (raw != null ? raw.getType() : null));
        }
        return type.cast(raw);
    }

    /**
     * Every agent reachable from the root through handoffs, by name. Cycles
     * are fine.
     */
    static Map<String, Agent> agentsByName(Agent root) {
        Map<String, Agent> agents = new LinkedHashMap<>();
        Deque<Agent> queue = new ArrayDeque<>();
        if (root != null) {
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            Agent agent = queue.poll();
            if (agents.containsKey(agent.getName())) {
                continue;
            }
            agents.put(agent.getName(), agent);
            for (Handoff handoff : agent.getHandoffs()) {
                if (handoff.getTarget() != null) {
                    queue.add(handoff.getTarget());
                }
            }
        }
        return agents;
    }

    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
