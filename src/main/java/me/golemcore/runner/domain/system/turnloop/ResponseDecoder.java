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
import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.exception.ModelBehaviorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.Handoff;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.OutputSchema;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.item.HandoffCallItem;
import me.golemcore.runner.domain.model.item.McpApprovalRequestItem;
import me.golemcore.runner.domain.model.item.McpListToolsItem;
import me.golemcore.runner.domain.model.item.MessageOutputItem;
import me.golemcore.runner.domain.model.item.ReasoningItem;
import me.golemcore.runner.domain.model.item.ToolCallItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.HostedToolKind;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;
import me.golemcore.runner.domain.model.protocol.McpListTools;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.model.protocol.Reasoning;
import me.golemcore.runner.domain.model.protocol.UnknownItem;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies the items of one model response into a
 * {@link ProcessedResponse}. Pure classification: nothing is executed here.
 *
 * <p>
 * A single item that cannot be routed to something the agent owns fails the
 * whole response, so no tool of a malformed turn ever runs.
 */
@Slf4j
public class ResponseDecoder {

    public ProcessedResponse decode(Agent agent, List<Component> allTools, ModelResponse response,
            OutputSchema outputSchema, List<Handoff> handoffs) {
        Routes routes = new Routes(allTools, handoffs);
        ProcessedResponse processed = ProcessedResponse.builder().build();

        for (ProtocolItem item : response.getOutput()) {
            if (item instanceof Message message) {
                processed.getNewItems().add(new MessageOutputItem(agent, message));
            } else if (item instanceof Reasoning reasoning) {
                processed.getNewItems().add(new ReasoningItem(agent, reasoning));
            } else if (item instanceof McpListTools listTools) {
                processed.getNewItems().add(new McpListToolsItem(agent, listTools));
            } else if (item instanceof McpApprovalRequest request) {
                decodeMcpApprovalRequest(agent, request, routes, processed);
            } else if (item instanceof HostedToolCall call) {
                decodeHostedCall(agent, call, routes, processed);
            } else if (item instanceof FunctionCall call) {
                decodeFunctionCall(agent, call, routes, outputSchema, processed);
            } else if (item instanceof UnknownItem unknown) {
                log.warn("[Decoder] Skipping unrecognized output item type '{}'", unknown.getType());
            } else if (item != null) {
                log.debug("[Decoder] Ignoring {} item in model output", item.getType());
            }
        }

        log.debug("[Decoder] Agent {}: {} functions, {} handoffs, {} hosted calls, {} mcp approvals",
                agent.getName(), processed.getFunctions().size(), processed.getHandoffs().size(),
                processed.getHostedCalls().size(), processed.getMcpApprovalRequests().size());
        return processed;
    }

    private void decodeFunctionCall(Agent agent, FunctionCall call, Routes routes, OutputSchema outputSchema,
            ProcessedResponse processed) {
        if (isBlank(call.getName()) || isBlank(call.getCallId())) {
            throw new ModelBehaviorException("Function call is missing its name or call id: " + call);
        }

        Handoff handoff = routes.handoffs.get(call.getName());
        if (handoff != null) {
            processed.getNewItems().add(new HandoffCallItem(agent, call));
            processed.getHandoffs().add(new ProcessedResponse.HandoffRun(call, handoff));
            processed.getToolsUsed().add(call.getName());
            return;
        }

        ToolComponent tool = routes.functions.get(call.getName());
        if (tool == null && JsonToolCallTool.NAME.equals(call.getName()) && outputSchema != null
                && !outputSchema.isPlainText()) {
            tool = new JsonToolCallTool(outputSchema);
        }
        if (tool == null) {
            throw new ModelBehaviorException("Tool " + call.getName() + " not found in agent " + agent.getName());
        }

        processed.getNewItems().add(new ToolCallItem(agent, call, tool.getOrigin()));
        processed.getFunctions().add(new ProcessedResponse.FunctionRun(call, tool));
        processed.getToolsUsed().add(call.getName());
    }

    private void decodeHostedCall(Agent agent, HostedToolCall call, Routes routes, ProcessedResponse processed) {
        HostedToolKind kind = call.kind();
        HostedToolComponent tool = routes.hosted.get(kind);
        if (tool == null) {
            throw new ModelBehaviorException("Model produced " + call.getType() + " but agent " + agent.getName()
                    + " has no " + kind.name().toLowerCase(Locale.ROOT) + " tool");
        }
        if (isBlank(call.getCallId())) {
            throw new ModelBehaviorException("Hosted tool call is missing its call id: " + call);
        }
        processed.getNewItems().add(new ToolCallItem(agent, call, ToolOrigin.function()));
        processed.getHostedCalls().add(new ProcessedResponse.HostedRun(call, tool));
        processed.getToolsUsed().add(tool.getName());
    }

    private void decodeMcpApprovalRequest(Agent agent, McpApprovalRequest request, Routes routes,
            ProcessedResponse processed) {
        HostedMcpTool tool = routes.mcpServers.get(request.getServerLabel());
        if (tool == null) {
            throw new ModelBehaviorException("MCP server label " + request.getServerLabel()
                    + " not found in agent " + agent.getName());
        }
        processed.getNewItems().add(new McpApprovalRequestItem(agent, request));
        processed.getMcpApprovalRequests().add(new ProcessedResponse.McpApprovalRun(request, tool));
        processed.getToolsUsed().add(request.getServerLabel());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Routes {
        private final Map<String, ToolComponent> functions = new LinkedHashMap<>();
        private final Map<HostedToolKind, HostedToolComponent> hosted = new EnumMap<>(HostedToolKind.class);
        private final Map<String, HostedMcpTool> mcpServers = new LinkedHashMap<>();
        private final Map<String, Handoff> handoffs = new LinkedHashMap<>();

        private Routes(List<Component> tools, List<Handoff> handoffList) {
            for (Component component : tools) {
                if (!component.isEnabled()) {
                    continue;
                }
                if (component instanceof ToolComponent tool) {
                    functions.putIfAbsent(tool.getToolName(), tool);
                } else if (component instanceof HostedToolComponent hostedTool) {
                    hosted.putIfAbsent(hostedTool.getKind(), hostedTool);
                } else if (component instanceof HostedMcpTool mcpTool) {
                    mcpServers.putIfAbsent(mcpTool.getServerLabel(), mcpTool);
                }
            }
            for (Handoff handoff : handoffList) {
                if (handoff.isEnabled()) {
                    handoffs.putIfAbsent(handoff.getToolName(), handoff);
                }
            }
        }
    }
}
