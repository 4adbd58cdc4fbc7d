package me.golemcore.runner.domain.model;

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

import lombok.Builder;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Transfer of control to another agent, exposed to the model as a tool.
 */
@Getter
@Builder
public class Handoff {

    private static final Pattern INVALID_TOOL_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_]");

    private final String toolName;
    private final String toolDescription;
    private final Agent target;
    private final Callback onHandoff;
    private final HandoffInputFilter inputFilter;
    @Builder.Default
    private final boolean enabled = true;

    /**
     * Creates a handoff to the target agent using the default tool name and
     * description.
     */
    public static Handoff to(Agent target) {
        return Handoff.builder()
                .toolName(defaultToolName(target.getName()))
                .toolDescription(defaultToolDescription(target))
                .target(target)
                .build();
    }

    public static String defaultToolName(String agentName) {
        String raw = "transfer_to_" + agentName;
        String sanitized = INVALID_TOOL_NAME_CHARS.matcher(raw).replaceAll("_");
        return sanitized.equals(raw) ? raw : sanitized.toLowerCase(Locale.ROOT);
    }

    public static String defaultToolDescription(Agent agent) {
        String extra = agent.getHandoffDescription() != null ? agent.getHandoffDescription() : "";
        return "Handoff to the " + agent.getName() + " agent to handle the request. " + extra;
    }

    public String getAgentName() {
        return target.getName();
    }

    /**
     * Output recorded for the handoff call, e.g. {@code {"assistant": "billing"}}.
     */
    public String getTransferMessage() {
        return "{\"assistant\": \"" + target.getName().replace("\\", "\\\\").replace("\"", "\\\"") + "\"}";
    }

    public ToolDefinition toDefinition() {
        return ToolDefinition.builder()
                .name(toolName)
                .description(toolDescription)
                .inputSchema(Map.of("type", "object", "properties", Map.of(), "additionalProperties", false))
                .build();
    }

    /**
     * Invoked when the handoff is taken, with the raw JSON arguments of the
     * handoff call.
     */
    @FunctionalInterface
    public interface Callback {
        void onHandoff(RunContext context, String arguments);
    }
}
