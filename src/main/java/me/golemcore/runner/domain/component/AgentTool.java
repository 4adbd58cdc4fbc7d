package me.golemcore.runner.domain.component;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.service.AgentRunner;
import me.golemcore.runner.domain.state.RunResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Exposes an agent as a tool. The nested agent runs to completion on the
 * calling tool thread and its final output becomes the tool output. Model
 * usage of the nested run is added to the calling run.
 *
 * <p>
 * A nested run cannot pause: if it stops on an approval request, the call
 * fails with a message to the calling model instead.
 */
@Slf4j
@Getter
@Builder
public class AgentTool implements ToolComponent {

    static final String INPUT_PARAMETER = "input";

    private final Agent agent;
    private final AgentRunner runner;
    private final String toolName;
    private final String toolDescription;
    // Final output of the nested run to tool output text; String.valueOf when unset
    private final Function<RunResult, String> outputExtractor;
    private final RunConfig runConfig;
    @Builder.Default
    private final boolean enabled = true;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description(toolDescription != null ? toolDescription : agent.getHandoffDescription())
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(INPUT_PARAMETER, Map.of(
                                "type", "string",
                                "description", "The input for the " + agent.getName() + " agent")),
                        "required", List.of(INPUT_PARAMETER),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public String getToolName() {
        if (toolName != null) {
            return toolName;
        }
        return agent.getName().replaceAll("[^A-Za-z0-9_]", "_").toLowerCase(Locale.ROOT);
    }

    @Override
    public ToolOrigin getOrigin() {
        return ToolOrigin.agentAsTool(agent.getName());
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        Object input = parameters.get(INPUT_PARAMETER);
        if (input == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: input"));
        }

        RunConfig base = runConfig != null ? runConfig : RunConfig.defaults();
        RunConfig nestedConfig = base.toBuilder()
                .context(context.runContext() != null ? context.runContext().getPayload() : null)
                .build();

        log.debug("[Tools] Running agent {} as tool {}", agent.getName(), getToolName());
        RunResult result = runner.run(agent, String.valueOf(input), nestedConfig);
        if (context.runContext() != null) {
            context.runContext().getUsage().add(result.getUsage());
        }

        if (result.isInterrupted()) {
            log.warn("[Tools] Agent {} paused for {} approvals inside tool {}", agent.getName(),
                    result.getInterruptions().size(), getToolName());
            return CompletableFuture.completedFuture(ToolResult.failure("Agent " + agent.getName()
                    + " requires approval for " + result.getInterruptions().size()
                    + " tool calls and cannot run as a tool"));
        }

        String output = outputExtractor != null
                ? outputExtractor.apply(result)
                : String.valueOf(result.getFinalOutput());
        return CompletableFuture.completedFuture(ToolResult.success(output, result.getFinalOutput()));
    }
}
