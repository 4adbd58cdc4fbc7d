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

import me.golemcore.runner.domain.guardrail.ToolInputGuardrail;
import me.golemcore.runner.domain.guardrail.ToolOutputGuardrail;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.ToolStreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a function tool the model can call. Tools expose
 * their JSON Schema definition to the model and implement the execution logic.
 * Approval gating, guardrails and error translation are optional.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the parsed call arguments. A failed future, or an
     * exception, aborts the run unless {@link #translateFailure} turns it into a
     * message.
     *
     * @param context
     *            the call being served
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters);

    /**
     * Whether this tool reports progress through {@link #stream}.
     */
    default boolean isStreaming() {
        return false;
    }

    /**
     * Executes the tool as a stream of deltas ending with the final result.
     * Default implementation wraps {@link #execute}.
     */
    default Flux<ToolStreamEvent> stream(ToolContext context, Map<String, Object> parameters) {
        return Mono.fromFuture(() -> execute(context, parameters))
                .map(ToolStreamEvent::finalResult)
                .flux();
    }

    /**
     * Whether this particular call must be approved before it runs.
     */
    default boolean needsApproval(ToolContext context, Map<String, Object> parameters) {
        return false;
    }

    default List<ToolInputGuardrail> getInputGuardrails() {
        return List.of();
    }

    default List<ToolOutputGuardrail> getOutputGuardrails() {
        return List.of();
    }

    default ToolOrigin getOrigin() {
        return ToolOrigin.function();
    }

    /**
     * Turns an execution failure into a model-visible message. An empty result
     * lets the failure propagate.
     */
    default Optional<String> translateFailure(ToolContext context, Throwable error) {
        return Optional.empty();
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
