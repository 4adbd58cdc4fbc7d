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
import me.golemcore.runner.domain.guardrail.ToolInputGuardrail;
import me.golemcore.runner.domain.guardrail.ToolOutputGuardrail;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tool backed by a plain Java function.
 *
 * <pre>{@code
 * FunctionTool echo = FunctionTool.builder()
 *         .name("echo")
 *         .description("Echoes its input")
 *         .parameters(Map.of("type", "object", "properties", Map.of("x", Map.of("type", "string"))))
 *         .handler((ctx, args) -> ToolResult.success(String.valueOf(args.get("x"))))
 *         .approvalPolicy((ctx, args) -> true)
 *         .build();
 * }</pre>
 */
@Getter
@Builder
public class FunctionTool implements ToolComponent {

    private final String name;
    private final String description;
    @Builder.Default
    private final Map<String, Object> parameters = Map.of("type", "object", "properties", Map.of());
    private final Handler handler;
    private final ApprovalPolicy approvalPolicy;
    @Builder.Default
    private final List<ToolInputGuardrail> inputGuardrails = List.of();
    @Builder.Default
    private final List<ToolOutputGuardrail> outputGuardrails = List.of();
    private final FailureTranslator failureTranslator;
    @Builder.Default
    private final ToolOrigin origin = ToolOrigin.function();
    @Builder.Default
    private final boolean enabled = true;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(parameters)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> arguments) {
        try {
            return CompletableFuture.completedFuture(handler.handle(context, arguments));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean needsApproval(ToolContext context, Map<String, Object> arguments) {
        return approvalPolicy != null && approvalPolicy.needsApproval(context, arguments);
    }

    @Override
    public Optional<String> translateFailure(ToolContext context, Throwable error) {
        if (failureTranslator == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(failureTranslator.translate(context, error));
    }

    @FunctionalInterface
    public interface Handler {
        ToolResult handle(ToolContext context, Map<String, Object> arguments) throws Exception;
    }

    @FunctionalInterface
    public interface ApprovalPolicy {
        boolean needsApproval(ToolContext context, Map<String, Object> arguments);
    }

    @FunctionalInterface
    public interface FailureTranslator {
        String translate(ToolContext context, Throwable error);
    }
}
