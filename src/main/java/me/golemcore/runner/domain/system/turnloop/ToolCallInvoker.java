package me.golemcore.runner.domain.system.turnloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.ModelBehaviorException;
import me.golemcore.runner.domain.exception.ToolExecutionException;
import me.golemcore.runner.domain.exception.ToolGuardrailTripwireException;
import me.golemcore.runner.domain.guardrail.GuardrailOutcome;
import me.golemcore.runner.domain.guardrail.ToolInputGuardrail;
import me.golemcore.runner.domain.guardrail.ToolOutputGuardrail;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ApprovalStatus;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.RunHooks;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolFailureKind;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.ToolStreamEvent;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.HostedToolCallOutput;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs a single tool call: approval gate, input guardrails, invocation, error
 * translation, output guardrails and truncation. Called concurrently from the
 * tool executor, one call per thread.
 */
@Slf4j
public class ToolCallInvoker {

    static final String REJECTION_MESSAGE = "Tool execution was not approved.";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final int maxToolResultChars;

    public ToolCallInvoker(ObjectMapper objectMapper, int maxToolResultChars) {
        this.objectMapper = objectMapper;
        this.maxToolResultChars = maxToolResultChars;
    }

    ToolCallResult invokeFunction(Agent agent, ToolComponent tool, FunctionCall call, RunContext context,
            List<RunHooks> hooks, RunEventEmitter emitter) {
        String toolName = tool.getToolName();
        Map<String, Object> arguments = parseArguments(toolName, call.getArguments());
        ToolContext toolContext = new ToolContext(context, agent, toolName, call.getCallId(), call.getArguments());

        if (needsApproval(tool, toolContext, arguments)) {
            ApprovalStatus status = context.getApprovalStatus(toolName, call.getCallId());
            if (status == ApprovalStatus.UNKNOWN) {
                log.info("[Tools] Call {} of tool {} is waiting for approval", call.getCallId(), toolName);
                return new ToolCallResult(toolName, call.getCallId(),
                        new ToolApprovalItem(agent, call, toolName, tool.getOrigin()), null);
            }
            if (status == ApprovalStatus.REJECTED) {
                log.info("[Tools] Call {} of tool {} was rejected", call.getCallId(), toolName);
                return rejectedFunction(agent, toolName, call, tool.getOrigin());
            }
        }

        hooks.forEach(hook -> hook.onToolStart(context, agent, toolName, call.getCallId()));
        emitter.toolStarted(toolName, call.getCallId());

        String output;
        Object value;
        String inputRejection = runInputGuardrails(tool, toolContext, arguments);
        if (inputRejection != null) {
            output = inputRejection;
            value = ToolResult.failure(ToolFailureKind.GUARDRAIL_REJECTED, inputRejection);
        } else {
            ToolResult result = invokeTool(tool, toolContext, arguments, emitter);
            output = truncateToolResult(result.toModelOutput(), toolName);
            value = result.getData() != null ? result.getData() : output;
            String outputRejection = runOutputGuardrails(tool, toolContext, arguments, output);
            if (outputRejection != null) {
                output = outputRejection;
                value = ToolResult.failure(ToolFailureKind.GUARDRAIL_REJECTED, outputRejection);
            }
        }

        String recorded = output;
        hooks.forEach(hook -> hook.onToolEnd(context, agent, toolName, call.getCallId(), recorded));
        emitter.toolEnded(toolName, call.getCallId(), recorded);

        FunctionCallOutput raw = FunctionCallOutput.of(call.getCallId(), recorded);
        return new ToolCallResult(toolName, call.getCallId(),
                new ToolCallOutputItem(agent, raw, value, tool.getOrigin()), value);
    }

    ToolCallResult invokeHosted(Agent agent, HostedToolComponent tool, HostedToolCall call, RunContext context,
            List<RunHooks> hooks, RunEventEmitter emitter) {
        String toolName = tool.getName();
        ToolContext toolContext = new ToolContext(context, agent, toolName, call.getCallId(), null);

        if (tool.needsApproval(toolContext, call)) {
            ApprovalStatus status = context.getApprovalStatus(toolName, call.getCallId());
            if (status == ApprovalStatus.UNKNOWN) {
                log.info("[Tools] Hosted call {} ({}) is waiting for approval", call.getCallId(), toolName);
                return new ToolCallResult(toolName, call.getCallId(),
                        new ToolApprovalItem(agent, call, toolName, ToolOrigin.function()), null);
            }
            if (status == ApprovalStatus.REJECTED) {
                log.info("[Tools] Hosted call {} ({}) was rejected", call.getCallId(), toolName);
                return rejectedHosted(agent, toolName, call);
            }
        }

        hooks.forEach(hook -> hook.onToolStart(context, agent, toolName, call.getCallId()));
        emitter.toolStarted(toolName, call.getCallId());

        String output;
        try {
            output = truncateToolResult(tool.getExecutor().execute(toolContext, call), toolName);
        } catch (AgentRunException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolExecutionException(toolName, "Error running tool " + toolName + ": "
                    + safeCauseMessage(e), e);
        }

        String recorded = output != null ? output : "";
        hooks.forEach(hook -> hook.onToolEnd(context, agent, toolName, call.getCallId(), recorded));
        emitter.toolEnded(toolName, call.getCallId(), recorded);

        HostedToolCallOutput raw = HostedToolCallOutput.of(call.kind(), call.getCallId(), recorded);
        return new ToolCallResult(toolName, call.getCallId(),
                new ToolCallOutputItem(agent, raw, recorded, ToolOrigin.function()), recorded);
    }

    ToolCallResult rejectedFunction(Agent agent, String toolName, FunctionCall call, ToolOrigin origin) {
        FunctionCallOutput raw = FunctionCallOutput.of(call.getCallId(), REJECTION_MESSAGE);
        ToolResult denied = ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, REJECTION_MESSAGE);
        return new ToolCallResult(toolName, call.getCallId(),
                new ToolCallOutputItem(agent, raw, denied, origin), denied);
    }

    ToolCallResult rejectedHosted(Agent agent, String toolName, HostedToolCall call) {
        HostedToolCallOutput raw = HostedToolCallOutput.of(call.kind(), call.getCallId(), REJECTION_MESSAGE);
        ToolResult denied = ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, REJECTION_MESSAGE);
        return new ToolCallResult(toolName, call.getCallId(),
                new ToolCallOutputItem(agent, raw, denied, ToolOrigin.function()), denied);
    }

    boolean needsApproval(ToolComponent tool, ToolContext toolContext, Map<String, Object> arguments) {
        try {
            return tool.needsApproval(toolContext, arguments);
        } catch (RuntimeException e) {
            throw new ToolExecutionException(tool.getToolName(), "Approval check of tool " + tool.getToolName()
                    + " failed: " + safeCauseMessage(e), e);
        }
    }

    Map<String, Object> parseArguments(String toolName, String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, ARGUMENTS_TYPE);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new ModelBehaviorException("Invalid JSON input for tool " + toolName + ": " + json, e);
        }
    }

    private ToolResult invokeTool(ToolComponent tool, ToolContext toolContext, Map<String, Object> arguments,
            RunEventEmitter emitter) {
        try {
            ToolResult result = tool.isStreaming()
                    ? consumeStream(tool, toolContext, arguments, emitter)
                    : tool.execute(toolContext, arguments).get();
            return result != null ? result : ToolResult.success("");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(tool.getToolName(), "Interrupted while running tool "
                    + tool.getToolName(), e);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            Optional<String> translated = tool.translateFailure(toolContext, cause);
            if (translated.isPresent()) {
                log.warn("[Tools] Tool {} failed, recording translated error: {}", tool.getToolName(),
                        safeCauseMessage(cause));
                return ToolResult.builder()
                        .success(false)
                        .failureKind(ToolFailureKind.EXECUTION_FAILED)
                        .output(translated.get())
                        .error(safeCauseMessage(cause))
                        .build();
            }
            if (cause instanceof AgentRunException runException) {
                throw runException;
            }
            log.error("[Tools] Tool {} failed", tool.getToolName(), cause);
            throw new ToolExecutionException(tool.getToolName(), "Error running tool " + tool.getToolName()
                    + ": " + safeCauseMessage(cause), cause);
        }
    }

    private ToolResult consumeStream(ToolComponent tool, ToolContext toolContext, Map<String, Object> arguments,
            RunEventEmitter emitter) {
        return tool.stream(toolContext, arguments)
                .doOnNext(event -> {
                    if (!event.isFinal()) {
                        emitter.toolDelta(toolContext.toolName(), toolContext.callId(), event.delta());
                    }
                })
                .filter(ToolStreamEvent::isFinal)
                .next()
                .map(ToolStreamEvent::finalResult)
                .blockOptional()
                .orElseThrow(() -> new IllegalStateException("Tool stream ended without a final result"));
    }

    private String runInputGuardrails(ToolComponent tool, ToolContext toolContext, Map<String, Object> arguments) {
        for (ToolInputGuardrail guardrail : tool.getInputGuardrails()) {
            GuardrailOutcome outcome;
            try {
                outcome = guardrail.check(toolContext, arguments);
            } catch (Exception e) {
                log.warn("[Tools] Input guardrail {} failed on tool {}: {}", guardrail.getName(),
                        tool.getToolName(), safeCauseMessage(e));
                return "Tool input guardrail " + guardrail.getName() + " failed: " + safeCauseMessage(e);
            }
            String rejection = applyOutcome(guardrail.getName(), tool.getToolName(), outcome);
            if (rejection != null) {
                return rejection;
            }
        }
        return null;
    }

    private String runOutputGuardrails(ToolComponent tool, ToolContext toolContext, Map<String, Object> arguments,
            String output) {
        for (ToolOutputGuardrail guardrail : tool.getOutputGuardrails()) {
            GuardrailOutcome outcome;
            try {
                outcome = guardrail.check(toolContext, arguments, output);
            } catch (Exception e) {
                log.warn("[Tools] Output guardrail {} failed on tool {}: {}", guardrail.getName(),
                        tool.getToolName(), safeCauseMessage(e));
                return "Tool output guardrail " + guardrail.getName() + " failed: " + safeCauseMessage(e);
            }
            String rejection = applyOutcome(guardrail.getName(), tool.getToolName(), outcome);
            if (rejection != null) {
                return rejection;
            }
        }
        return null;
    }

    private String applyOutcome(String guardrailName, String toolName, GuardrailOutcome outcome) {
        if (outcome == null || !outcome.isBlocked()) {
            return null;
        }
        if (outcome.behavior() == GuardrailOutcome.Behavior.RAISE_EXCEPTION) {
            throw new ToolGuardrailTripwireException(guardrailName, toolName, outcome.modelMessage());
        }
        log.info("[Tools] Guardrail {} blocked tool {}", guardrailName, toolName);
        return outcome.modelMessage() != null
                ? outcome.modelMessage()
                : "Tool call was blocked by guardrail " + guardrailName;
    }

    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        if (maxToolResultChars <= 0 || content.length() <= maxToolResultChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxToolResultChars + " chars.]";
        int cutPoint = Math.max(0, maxToolResultChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
