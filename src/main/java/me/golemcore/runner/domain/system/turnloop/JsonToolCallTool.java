package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.model.OutputSchema;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stand-in tool for a structured-output "json tool call": the arguments are
 * the structured output, validated against the agent's output schema.
 */
class JsonToolCallTool implements ToolComponent {

    static final String NAME = "json_tool_call";

    private final OutputSchema outputSchema;

    JsonToolCallTool(OutputSchema outputSchema) {
        this.outputSchema = outputSchema;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Structured output of type " + outputSchema.getName())
                .inputSchema(outputSchema.getJsonSchema())
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        Object validated = outputSchema.validate(context.arguments());
        return CompletableFuture.completedFuture(ToolResult.success(context.arguments(), validated));
    }
}
