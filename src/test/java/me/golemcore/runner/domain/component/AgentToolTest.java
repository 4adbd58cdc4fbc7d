package me.golemcore.runner.domain.component;

import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.ToolDefinition;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.testsupport.ScriptedModelPort;
import me.golemcore.runner.testsupport.TurnLoopFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.runner.testsupport.ScriptedModelPort.functionCall;
import static me.golemcore.runner.testsupport.ScriptedModelPort.message;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentToolTest {

    private TurnLoopFixture fixture;
    private ScriptedModelPort nestedModel;
    private ScriptedModelPort outerModel;
    private Agent translator;

    @BeforeEach
    void setUp() {
        fixture = new TurnLoopFixture();
        nestedModel = ScriptedModelPort.create();
        outerModel = ScriptedModelPort.create();
        translator = Agent.builder()
                .name("French Translator")
                .instructions("Translate to French")
                .handoffDescription("Translates text to French")
                .model(nestedModel)
                .build();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private AgentTool.AgentToolBuilder tool() {
        return AgentTool.builder().agent(translator).runner(fixture.runner());
    }

    private static ToolContext toolContext(RunContext context) {
        return new ToolContext(context, null, "french_translator", "c1", "{}");
    }

    // ==================== Definition ====================

    @Test
    void shouldDeriveNameAndSchemaFromAgent() {
        AgentTool agentTool = tool().build();

        ToolDefinition definition = agentTool.getDefinition();

        assertEquals("french_translator", agentTool.getToolName());
        assertEquals("Translates text to French", definition.getDescription());
        assertEquals(List.of(AgentTool.INPUT_PARAMETER), definition.getInputSchema().get("required"));
        assertEquals(ToolOrigin.Type.AGENT_AS_TOOL, agentTool.getOrigin().type());
        assertEquals("French Translator", agentTool.getOrigin().agentName());
    }

    @Test
    void shouldUseExplicitNameAndDescription() {
        AgentTool agentTool = tool().toolName("translate").toolDescription("Translate text").build();

        assertEquals("translate", agentTool.getDefinition().getName());
        assertEquals("Translate text", agentTool.getDefinition().getDescription());
    }

    // ==================== Execution ====================

    @Test
    void shouldReturnNestedFinalOutputAndAddUsage() {
        nestedModel.respond(message("Bonjour"));
        RunContext parent = new RunContext(Map.of("user", "u1"));

        ToolResult result = tool().build()
                .execute(toolContext(parent), Map.of(AgentTool.INPUT_PARAMETER, "Hello"))
                .join();

        assertTrue(result.isSuccess());
        assertEquals("Bonjour", result.getOutput());
        assertEquals(1, parent.getUsage().getRequests());
        assertEquals("Hello", ((Message) nestedModel.lastRequest().getInput().get(0)).getContent());
    }

    @Test
    void shouldApplyOutputExtractor() {
        nestedModel.respond(message("Bonjour"));

        ToolResult result = tool()
                .outputExtractor((RunResult nested) -> "FR: " + nested.getFinalOutput())
                .build()
                .execute(toolContext(new RunContext(null)), Map.of(AgentTool.INPUT_PARAMETER, "Hello"))
                .join();

        assertEquals("FR: Bonjour", result.getOutput());
    }

    @Test
    void shouldFailWithoutInput() {
        ToolResult result = tool().build().execute(toolContext(new RunContext(null)), Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: input", result.getError());
        assertEquals(0, nestedModel.getRequests().size());
    }

    @Test
    void shouldFailWhenNestedRunNeedsApproval() {
        Agent gated = translator.toBuilder()
                .tools(List.of(FunctionTool.builder()
                        .name("publish")
                        .handler((ctx, args) -> ToolResult.success("published"))
                        .approvalPolicy((ctx, args) -> true)
                        .build()))
                .build();
        nestedModel.respond(functionCall("p1", "publish", "{}"));

        ToolResult result = AgentTool.builder().agent(gated).runner(fixture.runner()).build()
                .execute(toolContext(new RunContext(null)), Map.of(AgentTool.INPUT_PARAMETER, "Hello"))
                .join();

        assertFalse(result.isSuccess());
        assertEquals("Agent French Translator requires approval for 1 tool calls and cannot run as a tool",
                result.getError());
    }

    @Test
    void shouldRunAsToolOfAnotherAgent() {
        Agent orchestrator = Agent.builder()
                .name("orchestrator")
                .tools(List.of(tool().build()))
                .build();
        outerModel.respond(functionCall("t1", "french_translator", "{\"input\":\"Hello\"}"))
                .respond(message("The translation is Bonjour"));
        nestedModel.respond(message("Bonjour"));

        RunResult result = fixture.runner().run(orchestrator, "Translate Hello",
                RunConfig.builder().modelPort(outerModel).build());

        assertEquals("The translation is Bonjour", result.getFinalOutput());
        assertEquals(3, result.getUsage().getRequests());
    }
}
