package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.domain.component.FunctionTool;
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.exception.ModelBehaviorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.Handoff;
import me.golemcore.runner.domain.model.JsonOutputSchema;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.ToolResult;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.RunItemType;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.HostedToolKind;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.model.protocol.Reasoning;
import me.golemcore.runner.domain.model.protocol.UnknownItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseDecoderTest {

    private ResponseDecoder decoder;
    private Agent agent;
    private FunctionTool search;

    @BeforeEach
    void setUp() {
        decoder = new ResponseDecoder();
        search = FunctionTool.builder()
                .name("search")
                .description("Searches")
                .handler((ctx, args) -> ToolResult.success("found"))
                .build();
        agent = Agent.builder().name("assistant").tools(List.of(search)).build();
    }

    private ProcessedResponse decode(List<Component> tools, List<Handoff> handoffs, ProtocolItem... output) {
        ModelResponse response = ModelResponse.builder().output(List.of(output)).build();
        return decoder.decode(agent, tools, response, null, handoffs);
    }

    private static FunctionCall call(String callId, String name) {
        return FunctionCall.builder().callId(callId).name(name).arguments("{}").build();
    }

    private static List<RunItemType> types(List<RunItem> items) {
        return items.stream().map(RunItem::getType).toList();
    }

    // ==================== Classification ====================

    @Test
    void shouldKeepOutputOrderInNewItems() {
        ProcessedResponse processed = decode(List.of(search), List.of(),
                Reasoning.builder().id("rs_1").summary("thinking").build(),
                Message.assistant("msg_1", "Let me look"),
                call("c1", "search"));

        assertEquals(List.of(RunItemType.REASONING, RunItemType.MESSAGE_OUTPUT, RunItemType.TOOL_CALL),
                types(processed.getNewItems()));
        assertEquals(1, processed.getFunctions().size());
        assertSame(search, processed.getFunctions().get(0).tool());
        assertEquals(List.of("search"), processed.getToolsUsed());
        assertTrue(processed.hasToolsOrApprovalsToRun());
    }

    @Test
    void shouldRouteHandoffCallsBeforeFunctions() {
        Agent billing = Agent.builder().name("billing").build();
        Handoff handoff = Handoff.to(billing);

        ProcessedResponse processed = decode(List.of(search), List.of(handoff), call("h1", "transfer_to_billing"));

        assertEquals(List.of(RunItemType.HANDOFF_CALL), types(processed.getNewItems()));
        assertEquals(1, processed.getHandoffs().size());
        assertSame(handoff, processed.getHandoffs().get(0).handoff());
        assertTrue(processed.getFunctions().isEmpty());
    }

    @Test
    void shouldRouteHostedCallsByKind() {
        HostedToolComponent shell = HostedToolComponent.builder()
                .kind(HostedToolKind.SHELL)
                .executor((ctx, call) -> "ok")
                .build();
        HostedToolCall hostedCall = HostedToolCall.builder()
                .type("shell_call")
                .id("sh_1")
                .callId("s1")
                .action(Map.of("commands", List.of("ls")))
                .build();

        ProcessedResponse processed = decode(List.of(shell), List.of(), hostedCall);

        assertEquals(1, processed.getHostedCalls().size());
        assertSame(shell, processed.getHostedCalls().get(0).tool());
        assertEquals(List.of("shell"), processed.getToolsUsed());
    }

    @Test
    void shouldRouteMcpApprovalRequestsByServerLabel() {
        HostedMcpTool docs = HostedMcpTool.builder().serverLabel("docs").build();
        McpApprovalRequest request = McpApprovalRequest.builder()
                .id("mcpr_1")
                .serverLabel("docs")
                .name("read")
                .arguments("{}")
                .build();

        ProcessedResponse processed = decode(List.of(docs), List.of(), request);

        assertEquals(List.of(RunItemType.MCP_APPROVAL_REQUEST), types(processed.getNewItems()));
        assertSame(docs, processed.getMcpApprovalRequests().get(0).tool());
    }

    @Test
    void shouldSkipUnknownItems() {
        ProcessedResponse processed = decode(List.of(search), List.of(),
                new UnknownItem("web_search_call", Map.of("id", "ws_1")),
                Message.assistant("msg_1", "Hi"));

        assertEquals(List.of(RunItemType.MESSAGE_OUTPUT), types(processed.getNewItems()));
        assertFalse(processed.hasToolsOrApprovalsToRun());
    }

    @Test
    void shouldIgnoreDisabledTools() {
        FunctionTool disabled = FunctionTool.builder()
                .name("search")
                .handler((ctx, args) -> ToolResult.success("x"))
                .enabled(false)
                .build();

        assertThrows(ModelBehaviorException.class, () -> decode(List.of(disabled), List.of(), call("c1", "search")));
    }

    // ==================== Structured output ====================

    @Test
    void shouldAcceptJsonToolCallOnlyWithStructuredOutput() {
        JsonOutputSchema<Map> schema = JsonOutputSchema.of(Map.class, Map.of("type", "object"));
        ModelResponse response = ModelResponse.builder()
                .output(List.of(call("j1", JsonToolCallTool.NAME)))
                .build();

        ProcessedResponse processed = decoder.decode(agent, List.of(), response, schema, List.of());

        assertInstanceOf(JsonToolCallTool.class, processed.getFunctions().get(0).tool());
        assertThrows(ModelBehaviorException.class,
                () -> decoder.decode(agent, List.of(), response, null, List.of()));
    }

    // ==================== Malformed responses ====================

    @Test
    void shouldFailWholeResponseOnUnknownTool() {
        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> decode(List.of(search), List.of(), call("c1", "search"), call("c2", "delete")));

        assertEquals("Tool delete not found in agent assistant", error.getMessage());
    }

    @Test
    void shouldFailOnFunctionCallWithoutCallId() {
        FunctionCall malformed = FunctionCall.builder().name("search").arguments("{}").build();

        assertThrows(ModelBehaviorException.class, () -> decode(List.of(search), List.of(), malformed));
    }

    @Test
    void shouldFailOnHostedCallWithoutMatchingTool() {
        HostedToolCall hostedCall = HostedToolCall.builder().type("computer_call").callId("k1").build();

        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> decode(List.of(search), List.of(), hostedCall));

        assertTrue(error.getMessage().contains("has no computer tool"));
    }

    @Test
    void shouldFailOnUnknownMcpServer() {
        McpApprovalRequest request = McpApprovalRequest.builder().id("r1").serverLabel("nope").build();

        assertThrows(ModelBehaviorException.class, () -> decode(List.of(search), List.of(), request));
    }
}
