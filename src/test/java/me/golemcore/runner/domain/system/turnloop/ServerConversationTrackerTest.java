package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolCallItem;
import me.golemcore.runner.domain.model.item.ToolCallOutputItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.FunctionCallOutput;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.testsupport.ScriptedModelPort;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServerConversationTrackerTest {

    private static final Agent AGENT = Agent.builder().name("assistant").build();

    private static ToolCallItem callItem(FunctionCall call) {
        return new ToolCallItem(AGENT, call, ToolOrigin.function());
    }

    private static ToolCallOutputItem outputItem(String callId, String output) {
        return new ToolCallOutputItem(AGENT, FunctionCallOutput.of(callId, output), output, ToolOrigin.function());
    }

    // ==================== Delta input ====================

    @Test
    void shouldSendInitialInputOnlyOnce() {
        ServerConversationTracker tracker = new ServerConversationTracker("conv_1", null, false);
        List<ProtocolItem> original = List.of(Message.user("Hi"));

        List<ProtocolItem> first = tracker.prepareInput(original, List.of());
        tracker.markInputAsSent(first);
        List<ProtocolItem> second = tracker.prepareInput(original, List.of());

        assertEquals(original, first);
        assertTrue(second.isEmpty());
    }

    @Test
    void shouldNotResendItemsProducedByServer() {
        ServerConversationTracker tracker = new ServerConversationTracker("conv_1", null, false);
        List<ProtocolItem> original = List.of(Message.user("Hi"));
        tracker.markInputAsSent(tracker.prepareInput(original, List.of()));

        FunctionCall call = ScriptedModelPort.functionCall("c1", "lookup", "{}");
        tracker.trackServerItems(ScriptedModelPort.response(call));
        List<RunItem> generated = List.of(callItem(call), outputItem("c1", "found"));

        List<ProtocolItem> next = tracker.prepareInput(original, generated);

        assertEquals(1, next.size());
        assertEquals(FunctionCallOutput.of("c1", "found"), next.get(0));
    }

    @Test
    void shouldResendRewoundInput() {
        ServerConversationTracker tracker = new ServerConversationTracker("conv_1", null, false);
        List<ProtocolItem> original = List.of(Message.user("Hi"));
        List<ProtocolItem> first = tracker.prepareInput(original, List.of());
        tracker.markInputAsSent(first);

        tracker.rewindInput(first);

        assertEquals(original, tracker.prepareInput(original, List.of()));
        assertEquals(original, tracker.getRemainingInitialInput());
    }

    // ==================== Response chaining ====================

    @Test
    void shouldChainResponseIdsWhenAutomatic() {
        ServerConversationTracker tracker = new ServerConversationTracker(null, null, true);
        ModelResponse response = ScriptedModelPort.response(Message.assistant("msg_1", "Hello"));

        tracker.trackServerItems(response);

        assertEquals(response.getResponseId(), tracker.getPreviousResponseId());
    }

    @Test
    void shouldNotChainWhenConversationIdIsSet() {
        ServerConversationTracker tracker = new ServerConversationTracker("conv_1", null, true);

        tracker.trackServerItems(ScriptedModelPort.response(Message.assistant("msg_1", "Hello")));

        assertNull(tracker.getPreviousResponseId());
    }

    // ==================== Resumed runs ====================

    @Test
    void shouldSendOnlyNewItemsAfterHydration() {
        List<ProtocolItem> original = List.of(Message.user("Hi"));
        FunctionCall call = ScriptedModelPort.functionCall("c1", "lookup", "{}");
        ModelResponse response = ScriptedModelPort.response(call);
        List<RunItem> generated = new ArrayList<>(List.of(callItem(call), outputItem("c1", "found")));

        ServerConversationTracker tracker = new ServerConversationTracker(null, "resp_old", false);
        tracker.hydrateFromState(original, generated, List.of(response), null);
        generated.add(outputItem("c2", "late"));

        List<ProtocolItem> next = tracker.prepareInput(original, generated);

        assertEquals(List.of(FunctionCallOutput.of("c2", "late")), next);
        assertEquals(response.getResponseId(), tracker.getPreviousResponseId());
    }

    @Test
    void shouldIgnoreRepeatedHydration() {
        List<ProtocolItem> original = List.of(Message.user("Hi"));
        FunctionCall call = ScriptedModelPort.functionCall("c1", "lookup", "{}");
        ModelResponse response = ScriptedModelPort.response(call);
        List<RunItem> generated = new ArrayList<>(List.of(callItem(call), outputItem("c1", "found")));

        ServerConversationTracker once = new ServerConversationTracker(null, "resp_old", false);
        once.hydrateFromState(original, generated, List.of(response), null);
        ServerConversationTracker twice = new ServerConversationTracker(null, "resp_old", false);
        twice.hydrateFromState(original, generated, List.of(response), null);
        twice.hydrateFromState(original, generated, List.of(response), null);
        generated.add(outputItem("c2", "late"));

        List<ProtocolItem> expected = once.prepareInput(original, generated);
        List<ProtocolItem> actual = twice.prepareInput(original, generated);

        assertEquals(List.of(FunctionCallOutput.of("c2", "late")), expected);
        assertEquals(expected, actual);
        assertEquals(once.getPreviousResponseId(), twice.getPreviousResponseId());
        assertNull(twice.getRemainingInitialInput());
    }

    @Test
    void shouldSkipItemsAlreadyInSessionAfterHydration() {
        List<ProtocolItem> original = List.of(Message.user("Hi"));
        List<RunItem> generated = List.of(outputItem("c9", "from session"));

        ServerConversationTracker tracker = new ServerConversationTracker("conv_1", null, false);
        tracker.hydrateFromState(original, List.of(), List.of(), List.of(FunctionCallOutput.of("c9", "from session")));

        assertTrue(tracker.prepareInput(original, generated).isEmpty());
    }
}
