package me.golemcore.runner.domain.system.turnloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runner.domain.state.RunStateSerializer;
import me.golemcore.runner.infrastructure.config.RunnerProperties;
import me.golemcore.runner.port.outbound.ModelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/** Spring wiring for TurnLoopSystem (domain orchestrator + collaborators). */
@Configuration
public class TurnLoopConfiguration {

    @Bean
    public ResponseDecoder responseDecoder() {
        return new ResponseDecoder();
    }

    @Bean
    public ToolCallInvoker toolCallInvoker(ObjectMapper objectMapper, RunnerProperties properties) {
        return new ToolCallInvoker(objectMapper, properties.getTools().getMaxToolResultChars());
    }

    @Bean
    public ToolExecutionCoordinator toolExecutionCoordinator(ToolCallInvoker invoker, ExecutorService toolExecutor,
            RunnerProperties properties) {
        return new ToolExecutionCoordinator(invoker, toolExecutor,
                properties.getApprovals().isAutoApproveHostedWithoutCallback());
    }

    @Bean
    public InterruptedTurnResolver interruptedTurnResolver(ToolExecutionCoordinator coordinator,
            ToolCallInvoker invoker) {
        return new InterruptedTurnResolver(coordinator, invoker);
    }

    @Bean
    public HistoryWriter turnLoopHistoryWriter(RunnerProperties properties) {
        return new SessionHistoryWriter(properties.getSession().getHistoryLimit());
    }

    @Bean
    public RunStateSerializer runStateSerializer(ObjectMapper objectMapper) {
        return new RunStateSerializer(objectMapper);
    }

    @Bean
    public TurnLoopSystem turnLoopSystem(ResponseDecoder decoder, ToolExecutionCoordinator coordinator,
            InterruptedTurnResolver resolver, HistoryWriter historyWriter, RunnerProperties properties,
            ObjectProvider<ModelPort> defaultModel) {
        // A ModelPort bean, when the application defines one, serves agents that carry no model of their own.
        return new DefaultTurnLoopSystem(decoder, coordinator, resolver, historyWriter, properties.getTurn(),
                properties.getConversation(), defaultModel.getIfAvailable());
    }
}
