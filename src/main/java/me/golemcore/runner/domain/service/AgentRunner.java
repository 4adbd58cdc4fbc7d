package me.golemcore.runner.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.event.RunCompletedEvent;
import me.golemcore.runner.domain.model.event.RunEvent;
import me.golemcore.runner.domain.model.event.RunEventListener;
import me.golemcore.runner.domain.model.protocol.Message;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.domain.state.RunState;
import me.golemcore.runner.domain.system.turnloop.TurnLoopSystem;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Entry point for running agents.
 *
 * <p>
 * A run either finishes with a final output or pauses with interruptions. A
 * paused run is continued by recording decisions on
 * {@link RunResult#toState()} and passing the state to {@link #resume}. The
 * state may also be stored with {@link RunState#toDocument()} and loaded later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunner {

    private final TurnLoopSystem turnLoopSystem;

    public RunResult run(Agent agent, String input) {
        return run(agent, input, RunConfig.defaults());
    }

    public RunResult run(Agent agent, String input, RunConfig config) {
        return run(agent, toInput(input), config);
    }

    public RunResult run(Agent agent, List<ProtocolItem> input, RunConfig config) {
        return turnLoopSystem.run(agent, input, config);
    }

    public RunResult resume(RunState state) {
        return resume(state, RunConfig.defaults());
    }

    public RunResult resume(RunState state, RunConfig config) {
        return turnLoopSystem.resume(state, config);
    }

    public CompletableFuture<RunResult> runAsync(Agent agent, List<ProtocolItem> input, RunConfig config) {
        return Mono.fromCallable(() -> run(agent, input, config))
                .subscribeOn(Schedulers.boundedElastic())
                .toFuture();
    }

    // ==================== Streaming ====================

    public Flux<RunEvent> runStreamed(Agent agent, String input, RunConfig config) {
        return runStreamed(agent, toInput(input), config);
    }

    /**
     * Runs the agent on a worker thread and publishes its events. The flux
     * ends with a {@link RunCompletedEvent}, or with the error that failed the
     * run.
     */
    public Flux<RunEvent> runStreamed(Agent agent, List<ProtocolItem> input, RunConfig config) {
        return stream(config, streamingConfig -> turnLoopSystem.run(agent, input, streamingConfig));
    }

    public Flux<RunEvent> resumeStreamed(RunState state, RunConfig config) {
        return stream(config, streamingConfig -> turnLoopSystem.resume(state, streamingConfig));
    }

    private Flux<RunEvent> stream(RunConfig config, Function<RunConfig, RunResult> execution) {
        RunConfig base = config != null ? config : RunConfig.defaults();
        return Flux.create(sink -> {
            RunEventListener callerListener = base.getEventListener();
            RunConfig streamingConfig = base.toBuilder()
                    .streaming(true)
                    .eventListener(event -> {
                        sink.next(event);
                        if (callerListener != null) {
                            callerListener.onEvent(event);
                        }
                    })
                    .build();

            Disposable task = Mono.fromCallable(() -> execution.apply(streamingConfig))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(result -> {
                        sink.next(new RunCompletedEvent(result));
                        sink.complete();
                    }, error -> {
                        log.error("[TurnLoop] Streamed run failed: {}", error.getMessage());
                        sink.error(error);
                    });
            sink.onDispose(task);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private static List<ProtocolItem> toInput(String input) {
        return input != null ? List.of(Message.user(input)) : List.of();
    }
}
