package me.golemcore.runner.port.outbound;

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

import me.golemcore.runner.domain.model.ModelRequest;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ModelStreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Port for model providers. Turns one request into one response with function
 * calling support and optional streaming.
 */
public interface ModelPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a model call and returns the full response. Providers that keep
     * conversation history server-side fail the future with
     * {@link ConversationLockedException} when the conversation is transiently
     * locked.
     */
    CompletableFuture<ModelResponse> call(ModelRequest request);

    /**
     * Executes a streaming model call. The stream ends with a completed event
     * carrying the same response shape {@link #call} returns. Default
     * implementation wraps {@link #call}.
     */
    default Flux<ModelStreamEvent> stream(ModelRequest request) {
        return Mono.fromFuture(() -> call(request))
                .map(ModelStreamEvent::completed)
                .flux();
    }

    /**
     * Checks if this provider streams incremental events.
     */
    default boolean supportsStreaming() {
        return false;
    }
}
