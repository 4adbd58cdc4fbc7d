package me.golemcore.runner.domain.model;

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
import lombok.Data;
import me.golemcore.runner.domain.model.event.RunEventListener;
import me.golemcore.runner.port.outbound.ModelPort;
import me.golemcore.runner.port.outbound.SessionPort;

/**
 * Per-run settings. Anything left unset falls back to the agent or to the
 * {@code runner.*} properties.
 */
@Data
@Builder(toBuilder = true)
public class RunConfig {

    private Integer maxTurns;

    // Model name passed to the provider, overriding the provider default
    private String model;

    // Provider used for every agent in the run, overriding Agent.model
    private ModelPort modelPort;

    @Builder.Default
    private RunHooks hooks = RunHooks.NOOP;

    private SessionPort session;

    // Server-managed conversation settings
    private String conversationId;
    private String previousResponseId;
    private boolean autoPreviousResponseId;

    private Object context;

    private HandoffInputFilter handoffInputFilter;

    private RunEventListener eventListener;

    // Streams model events to the listener when the provider supports it
    private boolean streaming;

    public static RunConfig defaults() {
        return RunConfig.builder().build();
    }

    public boolean isServerManagedConversation() {
        return conversationId != null || previousResponseId != null || autoPreviousResponseId;
    }
}
