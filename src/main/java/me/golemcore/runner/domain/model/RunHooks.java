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

/**
 * Lifecycle callbacks of a run. Run-level hooks come from the run config,
 * agent-level hooks from the agent; both are invoked. Every method defaults to
 * a no-op.
 */
public interface RunHooks {

    RunHooks NOOP = new RunHooks() {
    };

    default void onAgentStart(RunContext context, Agent agent) {
    }

    default void onAgentEnd(RunContext context, Agent agent, Object output) {
    }

    default void onHandoff(RunContext context, Agent fromAgent, Agent toAgent) {
    }

    default void onToolStart(RunContext context, Agent agent, String toolName, String callId) {
    }

    default void onToolEnd(RunContext context, Agent agent, String toolName, String callId, String output) {
    }

    default void onModelStart(RunContext context, Agent agent, ModelRequest request) {
    }

    default void onModelEnd(RunContext context, Agent agent, ModelResponse response) {
    }
}
