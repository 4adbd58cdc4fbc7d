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
import lombok.Getter;
import lombok.ToString;
import me.golemcore.runner.domain.component.Component;
import me.golemcore.runner.port.outbound.ModelPort;

import java.util.ArrayList;
import java.util.List;

/**
 * Description of an agent: instructions, tools, handoff targets and output
 * schema. The name identifies the agent inside run state snapshots, so names
 * must be unique within the graph of agents reachable through handoffs.
 *
 * <p>
 * Handoff graphs may contain cycles. Build the agents first, then connect them
 * with {@link #addHandoff(Agent)}.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = "name")
public class Agent {

    private final String name;
    private final String instructions;
    private final String handoffDescription;
    @Builder.Default
    private final List<Component> tools = List.of();
    @Builder.Default
    private List<Handoff> handoffs = List.of();
    private final OutputSchema outputSchema;
    private final RunHooks hooks;
    private final ModelPort model;
    @Builder.Default
    private final ToolUseBehavior toolUseBehavior = ToolUseBehavior.RUN_LLM_AGAIN;
    @Builder.Default
    private final boolean resetToolChoice = true;
    private final String toolChoice;

    public Agent addHandoff(Agent target) {
        return addHandoff(Handoff.to(target));
    }

    public Agent addHandoff(Handoff handoff) {
        List<Handoff> updated = new ArrayList<>(handoffs);
        updated.add(handoff);
        this.handoffs = List.copyOf(updated);
        return this;
    }

    public List<Component> getEnabledTools() {
        return tools.stream().filter(Component::isEnabled).toList();
    }

    public List<Handoff> getEnabledHandoffs() {
        return handoffs.stream().filter(Handoff::isEnabled).toList();
    }

    public boolean hasStructuredOutput() {
        return outputSchema != null && !outputSchema.isPlainText();
    }
}
