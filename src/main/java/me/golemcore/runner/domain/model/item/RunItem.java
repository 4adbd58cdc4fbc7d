package me.golemcore.runner.domain.model.item;

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

import lombok.Getter;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

/**
 * One entry of a run's transcript: the protocol payload plus the agent that
 * produced it. Item order in a run is significant.
 */
@Getter
public abstract class RunItem {

    private final Agent agent;
    private final ProtocolItem rawItem;

    protected RunItem(Agent agent, ProtocolItem rawItem) {
        this.agent = agent;
        this.rawItem = rawItem;
    }

    public abstract RunItemType getType();

    /**
     * Payload to send back to the model as input, or {@code null} if this item
     * is never sent.
     */
    public ProtocolItem toInputItem() {
        return rawItem;
    }

    public String callId() {
        return rawItem != null ? rawItem.callId() : null;
    }

    @Override
    public String toString() {
        return getType().getWireName() + "[agent=" + (agent != null ? agent.getName() : null) + ", raw=" + rawItem
                + "]";
    }
}
