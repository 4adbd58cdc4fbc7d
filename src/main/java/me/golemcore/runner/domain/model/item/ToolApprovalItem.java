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
import me.golemcore.runner.domain.model.ToolOrigin;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

/**
 * Placeholder for a gated tool call waiting for an approve/reject decision.
 * Never sent to the model.
 */
@Getter
public class ToolApprovalItem extends RunItem {

    private final String toolName;
    private final ToolOrigin origin;

    public ToolApprovalItem(Agent agent, ProtocolItem rawItem, String toolName, ToolOrigin origin) {
        super(agent, rawItem);
        this.toolName = toolName;
        this.origin = origin;
    }

    @Override
    public RunItemType getType() {
        return RunItemType.TOOL_APPROVAL;
    }

    @Override
    public ProtocolItem toInputItem() {
        return null;
    }
}
