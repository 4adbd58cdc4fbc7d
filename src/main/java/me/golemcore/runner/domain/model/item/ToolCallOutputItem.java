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
 * Recorded output of a tool call, including rejection and guardrail outputs.
 * {@code output} is the value the tool produced; the raw item holds the text
 * sent to the model.
 */
@Getter
public class ToolCallOutputItem extends RunItem {

    private final Object output;
    private final ToolOrigin origin;

    public ToolCallOutputItem(Agent agent, ProtocolItem rawItem, Object output, ToolOrigin origin) {
        super(agent, rawItem);
        this.output = output;
        this.origin = origin;
    }

    @Override
    public RunItemType getType() {
        return RunItemType.TOOL_CALL_OUTPUT;
    }
}
