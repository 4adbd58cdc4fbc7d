package me.golemcore.runner.domain.state;

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
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.Usage;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a finished or paused run.
 */
@Getter
@Builder
public class RunResult {

    private final Object finalOutput;
    private final List<ProtocolItem> input;
    private final List<RunItem> newItems;
    private final List<ToolApprovalItem> interruptions;
    private final List<ModelResponse> rawResponses;
    private final Agent lastAgent;
    private final int currentTurn;
    private final RunContext context;
    private final RunState state;

    public Usage getUsage() {
        return context.getUsage();
    }

    public String getLastResponseId() {
        return rawResponses.isEmpty() ? null : rawResponses.get(rawResponses.size() - 1).getResponseId();
    }

    public boolean isInterrupted() {
        return !interruptions.isEmpty();
    }

    public <T> T finalOutputAs(Class<T> type) {
        return type.cast(finalOutput);
    }

    /**
     * Input for a follow-up run: the original input followed by every
     * generated item that can be sent to a model.
     */
    public List<ProtocolItem> toInputList() {
        List<ProtocolItem> items = new ArrayList<>(input);
        newItems.stream()
                .map(RunItem::toInputItem)
                .filter(Objects::nonNull)
                .forEach(items::add);
        return items;
    }

    /**
     * State to resume from, typically after recording approval decisions.
     */
    public RunState toState() {
        return state;
    }
}
