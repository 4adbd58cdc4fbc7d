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
import me.golemcore.runner.domain.component.HostedMcpTool;
import me.golemcore.runner.domain.component.HostedToolComponent;
import me.golemcore.runner.domain.component.ToolComponent;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.protocol.FunctionCall;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Classified content of one model response. Produced by the response decoder,
 * consumed by the tool coordinator, and kept on the run state so that a paused
 * turn can be resumed exactly.
 */
@Getter
@Builder
public class ProcessedResponse {

    @Builder.Default
    private final List<RunItem> newItems = new ArrayList<>();
    @Builder.Default
    private final List<HandoffRun> handoffs = new ArrayList<>();
    @Builder.Default
    private final List<FunctionRun> functions = new ArrayList<>();
    @Builder.Default
    private final List<HostedRun> hostedCalls = new ArrayList<>();
    @Builder.Default
    private final List<McpApprovalRun> mcpApprovalRequests = new ArrayList<>();
    @Builder.Default
    private final List<String> toolsUsed = new ArrayList<>();
    @Builder.Default
    private final List<ToolApprovalItem> interruptions = new ArrayList<>();

    public boolean hasToolsOrApprovalsToRun() {
        return !handoffs.isEmpty() || !functions.isEmpty() || !hostedCalls.isEmpty()
                || !mcpApprovalRequests.isEmpty();
    }

    public boolean hasInterruptions() {
        return !interruptions.isEmpty();
    }

    public record FunctionRun(FunctionCall toolCall, ToolComponent tool) {
    }

    public record HandoffRun(FunctionCall toolCall, Handoff handoff) {
    }

    public record HostedRun(HostedToolCall toolCall, HostedToolComponent tool) {
    }

    public record McpApprovalRun(McpApprovalRequest request, HostedMcpTool tool) {
    }
}
