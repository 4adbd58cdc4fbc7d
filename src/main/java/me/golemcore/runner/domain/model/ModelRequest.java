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
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.List;

/**
 * Everything a model provider needs for one call. When a conversation id or a
 * previous response id is set, {@code input} holds only the items the provider
 * has not seen yet.
 */
@Data
@Builder
public class ModelRequest {

    private String agentName;
    private String model;
    private String systemInstructions;
    private List<ProtocolItem> input;
    private List<ToolDefinition> tools;
    private List<ToolDefinition> handoffs;
    private OutputSchema outputSchema;
    private String toolChoice;
    private String conversationId;
    private String previousResponseId;

    public boolean hasTools() {
        return (tools != null && !tools.isEmpty()) || (handoffs != null && !handoffs.isEmpty());
    }
}
