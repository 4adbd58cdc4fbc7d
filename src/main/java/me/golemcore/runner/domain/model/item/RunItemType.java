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

import java.util.Arrays;
import java.util.Optional;

public enum RunItemType {
    MESSAGE_OUTPUT("message_output_item"),
    TOOL_CALL("tool_call_item"),
    TOOL_CALL_OUTPUT("tool_call_output_item"),
    HANDOFF_CALL("handoff_call_item"),
    HANDOFF_OUTPUT("handoff_output_item"),
    REASONING("reasoning_item"),
    TOOL_APPROVAL("tool_approval_item"),
    MCP_LIST_TOOLS("mcp_list_tools_item"),
    MCP_APPROVAL_REQUEST("mcp_approval_request_item"),
    MCP_APPROVAL_RESPONSE("mcp_approval_response_item");

    private final String wireName;

    RunItemType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<RunItemType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
