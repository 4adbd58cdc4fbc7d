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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a tool comes from: a plain function, a tool exposed by a remote
 * protocol server, or another agent exposed as a tool.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolOrigin(Type type, String serverName, String agentName) {

    private static final ToolOrigin FUNCTION = new ToolOrigin(Type.FUNCTION, null, null);

    public static ToolOrigin function() {
        return FUNCTION;
    }

    public static ToolOrigin protocolTool(String serverName) {
        return new ToolOrigin(Type.PROTOCOL_TOOL, serverName, null);
    }

    public static ToolOrigin agentAsTool(String agentName) {
        return new ToolOrigin(Type.AGENT_AS_TOOL, null, agentName);
    }

    public enum Type {
        FUNCTION("function"), PROTOCOL_TOOL("protocol_tool"), AGENT_AS_TOOL("agent_as_tool");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Type fromWireName(String value) {
            for (Type type : values()) {
                if (type.wireName.equals(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown tool origin: " + value);
        }
    }
}
