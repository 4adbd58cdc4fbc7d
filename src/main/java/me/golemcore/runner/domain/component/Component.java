package me.golemcore.runner.domain.component;

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
 * Base interface for everything an agent can be equipped with: function tools,
 * hosted tools and hosted MCP servers. Each component type extends this
 * interface while keeping a common lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier for this component.
     *
     * @return the component type (e.g., "tool", "hosted_tool", "hosted_mcp")
     */
    String getComponentType();

    /**
     * Initializes the component. Default implementation does nothing.
     */
    default void initialize() {
        // Default no-op
    }

    /**
     * Releases component resources. Default implementation does nothing.
     */
    default void destroy() {
        // Default no-op
    }

    /**
     * Checks whether this component is currently available. Disabled components
     * are neither advertised to the model nor routable by the decoder.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
