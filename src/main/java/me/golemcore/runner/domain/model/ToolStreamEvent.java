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

/**
 * Event of a streaming tool: either an incremental delta or the final result.
 * A tool stream must end with exactly one final result.
 */
public record ToolStreamEvent(Object delta, ToolResult finalResult) {

    public static ToolStreamEvent delta(Object delta) {
        return new ToolStreamEvent(delta, null);
    }

    public static ToolStreamEvent finalResult(ToolResult result) {
        return new ToolStreamEvent(null, result);
    }

    public boolean isFinal() {
        return finalResult != null;
    }
}
