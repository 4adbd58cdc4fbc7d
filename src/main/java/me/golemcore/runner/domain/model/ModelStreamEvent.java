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
 * Incremental event of a streamed model call. A stream ends with exactly one
 * completed event carrying the full {@link ModelResponse}.
 */
public record ModelStreamEvent(String type, Object data, ModelResponse response) {

    public static final String COMPLETED = "response.completed";

    public static ModelStreamEvent delta(String type, Object data) {
        return new ModelStreamEvent(type, data, null);
    }

    public static ModelStreamEvent completed(ModelResponse response) {
        return new ModelStreamEvent(COMPLETED, null, response);
    }

    public boolean isCompleted() {
        return response != null;
    }
}
