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

import java.util.Map;

/**
 * Declared shape of an agent's final output.
 */
public interface OutputSchema {

    String getName();

    /**
     * Plain-text schemas accept any text as final output.
     */
    boolean isPlainText();

    /**
     * JSON Schema advertised to the model.
     */
    Map<String, Object> getJsonSchema();

    /**
     * Validates model-produced JSON text and returns the typed value.
     *
     * @throws me.golemcore.runner.domain.exception.ModelBehaviorException
     *             if the text does not conform
     */
    Object validate(String json);
}
