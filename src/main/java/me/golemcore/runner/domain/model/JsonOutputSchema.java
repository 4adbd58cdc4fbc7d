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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runner.domain.exception.ModelBehaviorException;

import java.util.List;
import java.util.Map;

/**
 * Output schema backed by a Java type. The text must be a JSON object carrying
 * every field listed as required in the JSON Schema and nothing the type does
 * not declare.
 */
public class JsonOutputSchema<T> implements OutputSchema {

    private static final ObjectMapper STRICT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private final Class<T> type;
    private final Map<String, Object> jsonSchema;

    public JsonOutputSchema(Class<T> type, Map<String, Object> jsonSchema) {
        this.type = type;
        this.jsonSchema = jsonSchema;
    }

    public static <T> JsonOutputSchema<T> of(Class<T> type, Map<String, Object> jsonSchema) {
        return new JsonOutputSchema<>(type, jsonSchema);
    }

    @Override
    public String getName() {
        return type.getSimpleName();
    }

    @Override
    public boolean isPlainText() {
        return false;
    }

    @Override
    public Map<String, Object> getJsonSchema() {
        return jsonSchema;
    }

    @Override
    public T validate(String json) {
        try {
            JsonNode tree = STRICT_MAPPER.readTree(json);
            if (tree == null || !tree.isObject()) {
                throw new ModelBehaviorException("Expected a JSON object for " + getName() + ", got: " + json);
            }
            for (String field : requiredFields()) {
                if (!tree.has(field)) {
                    throw new ModelBehaviorException(
                            "Invalid JSON for " + getName() + ": missing required field '" + field + "'");
                }
            }
            return STRICT_MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new ModelBehaviorException("Invalid JSON when parsing " + json + " for " + getName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private List<String> requiredFields() {
        Object required = jsonSchema != null ? jsonSchema.get("required") : null;
        return required instanceof List<?> list ? (List<String>) list : List.of();
    }
}
