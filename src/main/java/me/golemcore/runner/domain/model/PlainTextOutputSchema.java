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

public final class PlainTextOutputSchema implements OutputSchema {

    public static final PlainTextOutputSchema INSTANCE = new PlainTextOutputSchema();

    private PlainTextOutputSchema() {
    }

    @Override
    public String getName() {
        return "str";
    }

    @Override
    public boolean isPlainText() {
        return true;
    }

    @Override
    public Map<String, Object> getJsonSchema() {
        return Map.of("type", "string");
    }

    @Override
    public String validate(String text) {
        return text;
    }
}
