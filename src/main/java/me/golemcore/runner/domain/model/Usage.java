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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulated model usage of a run. Counters only grow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Usage {

    private int requests;
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    // Provider-specific breakdowns, e.g. cached_tokens or reasoning_tokens
    @Builder.Default
    private Map<String, Integer> inputTokensDetails = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Integer> outputTokensDetails = new LinkedHashMap<>();

    /**
     * Creates a usage record for one request with token counts.
     */
    public static Usage of(int inputTokens, int outputTokens) {
        return Usage.builder()
                .requests(1)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }

    public synchronized void add(Usage other) {
        if (other == null) {
            return;
        }
        requests += other.requests;
        addTokens(other);
    }

    /**
     * Adds token counts without counting a request.
     */
    public synchronized void addTokens(Usage other) {
        if (other == null) {
            return;
        }
        inputTokens += other.inputTokens;
        outputTokens += other.outputTokens;
        totalTokens += other.totalTokens;
        mergeDetails(inputTokensDetails, other.inputTokensDetails);
        mergeDetails(outputTokensDetails, other.outputTokensDetails);
    }

    public synchronized void countRequest() {
        requests++;
    }

    public synchronized Usage copy() {
        return Usage.builder()
                .requests(requests)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(totalTokens)
                .inputTokensDetails(new LinkedHashMap<>(inputTokensDetails))
                .outputTokensDetails(new LinkedHashMap<>(outputTokensDetails))
                .build();
    }

    private static void mergeDetails(Map<String, Integer> target, Map<String, Integer> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> target.merge(key, value != null ? value : 0, Integer::sum));
    }
}
