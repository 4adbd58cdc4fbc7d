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

import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one turn: the items recorded before and during the turn and the
 * decision on what happens next.
 */
public record SingleStepResult(List<ProtocolItem> originalInput, ModelResponse modelResponse,
        List<RunItem> preStepItems, List<RunItem> newStepItems, NextStep nextStep,
        ProcessedResponse processedResponse) {

    public List<RunItem> generatedItems() {
        List<RunItem> all = new ArrayList<>(preStepItems);
        all.addAll(newStepItems);
        return all;
    }
}
