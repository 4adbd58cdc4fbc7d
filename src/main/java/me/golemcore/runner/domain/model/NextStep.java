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

import me.golemcore.runner.domain.model.item.ToolApprovalItem;

import java.util.List;

/**
 * Decision taken at the end of a turn.
 */
public interface NextStep {

    /**
     * Call the model again with the same agent.
     */
    record RunAgain() implements NextStep {
    }

    /**
     * The run is done.
     */
    record FinalOutput(Object output) implements NextStep {
    }

    /**
     * The run is paused until every listed call has an approval decision.
     */
    record Interruption(List<ToolApprovalItem> interruptions) implements NextStep {
    }

    /**
     * Control moves to another agent; the run continues.
     */
    record Handoff(Agent newAgent) implements NextStep {
    }
}
