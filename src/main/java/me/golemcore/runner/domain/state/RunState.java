package me.golemcore.runner.domain.state;

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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.runner.domain.exception.UserErrorException;
import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.NextStep;
import me.golemcore.runner.domain.model.ProcessedResponse;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Resumable snapshot of a run: where it is, what it produced so far, and what
 * it is waiting for. Mutated only by the turn loop at turn boundaries. A state
 * paused on an interruption is resumed by recording decisions with
 * {@link #approve} / {@link #reject} and passing it back to the runner.
 */
@Getter
@Setter
public class RunState {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    private Agent currentAgent;
    private List<ProtocolItem> originalInput;
    private int maxTurns;
    private int currentTurn;
    private List<ModelResponse> modelResponses = new ArrayList<>();
    private List<RunItem> generatedItems = new ArrayList<>();
    private ProcessedResponse lastProcessedResponse;
    private NextStep currentStep;
    private RunContext context;
    private String conversationId;
    private String previousResponseId;
    private boolean autoPreviousResponseId;

    public RunState(Agent currentAgent, List<ProtocolItem> originalInput, RunContext context, int maxTurns) {
        this.currentAgent = currentAgent;
        this.originalInput = new ArrayList<>(originalInput);
        this.context = context;
        this.maxTurns = maxTurns;
    }

    public void approve(ToolApprovalItem item) {
        approve(item, false);
    }

    /**
     * Approves the call, or every call of the tool when {@code always} is set.
     */
    public void approve(ToolApprovalItem item, boolean always) {
        requireContext().approveTool(item, always);
    }

    public void reject(ToolApprovalItem item) {
        reject(item, false);
    }

    public void reject(ToolApprovalItem item, boolean always) {
        requireContext().rejectTool(item, always);
    }

    /**
     * Calls waiting for a decision, empty unless the run is paused.
     */
    public List<ToolApprovalItem> getInterruptions() {
        if (currentStep instanceof NextStep.Interruption interruption) {
            return interruption.interruptions();
        }
        return List.of();
    }

    public boolean isInterrupted() {
        return currentStep instanceof NextStep.Interruption;
    }

    public ModelResponse getLastModelResponse() {
        return modelResponses.isEmpty() ? null : modelResponses.get(modelResponses.size() - 1);
    }

    public String toDocument() {
        return RunStateSerializer.shared().toDocument(this);
    }

    public static RunState fromDocument(String document, Agent rootAgent) {
        return RunStateSerializer.shared().fromDocument(document, rootAgent);
    }

    /**
     * Loads a snapshot with a caller-provided context in place of the
     * serialized one.
     */
    public static RunState fromDocument(String document, Agent rootAgent, RunContext contextOverride) {
        return RunStateSerializer.shared().fromDocument(document, rootAgent, contextOverride);
    }

    private RunContext requireContext() {
        if (context == null) {
            throw new UserErrorException("Cannot record an approval decision: run state has no context");
        }
        return context;
    }
}
