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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.runner.domain.model.item.ToolApprovalItem;

/**
 * Mutable context of one run: the caller's payload, accumulated usage and the
 * approval ledger. Owned by a single run, never shared.
 */
@Getter
public class RunContext {

    @Setter
    private Object payload;
    private final Usage usage;
    private final ApprovalLedger approvals;

    public RunContext(Object payload) {
        this(payload, new Usage(), new ApprovalLedger());
    }

    public RunContext(Object payload, Usage usage, ApprovalLedger approvals) {
        this.payload = payload;
        this.usage = usage;
        this.approvals = approvals;
    }

    public ApprovalStatus getApprovalStatus(String toolName, String callId) {
        return approvals.getStatus(toolName, callId);
    }

    public void approveTool(ToolApprovalItem item, boolean always) {
        approvals.approve(item.getToolName(), item.callId(), always);
    }

    public void rejectTool(ToolApprovalItem item, boolean always) {
        approvals.reject(item.getToolName(), item.callId(), always);
    }
}
