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
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Record of approve/reject decisions for approval-gated tool calls, keyed by
 * tool name. Each tool has tool-wide "always" flags and per-call-id decision
 * lists. Tool-wide flags are consulted before per-call decisions.
 *
 * <p>
 * This ledger is the only input the tool coordinator trusts when deciding
 * whether a gated call may run.
 */
@Slf4j
public class ApprovalLedger {

    private final Map<String, ToolApprovals> approvals = new LinkedHashMap<>();

    public synchronized ApprovalStatus getStatus(String toolName, String callId) {
        ToolApprovals entry = approvals.get(toolName);
        if (entry == null) {
            return ApprovalStatus.UNKNOWN;
        }
        if (entry.isAlwaysApproved() && entry.isAlwaysRejected()) {
            log.warn("[Approvals] Tool {} is both always approved and always rejected, approval wins", toolName);
            return ApprovalStatus.APPROVED;
        }
        if (entry.isAlwaysApproved()) {
            return ApprovalStatus.APPROVED;
        }
        if (entry.isAlwaysRejected()) {
            return ApprovalStatus.REJECTED;
        }
        boolean approved = callId != null && entry.getApprovedCallIds().contains(callId);
        boolean rejected = callId != null && entry.getRejectedCallIds().contains(callId);
        if (approved && rejected) {
            log.warn("[Approvals] Call {} of tool {} is both approved and rejected, approval wins", callId, toolName);
            return ApprovalStatus.APPROVED;
        }
        if (approved) {
            return ApprovalStatus.APPROVED;
        }
        return rejected ? ApprovalStatus.REJECTED : ApprovalStatus.UNKNOWN;
    }

    public synchronized void approve(String toolName, String callId, boolean always) {
        ToolApprovals entry = approvals.computeIfAbsent(toolName, name -> new ToolApprovals());
        if (always) {
            entry.setAlwaysApproved(true);
            entry.setAlwaysRejected(false);
            entry.getRejectedCallIds().clear();
            return;
        }
        entry.getRejectedCallIds().remove(callId);
        entry.getApprovedCallIds().add(callId);
        log.debug("[Approvals] Approved call {} of tool {}", callId, toolName);
    }

    public synchronized void reject(String toolName, String callId, boolean always) {
        ToolApprovals entry = approvals.computeIfAbsent(toolName, name -> new ToolApprovals());
        if (always) {
            entry.setAlwaysRejected(true);
            entry.setAlwaysApproved(false);
            entry.getApprovedCallIds().clear();
            return;
        }
        entry.getApprovedCallIds().remove(callId);
        entry.getRejectedCallIds().add(callId);
        log.debug("[Approvals] Rejected call {} of tool {}", callId, toolName);
    }

    /**
     * Returns a deep copy of the ledger contents, keyed by tool name.
     */
    public synchronized Map<String, ToolApprovals> snapshot() {
        Map<String, ToolApprovals> copy = new LinkedHashMap<>();
        approvals.forEach((name, entry) -> copy.put(name, entry.copy()));
        return Collections.unmodifiableMap(copy);
    }

    public synchronized void restore(Map<String, ToolApprovals> entries) {
        approvals.clear();
        if (entries != null) {
            entries.forEach((name, entry) -> approvals.put(name, entry.copy()));
        }
    }

    /**
     * Decisions recorded for one tool.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolApprovals {
        private boolean alwaysApproved;
        private boolean alwaysRejected;
        private Set<String> approvedCallIds = new LinkedHashSet<>();
        private Set<String> rejectedCallIds = new LinkedHashSet<>();

        ToolApprovals copy() {
            return new ToolApprovals(alwaysApproved, alwaysRejected,
                    new LinkedHashSet<>(approvedCallIds != null ? approvedCallIds : Set.of()),
                    new LinkedHashSet<>(rejectedCallIds != null ? rejectedCallIds : Set.of()));
        }
    }
}
