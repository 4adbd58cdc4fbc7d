package me.golemcore.runner.domain.component;

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

import lombok.Builder;
import lombok.Getter;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.protocol.McpApprovalRequest;

import java.util.concurrent.CompletableFuture;

/**
 * MCP server hosted by the model provider. The provider asks for approval
 * before running one of the server's tools; the answer comes from
 * {@code approvalCallback} when one is registered.
 */
@Getter
@Builder
public class HostedMcpTool implements Component {

    private final String serverLabel;
    private final ApprovalCallback approvalCallback;
    @Builder.Default
    private final boolean enabled = true;

    @Override
    public String getComponentType() {
        return "hosted_mcp";
    }

    public boolean hasApprovalCallback() {
        return approvalCallback != null;
    }

    @FunctionalInterface
    public interface ApprovalCallback {
        CompletableFuture<McpApprovalDecision> onApprovalRequest(RunContext context, McpApprovalRequest request);
    }
}
