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
import me.golemcore.runner.domain.model.ToolContext;
import me.golemcore.runner.domain.model.protocol.HostedToolCall;
import me.golemcore.runner.domain.model.protocol.HostedToolKind;

import java.util.Locale;

/**
 * Local executor for a hosted capability (remote shell, patch application,
 * computer use, local shell). The model can only emit a call of a given kind
 * when the agent carries the matching component.
 */
@Getter
@Builder
public class HostedToolComponent implements Component {

    private final HostedToolKind kind;
    private final String name;
    private final Executor executor;
    private final ApprovalPolicy approvalPolicy;
    @Builder.Default
    private final boolean enabled = true;

    @Override
    public String getComponentType() {
        return "hosted_tool";
    }

    public String getName() {
        return name != null ? name : kind.name().toLowerCase(Locale.ROOT);
    }

    public boolean needsApproval(ToolContext context, HostedToolCall call) {
        return approvalPolicy != null && approvalPolicy.needsApproval(context, call);
    }

    /**
     * Runs the call and returns the output text sent back to the model.
     */
    @FunctionalInterface
    public interface Executor {
        String execute(ToolContext context, HostedToolCall call) throws Exception;
    }

    @FunctionalInterface
    public interface ApprovalPolicy {
        boolean needsApproval(ToolContext context, HostedToolCall call);
    }
}
