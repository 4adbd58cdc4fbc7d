package me.golemcore.runner.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties of the agent runner, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code runner.*} prefix:
 * <ul>
 * <li>{@link TurnProperties} - turn budget of a run</li>
 * <li>{@link ToolsProperties} - tool executor pool and output limits</li>
 * <li>{@link ConversationProperties} - server-managed conversations</li>
 * <li>{@link SessionProperties} - client-side session history</li>
 * <li>{@link ApprovalsProperties} - approval defaults</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "runner")
@Data
public class RunnerProperties {

    private TurnProperties turn = new TurnProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private SessionProperties session = new SessionProperties();
    private ApprovalsProperties approvals = new ApprovalsProperties();

    @Data
    public static class TurnProperties {
        /**
         * Model calls allowed per run when the run config does not set its own
         * limit.
         */
        private int maxTurns = 10;
    }

    @Data
    public static class ToolsProperties {
        private int executorThreads = 16;

        /**
         * Tool outputs longer than this are cut before they reach the model.
         */
        private int maxToolResultChars = 100000;
    }

    @Data
    public static class ConversationProperties {
        /**
         * Retry a model call once when the provider reports the conversation
         * as locked.
         */
        private boolean retryOnLock = true;
    }

    @Data
    public static class SessionProperties {
        // 0 loads the whole history
        private int historyLimit = 0;
    }

    @Data
    public static class ApprovalsProperties {
        /**
         * Approve hosted MCP requests whose server has no approval callback.
         * When false, such requests pause the run like any gated tool call.
         */
        private boolean autoApproveHostedWithoutCallback = true;
    }
}
