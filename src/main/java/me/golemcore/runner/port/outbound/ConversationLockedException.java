package me.golemcore.runner.port.outbound;

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

import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.RunPhase;

/**
 * Thrown by a {@link ModelPort} when a server-managed conversation is
 * temporarily locked by another request. The call may be retried.
 */
public class ConversationLockedException extends AgentRunException {

    private static final long serialVersionUID = 1L;

    public ConversationLockedException(String conversationId) {
        super(RunPhase.MODEL, "Conversation " + conversationId + " is locked");
    }
}
