package me.golemcore.runner.domain.guardrail;

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

/**
 * Verdict of a tool guardrail.
 */
public record GuardrailOutcome(Behavior behavior, String modelMessage) {

    private static final GuardrailOutcome ALLOW = new GuardrailOutcome(Behavior.ALLOW, null);

    public static GuardrailOutcome allow() {
        return ALLOW;
    }

    /**
     * Blocks the call and records {@code message} as the tool output.
     */
    public static GuardrailOutcome rejectContent(String message) {
        return new GuardrailOutcome(Behavior.REJECT_CONTENT, message);
    }

    /**
     * Aborts the whole run.
     */
    public static GuardrailOutcome raiseException(String message) {
        return new GuardrailOutcome(Behavior.RAISE_EXCEPTION, message);
    }

    public boolean isBlocked() {
        return behavior != Behavior.ALLOW;
    }

    public enum Behavior {
        ALLOW, REJECT_CONTENT, RAISE_EXCEPTION
    }
}
