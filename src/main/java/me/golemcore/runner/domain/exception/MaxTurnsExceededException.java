package me.golemcore.runner.domain.exception;

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

import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.domain.state.RunState;

/**
 * The run used up its turn budget. The run can still be finished by
 * {@link #resume(String)}, which calls the model exactly once more with tool
 * use disabled and takes whatever it answers as the final output.
 */
public class MaxTurnsExceededException extends AgentRunException {

    private static final long serialVersionUID = 1L;

    private final transient RunState runState;
    private final transient Resumer resumer;

    public MaxTurnsExceededException(int maxTurns, RunState runState, Resumer resumer) {
        super(RunPhase.EXECUTE, "Max turns (" + maxTurns + ") exceeded");
        this.runState = runState;
        this.resumer = resumer;
    }

    public RunState getRunState() {
        return runState;
    }

    /**
     * Forces a final answer.
     *
     * @param extraInstruction
     *            optional instruction appended as a user message, e.g. "answer
     *            now"
     */
    public RunResult resume(String extraInstruction) {
        return resumer.resume(runState, extraInstruction);
    }

    @FunctionalInterface
    public interface Resumer {
        RunResult resume(RunState state, String extraInstruction);
    }
}
