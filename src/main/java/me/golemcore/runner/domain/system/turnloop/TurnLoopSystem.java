package me.golemcore.runner.domain.system.turnloop;

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

import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.RunConfig;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.domain.state.RunResult;
import me.golemcore.runner.domain.state.RunState;

import java.util.List;

/**
 * Drives a run: model call, decode, execute, repeat until final output, an
 * interruption or a failure.
 */
public interface TurnLoopSystem {

    RunResult run(Agent agent, List<ProtocolItem> input, RunConfig config);

    /**
     * Continues a run from a saved state, typically one paused for approvals.
     * The turn counter continues from the stored value.
     */
    RunResult resume(RunState state, RunConfig config);
}
