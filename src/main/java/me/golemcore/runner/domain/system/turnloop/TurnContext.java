package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.HandoffInputFilter;
import me.golemcore.runner.domain.model.RunContext;
import me.golemcore.runner.domain.model.RunHooks;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-turn collaborators handed down into decode and execute, in place of any
 * process-wide lookup keyed by call or response id.
 */
record TurnContext(Agent agent, RunContext context, List<RunHooks> hooks, RunEventEmitter emitter,
        HandoffInputFilter runInputFilter) {

    static TurnContext of(Agent agent, RunContext context, RunHooks runHooks, RunEventEmitter emitter,
            HandoffInputFilter runInputFilter) {
        List<RunHooks> hooks = new ArrayList<>();
        hooks.add(runHooks != null ? runHooks : RunHooks.NOOP);
        if (agent.getHooks() != null) {
            hooks.add(agent.getHooks());
        }
        return new TurnContext(agent, context, List.copyOf(hooks), emitter, runInputFilter);
    }
}
