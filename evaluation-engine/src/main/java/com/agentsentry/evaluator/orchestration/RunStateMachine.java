package com.agentsentry.evaluator.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guards run state transitions.
 *
 * <pre>
 * INIT -&gt; PROFILING -&gt; ROUND_ACTIVE (repeats) -&gt; FINALIZING -&gt; DONE
 *                  \-&gt; ABORTED
 * PROFILING | ROUND_ACTIVE -&gt; TERMINATING_EARLY -&gt; TERMINATED_EARLY
 * </pre>
 *
 * @author Naveed Gung
 */
public class RunStateMachine {

    private static final Logger log = LoggerFactory.getLogger(RunStateMachine.class);

    private static final Map<RunState, Set<RunState>> TRANSITIONS = new EnumMap<>(RunState.class);

    static {
        TRANSITIONS.put(RunState.INIT, EnumSet.of(RunState.PROFILING, RunState.TERMINATING_EARLY));
        TRANSITIONS.put(RunState.PROFILING,
                EnumSet.of(RunState.ROUND_ACTIVE, RunState.ABORTED, RunState.TERMINATING_EARLY));
        TRANSITIONS.put(RunState.ROUND_ACTIVE,
                EnumSet.of(RunState.ROUND_ACTIVE, RunState.FINALIZING, RunState.TERMINATING_EARLY));
        TRANSITIONS.put(RunState.FINALIZING, EnumSet.of(RunState.DONE));
        TRANSITIONS.put(RunState.TERMINATING_EARLY, EnumSet.of(RunState.TERMINATED_EARLY));
        TRANSITIONS.put(RunState.DONE, EnumSet.noneOf(RunState.class));
        TRANSITIONS.put(RunState.TERMINATED_EARLY, EnumSet.noneOf(RunState.class));
        TRANSITIONS.put(RunState.ABORTED, EnumSet.noneOf(RunState.class));
    }

    private final String runId;
    private final List<RunState> history = new ArrayList<>();
    private RunState state = RunState.INIT;

    public RunStateMachine(String runId) {
        this.runId = runId;
        history.add(state);
    }

    /**
     * Move to the next state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transition(RunState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Run " + runId + ": illegal transition " + state + " -> " + next);
        }
        if (state != next) {
            log.info("Run {}: {} -> {}", runId, state, next);
        }
        state = next;
        history.add(next);
    }

    public synchronized RunState current() {
        return state;
    }

    public synchronized List<RunState> history() {
        return List.copyOf(history);
    }
}
