package com.zzf.miniagent.agent;

import lombok.Value;

/**
 * Lifecycle state of an agent: PENDING, then RUNNING, then COMPLETED or FAILED with a reason.
 */
@Value
public class AgentStatus {

    public enum State {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    private static final AgentStatus PENDING = new AgentStatus(State.PENDING, null);
    private static final AgentStatus RUNNING = new AgentStatus(State.RUNNING, null);
    private static final AgentStatus COMPLETED = new AgentStatus(State.COMPLETED, null);

    State state;
    String reason;

    public static AgentStatus pending() {
        return PENDING;
    }

    public static AgentStatus running() {
        return RUNNING;
    }

    public static AgentStatus completed() {
        return COMPLETED;
    }

    public static AgentStatus failed(String reason) {
        return new AgentStatus(State.FAILED, reason);
    }

    public boolean isActive() {
        return state == State.PENDING || state == State.RUNNING;
    }

    public boolean isTerminal() {
        return !isActive();
    }

    @Override
    public String toString() {
        return state == State.FAILED ? "Failed(" + reason + ")" : state.name();
    }
}
