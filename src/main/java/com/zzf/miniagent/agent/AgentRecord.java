package com.zzf.miniagent.agent;

import com.zzf.miniagent.context.ConversationStore;
import lombok.Getter;

/**
 * One agent: its task, its own conversation and its lifecycle. Status, result and iteration
 * are only touched under the record's monitor so a racing cancel and a racing completion
 * never interleave.
 */
public class AgentRecord {

    @Getter
    private final String id;
    @Getter
    private final String task;
    @Getter
    private final String agentKind;
    @Getter
    private final ConversationStore conversation;
    @Getter
    private final int maxIterations;

    private AgentStatus status = AgentStatus.pending();
    private String result;
    private int iteration;

    public AgentRecord(String id, String task, String agentKind, ConversationStore conversation, int maxIterations) {
        this.id = id;
        this.task = task;
        this.agentKind = agentKind;
        this.conversation = conversation;
        this.maxIterations = maxIterations;
    }

    public synchronized AgentStatus getStatus() {
        return status;
    }

    public synchronized String getResult() {
        return result;
    }

    public synchronized int getIteration() {
        return iteration;
    }

    /**
     * @return true if this call moved the record out of PENDING
     */
    public synchronized boolean markRunning() {
        if (status.getState() != AgentStatus.State.PENDING) {
            return false;
        }
        status = AgentStatus.running();
        return true;
    }

    public synchronized int nextIteration() {
        return ++iteration;
    }

    /**
     * @return false if the record was already cancelled or finished
     */
    public synchronized boolean complete(String answer) {
        if (status.getState() != AgentStatus.State.RUNNING) {
            return false;
        }
        status = AgentStatus.completed();
        result = answer;
        return true;
    }

    public synchronized boolean fail(String reason) {
        if (!status.isActive()) {
            return false;
        }
        status = AgentStatus.failed(reason);
        return true;
    }

    /**
     * Fails an active record and drops any partial result. No-op once terminal.
     */
    public synchronized boolean cancel(String reason) {
        if (!status.isActive()) {
            return false;
        }
        status = AgentStatus.failed(reason);
        result = null;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "AgentRecord{id=" + id + ", kind=" + agentKind + ", status=" + status
                + ", iteration=" + iteration + "/" + maxIterations + "}";
    }
}
