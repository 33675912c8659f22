package com.zzf.miniagent.agent;

/**
 * The user interrupted the run. Not an agent malfunction.
 */
public class AgentCancelledException extends AgentException {

    public AgentCancelledException(String message) {
        super(message);
    }
}
