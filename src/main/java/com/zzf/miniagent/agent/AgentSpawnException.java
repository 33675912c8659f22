package com.zzf.miniagent.agent;

public class AgentSpawnException extends AgentException {

    public AgentSpawnException(String message) {
        super(message);
    }

    public AgentSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
