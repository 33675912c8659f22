package com.zzf.miniagent.agent;

public class MaxIterationsException extends AgentException {

    public MaxIterationsException(int maxIterations) {
        super("max iterations reached (" + maxIterations + ")");
    }
}
