package com.zzf.miniagent.agent;

import com.zzf.miniagent.directive.SubTaskSpec;
import com.zzf.miniagent.interrupt.InterruptSubscription;

import java.util.List;

/**
 * Runs a batch of sub-agents and returns one labeled line per spec, in completion order.
 */
@FunctionalInterface
public interface ParallelTaskRunner {

    List<String> runParallel(List<SubTaskSpec> batch, InterruptSubscription interrupt);
}
