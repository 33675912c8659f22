package com.zzf.miniagent.directive;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a parallel batch.
 */
@Value
@Builder
public class SubTaskSpec {
    public static final String DEFAULT_KIND = "dynamic";
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    String task;
    @Builder.Default
    String agentKind = DEFAULT_KIND;
    @Builder.Default
    int maxIterations = DEFAULT_MAX_ITERATIONS;
}
