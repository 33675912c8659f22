package com.zzf.miniagent.interrupt;

import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

/**
 * Routes Ctrl+C to the interrupt channel instead of terminating the JVM.
 */
@Slf4j
public final class InterruptSignalHandler {

    private InterruptSignalHandler() {
    }

    public static boolean install(InterruptChannel channel) {
        try {
            Signal.handle(new Signal("INT"), signal -> channel.interrupt());
            return true;
        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            log.warn("interrupt.signal.unavailable err={}", e.getMessage());
            return false;
        }
    }
}
