package com.zzf.miniagent.interrupt;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process wide interrupt broadcast. Every {@link #interrupt()} bumps a generation counter;
 * waiters registered through {@link #awaitChange(long)} complete with the new value.
 */
@Slf4j
public class InterruptChannel {

    private final AtomicLong generation = new AtomicLong();
    private final List<CompletableFuture<Long>> waiters = new ArrayList<>();

    public long current() {
        return generation.get();
    }

    public void interrupt() {
        List<CompletableFuture<Long>> toWake;
        long value;
        synchronized (waiters) {
            value = generation.incrementAndGet();
            toWake = new ArrayList<>(waiters);
            waiters.clear();
        }
        log.info("interrupt.fired generation={} waiters={}", value, toWake.size());
        for (CompletableFuture<Long> waiter : toWake) {
            waiter.complete(value);
        }
    }

    public InterruptSubscription subscribe() {
        return new InterruptSubscription(this, current());
    }

    /**
     * Completes once the generation differs from {@code seen}; already complete if it does now.
     */
    public CompletableFuture<Long> awaitChange(long seen) {
        synchronized (waiters) {
            long now = generation.get();
            if (now != seen) {
                return CompletableFuture.completedFuture(now);
            }
            CompletableFuture<Long> waiter = new CompletableFuture<>();
            waiters.add(waiter);
            return waiter;
        }
    }

    void release(CompletableFuture<Long> waiter) {
        synchronized (waiters) {
            waiters.remove(waiter);
        }
    }

    int pendingWaiters() {
        synchronized (waiters) {
            return waiters.size();
        }
    }
}
