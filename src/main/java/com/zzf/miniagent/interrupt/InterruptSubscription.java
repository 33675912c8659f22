package com.zzf.miniagent.interrupt;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * A view of the {@link InterruptChannel} pinned to the generation seen at subscribe time.
 * Any later bump counts as an interrupt, including one that happened before a wait began.
 */
public final class InterruptSubscription {

    private final InterruptChannel channel;
    private final long seen;

    InterruptSubscription(InterruptChannel channel, long seen) {
        this.channel = channel;
        this.seen = seen;
    }

    public long seenGeneration() {
        return seen;
    }

    public boolean isInterrupted() {
        return channel.current() != seen;
    }

    /**
     * Future that completes when this subscription is interrupted.
     */
    public CompletableFuture<Long> changed() {
        return channel.awaitChange(seen);
    }

    /**
     * Drops a waiter obtained from {@link #changed()} that is no longer needed.
     */
    public void release(CompletableFuture<Long> waiter) {
        channel.release(waiter);
    }

    /**
     * Waits for {@code operation} or an interrupt, whichever comes first. The losing operation
     * is abandoned, not stopped. When both are done the interrupt wins.
     *
     * @throws CancellationException if the generation changed
     * @throws java.util.concurrent.CompletionException if the operation failed
     */
    public <T> T race(CompletableFuture<T> operation) {
        CompletableFuture<Long> interrupted = channel.awaitChange(seen);
        try {
            CompletableFuture.anyOf(operation.handle((value, error) -> null), interrupted).join();
        } finally {
            channel.release(interrupted);
        }
        if (interrupted.isDone()) {
            throw new CancellationException("cancelled by user");
        }
        return operation.join();
    }

    /**
     * Subscription for a child task that must also observe interrupts the parent has not yet seen.
     */
    public InterruptSubscription fork() {
        return new InterruptSubscription(channel, seen);
    }
}
