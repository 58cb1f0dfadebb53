package com.xpdustry.apiresult.concurrent;

import java.util.concurrent.Callable;

/**
 * The scope handed to the block of {@link ConcurrentResult#withConcurrentResult}. Every task forked in it,
 * directly or from another child, is joined before the builder returns.
 */
public interface ResultScope {

    <T> Deferred<T> fork(final Callable<? extends T> task);

    default Deferred<Void> launch(final Runnable task) {
        return this.fork(() -> {
            task.run();
            return null;
        });
    }

    /**
     * Whether the scope is tearing down its children, after a failure of the block or a cancellation.
     * Long-running children may poll this to stop early.
     */
    boolean isCancelled();
}
