package com.xpdustry.apiresult.concurrent;

import com.xpdustry.apiresult.ApiResult;

/**
 * A child task forked in a {@link ResultScope}.
 */
public interface Deferred<T> {

    /**
     * Blocks until the child finishes and returns its own outcome. A failed child yields a failed result here,
     * independently of the outcome of the whole scope.
     *
     * @throws java.util.concurrent.CancellationException if the child was cancelled, or the waiting thread
     *     was interrupted
     */
    ApiResult<T> await();

    boolean isDone();

    /**
     * Interrupts the child if it is running, or prevents it from starting. Cancelling a child does not cancel
     * the scope.
     */
    void cancel();
}
