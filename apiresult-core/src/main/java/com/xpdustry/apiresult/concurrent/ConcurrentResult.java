package com.xpdustry.apiresult.concurrent;

import com.xpdustry.apiresult.ApiResult;
import com.xpdustry.apiresult.Cancellation;
import com.xpdustry.apiresult.functional.ThrowingFunction;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;

/**
 * Binds several fallible tasks running concurrently into a single {@link ApiResult}.
 *
 * <p>The block runs on the calling thread and forks children on the executor through the {@link ResultScope}
 * it receives. The builder returns only once the block and all the children have finished, and:
 *
 * <ul>
 *   <li>fails with the first exception observed, by completion order, whether thrown by the block or by a
 *       child. A failing child does not cancel its siblings, a failing block cancels all the children;
 *   <li>rethrows a cancellation, after cancelling every child. This covers the interruption of the calling
 *       thread, and a {@link CancellationException} the scope did not ask for;
 *   <li>rethrows any {@link Error}, after cancelling every child;
 *   <li>otherwise succeeds with the value returned by the block.
 * </ul>
 */
public final class ConcurrentResult {

    private ConcurrentResult() {}

    public static <T> ApiResult<T> withConcurrentResult(
            final ThrowingFunction<? super ResultScope, ? extends T, ? extends Exception> block) {
        return withConcurrentResult(ResultExecutor.shared(), block);
    }

    public static <T> ApiResult<T> withConcurrentResult(
            final Executor executor,
            final ThrowingFunction<? super ResultScope, ? extends T, ? extends Exception> block) {
        final var scope = new ResultScopeImpl(executor);
        T value = null;
        try {
            value = block.apply(scope);
        } catch (final CancellationException e) {
            scope.abort(e);
        } catch (final Exception e) {
            if (e instanceof InterruptedException interrupted) {
                scope.abort(Cancellation.interrupted(interrupted));
            } else {
                scope.fail(e);
                scope.cancel();
            }
        } catch (final Error e) {
            scope.abort(e);
        }
        return scope.join(value);
    }
}
