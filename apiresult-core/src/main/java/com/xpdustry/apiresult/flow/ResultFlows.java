package com.xpdustry.apiresult.flow;

import com.google.common.util.concurrent.MoreExecutors;
import com.xpdustry.apiresult.ApiResult;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Bridges between {@link Flow.Publisher}s and {@link ApiResult}. Every publisher returned here emits
 * {@link ApiResult.Loading} first, so subscribers can render a pending state before any terminal result.
 */
public final class ResultFlows {

    private ResultFlows() {}

    /**
     * Adapts a stream of values: Loading first, then a success per item. A recoverable error of the upstream
     * is emitted as a final failure and the stream completes. Cancellations are signalled as errors, without
     * any failure item.
     */
    public static <T> Flow.Publisher<ApiResult<T>> asResult(final Flow.Publisher<? extends T> publisher) {
        return new LoadingFirstPublisher<>(publisher);
    }

    public static <T> Flow.Publisher<ApiResult<T>> flow(final Callable<? extends ApiResult<T>> call) {
        return flow(MoreExecutors.directExecutor(), call);
    }

    /**
     * Emits Loading, then the result of the call, which runs on the executor when the subscriber first
     * requests items. Exceptions thrown by the call are emitted as a failure.
     */
    public static <T> Flow.Publisher<ApiResult<T>> flow(
            final Executor executor, final Callable<? extends ApiResult<T>> call) {
        return new CallablePublisher<>(call, executor);
    }

    public static <T> Flow.Publisher<ApiResult<T>> tryFlow(final Callable<? extends T> call) {
        return tryFlow(MoreExecutors.directExecutor(), call);
    }

    /**
     * Like {@link #flow(Executor, Callable)}, for a call that returns a plain value.
     */
    public static <T> Flow.Publisher<ApiResult<T>> tryFlow(final Executor executor, final Callable<? extends T> call) {
        return new CallablePublisher<T>(() -> ApiResult.ofCallable(call), executor);
    }

    public static <T, R> Flow.Publisher<ApiResult<R>> mapResults(
            final Flow.Publisher<? extends ApiResult<T>> publisher, final Function<? super T, ? extends R> function) {
        return new TransformingPublisher<ApiResult<T>, ApiResult<R>>(publisher, result -> result.<R>map(function));
    }

    public static <T> Flow.Publisher<ApiResult<T>> onEachSuccess(
            final Flow.Publisher<? extends ApiResult<T>> publisher, final Consumer<? super T> consumer) {
        return new TransformingPublisher<ApiResult<T>, ApiResult<T>>(publisher, result -> result.onSuccess(consumer));
    }

    /**
     * Unwraps the success values. Loading items and {@code null} values are skipped, a failure terminates the
     * stream with its error.
     */
    public static <T> Flow.Publisher<T> values(final Flow.Publisher<? extends ApiResult<T>> publisher) {
        return new TransformingPublisher<ApiResult<T>, T>(
                publisher, result -> result.isLoading() ? null : result.orThrow());
    }

    /**
     * Maps every item to its value. The first failure terminates the stream with its error, and so does a
     * Loading item, as a {@link com.xpdustry.apiresult.NotFinishedException}. Flow items cannot be
     * {@code null}, so successes holding {@code null} are dropped.
     */
    public static <T> Flow.Publisher<T> orThrow(final Flow.Publisher<? extends ApiResult<T>> publisher) {
        return new TransformingPublisher<ApiResult<T>, T>(publisher, ApiResult::orThrow);
    }

    /**
     * Maps every item to its value, empty unless the item is a success holding a value.
     */
    public static <T> Flow.Publisher<Optional<T>> orNull(final Flow.Publisher<? extends ApiResult<T>> publisher) {
        return new TransformingPublisher<ApiResult<T>, Optional<T>>(
                publisher, result -> Optional.ofNullable(result.orNull()));
    }
}
