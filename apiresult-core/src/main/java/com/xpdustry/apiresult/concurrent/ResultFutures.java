package com.xpdustry.apiresult.concurrent;

import com.google.common.base.Throwables;
import com.xpdustry.apiresult.ApiResult;
import com.xpdustry.apiresult.Cancellation;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bridges between futures and {@link ApiResult}. Failures of the task become failed results, while
 * cancellations and errors keep travelling through the future.
 */
public final class ResultFutures {

    private ResultFutures() {}

    /**
     * Adapts a stage into a future of result. Cancelling the returned future cancels the source when it is a
     * {@link Future}.
     */
    public static <T> CompletableFuture<ApiResult<T>> of(final CompletionStage<? extends T> stage) {
        final var future = new CompletableFuture<ApiResult<T>>();
        stage.whenComplete((value, throwable) -> {
            if (throwable == null) {
                future.complete(ApiResult.success(value));
                return;
            }
            final var cause = unwrap(throwable);
            if (Cancellation.isCancellation(cause)) {
                future.completeExceptionally(Cancellation.of(cause));
            } else if (cause instanceof Exception exception) {
                future.complete(ApiResult.failure(exception));
            } else {
                future.completeExceptionally(cause);
            }
        });
        if (stage instanceof Future<?> source) {
            future.whenComplete((ignored, throwable) -> {
                if (future.isCancelled()) {
                    source.cancel(true);
                }
            });
        }
        return future;
    }

    public static <T> CompletableFuture<ApiResult<T>> supplyAsync(final Callable<? extends T> callable) {
        return supplyAsync(callable, ResultExecutor.shared());
    }

    /**
     * Runs the callable on the executor, wrapping its outcome like {@link ApiResult#ofCallable}.
     */
    public static <T> CompletableFuture<ApiResult<T>> supplyAsync(
            final Callable<? extends T> callable, final Executor executor) {
        final var future = new CompletableFuture<ApiResult<T>>();
        executor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(ApiResult.ofCallable(callable));
            } catch (final CancellationException e) {
                future.completeExceptionally(e);
            } catch (final Error e) {
                future.completeExceptionally(e);
                throw e;
            }
        });
        return future;
    }

    /**
     * Blocks until the future completes and wraps its outcome.
     *
     * @throws CancellationException if the future was cancelled, or the current thread was interrupted
     */
    public static <T> ApiResult<T> await(final Future<? extends T> future) {
        try {
            return ApiResult.success(future.get());
        } catch (final InterruptedException e) {
            throw Cancellation.interrupted(e);
        } catch (final ExecutionException e) {
            return fromCause(e.getCause());
        }
    }

    /**
     * Like {@link #await(Future)}, but gives up after the timeout with a failed result holding a
     * {@link TimeoutException}. The future itself is left running.
     */
    public static <T> ApiResult<T> await(final Future<? extends T> future, final Duration timeout) {
        try {
            return ApiResult.success(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (final InterruptedException e) {
            throw Cancellation.interrupted(e);
        } catch (final ExecutionException e) {
            return fromCause(e.getCause());
        } catch (final TimeoutException e) {
            return ApiResult.failure(e);
        }
    }

    private static <T> ApiResult<T> fromCause(final Throwable cause) {
        if (Cancellation.isCancellation(cause)) {
            throw Cancellation.of(cause);
        } else if (cause instanceof Exception exception) {
            return ApiResult.failure(exception);
        } else {
            Throwables.throwIfUnchecked(cause);
            throw new IllegalStateException(cause);
        }
    }

    private static Throwable unwrap(final Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
