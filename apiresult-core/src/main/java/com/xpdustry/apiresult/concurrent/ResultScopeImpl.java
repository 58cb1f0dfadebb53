package com.xpdustry.apiresult.concurrent;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.xpdustry.apiresult.ApiResult;
import com.xpdustry.apiresult.Cancellation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ResultScopeImpl implements ResultScope {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultScopeImpl.class);

    private final Executor executor;

    // First recoverable failure, by completion order
    private final AtomicReference<@Nullable Exception> failure = new AtomicReference<>();
    // First cancellation or error, rethrown to the caller
    private final AtomicReference<@Nullable Throwable> abort = new AtomicReference<>();

    private final Lock lock = new ReentrantLock();
    private final Condition idle = this.lock.newCondition();
    private final List<Child<?>> children = new ArrayList<>();
    private int running = 0;
    private boolean closed = false;
    private volatile boolean cancelled = false;

    ResultScopeImpl(final Executor executor) {
        this.executor = executor;
    }

    @Override
    public <T> Deferred<T> fork(final Callable<? extends T> task) {
        Objects.requireNonNull(task, "task");
        final var child = new Child<T>(task);
        this.lock.lock();
        try {
            Preconditions.checkState(!this.closed, "The scope is already closed");
            this.children.add(child);
            this.running++;
        } finally {
            this.lock.unlock();
        }
        if (this.cancelled) {
            child.cancel();
        }
        try {
            this.executor.execute(child);
        } catch (final RejectedExecutionException e) {
            child.reject(e);
            throw e;
        }
        return child;
    }

    @Override
    public boolean isCancelled() {
        return this.cancelled;
    }

    void fail(final Exception exception) {
        if (!this.failure.compareAndSet(null, exception)) {
            LOGGER.debug("Dropping failure, the scope already failed with {}", this.failure.get(), exception);
        }
    }

    void abort(final Throwable cause) {
        if (this.abort.compareAndSet(null, cause)) {
            LOGGER.debug("Aborting scope", cause);
            this.cancel();
        } else if (this.abort.get() != cause) {
            LOGGER.debug("Dropping abort cause, the scope is already aborted: {}", cause.toString());
        }
    }

    void cancel() {
        this.cancelled = true;
        final List<Child<?>> snapshot;
        this.lock.lock();
        try {
            snapshot = List.copyOf(this.children);
        } finally {
            this.lock.unlock();
        }
        for (final var child : snapshot) {
            child.cancel();
        }
    }

    /**
     * Waits for every child, then builds the outcome of the scope. An interruption while waiting cancels the
     * children, which are still waited for.
     */
    <T> ApiResult<T> join(final @Nullable T value) {
        var interrupted = false;
        this.lock.lock();
        try {
            while (this.running > 0) {
                try {
                    this.idle.await();
                } catch (final InterruptedException e) {
                    interrupted = true;
                    this.abort(Cancellation.of(e));
                }
            }
            this.closed = true;
        } finally {
            this.lock.unlock();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        final var abort = this.abort.get();
        if (abort != null) {
            Throwables.throwIfUnchecked(abort);
            throw new IllegalStateException("Unexpected scope abort", abort);
        }
        final var failure = this.failure.get();
        return failure == null ? ApiResult.success(value) : ApiResult.failure(failure);
    }

    private void finished() {
        this.lock.lock();
        try {
            if (--this.running == 0) {
                this.idle.signalAll();
            }
        } finally {
            this.lock.unlock();
        }
    }

    private final class Child<T> implements Runnable, Deferred<T> {

        private final Callable<? extends T> task;
        private final CompletableFuture<ApiResult<T>> outcome = new CompletableFuture<>();
        private @Nullable Thread runner = null;
        private boolean requested = false;
        private boolean interrupted = false;

        private Child(final Callable<? extends T> task) {
            this.task = task;
        }

        @Override
        public void run() {
            try {
                synchronized (this) {
                    if (this.requested) {
                        this.outcome.cancel(false);
                        return;
                    }
                    this.runner = Thread.currentThread();
                }
                this.outcome.complete(ApiResult.success(this.task.call()));
            } catch (final CancellationException | InterruptedException e) {
                this.cancelled(e);
            } catch (final Exception e) {
                ResultScopeImpl.this.fail(e);
                this.outcome.complete(ApiResult.failure(e));
            } catch (final Error e) {
                ResultScopeImpl.this.abort(e);
                this.outcome.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    this.runner = null;
                    if (this.interrupted) {
                        // Clears the interrupt we delivered, so it does not leak to the next task of the worker
                        Thread.interrupted();
                    }
                }
                ResultScopeImpl.this.finished();
            }
        }

        @Override
        public ApiResult<T> await() {
            try {
                return this.outcome.get();
            } catch (final InterruptedException e) {
                throw Cancellation.interrupted(e);
            } catch (final ExecutionException e) {
                Throwables.throwIfUnchecked(e.getCause());
                throw new IllegalStateException(e.getCause());
            }
        }

        @Override
        public boolean isDone() {
            return this.outcome.isDone();
        }

        @Override
        public synchronized void cancel() {
            if (this.requested || this.outcome.isDone()) {
                return;
            }
            this.requested = true;
            if (this.runner != null) {
                this.interrupted = true;
                this.runner.interrupt();
            }
        }

        private void cancelled(final Exception cause) {
            final boolean expected;
            synchronized (this) {
                expected = this.requested;
            }
            if (!expected) {
                // Nobody in the scope asked for it, so it comes from outside and tears everything down
                ResultScopeImpl.this.abort(Cancellation.of(cause));
            }
            this.outcome.cancel(false);
        }

        private void reject(final RejectedExecutionException exception) {
            this.outcome.complete(ApiResult.failure(exception));
            ResultScopeImpl.this.finished();
        }
    }
}
