package com.xpdustry.apiresult.flow;

import com.xpdustry.apiresult.ApiResult;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;

/**
 * Serializes results towards a subscriber, honouring its demand. The first emitted item is always
 * {@link ApiResult.Loading}, and terminal signals are only sent once every queued item was delivered.
 */
abstract class ResultEmitter<T> implements Flow.Subscription {

    private final Flow.Subscriber<? super ApiResult<T>> downstream;
    private final Queue<ApiResult<T>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong requested = new AtomicLong();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean done = false;
    private volatile boolean cancelled = false;
    private volatile @Nullable Throwable error = null;
    private boolean terminated = false;

    ResultEmitter(final Flow.Subscriber<? super ApiResult<T>> downstream) {
        this.downstream = downstream;
        this.queue.offer(ApiResult.loading());
    }

    /**
     * Called after the subscriber added {@code n} to its demand, and the Loading item had a chance to go out.
     */
    protected abstract void onRequest(final long n);

    protected abstract void onCancel();

    @Override
    public final void request(final long n) {
        if (this.cancelled) {
            return;
        }
        if (n <= 0) {
            this.queue.clear();
            this.onCancel();
            this.error(new IllegalArgumentException("Non-positive request: " + n));
            return;
        }
        addCapped(this.requested, n);
        this.drain();
        this.onRequest(n);
    }

    @Override
    public final void cancel() {
        if (!this.cancelled) {
            this.cancelled = true;
            this.queue.clear();
            this.onCancel();
        }
    }

    protected final boolean isCancelled() {
        return this.cancelled;
    }

    protected final void emit(final ApiResult<T> result) {
        if (this.done || this.cancelled) {
            return;
        }
        this.queue.offer(result);
        this.drain();
    }

    protected final void complete() {
        this.done = true;
        this.drain();
    }

    protected final void error(final Throwable error) {
        if (this.done) {
            return;
        }
        this.error = error;
        this.done = true;
        this.drain();
    }

    private void drain() {
        if (this.wip.getAndIncrement() != 0) {
            return;
        }
        var missed = 1;
        do {
            final var requested = this.requested.get();
            var emitted = 0L;
            while (emitted != requested) {
                if (this.cancelled) {
                    this.queue.clear();
                    return;
                }
                final var item = this.queue.poll();
                if (item == null) {
                    break;
                }
                this.downstream.onNext(item);
                emitted++;
            }
            if (this.cancelled) {
                this.queue.clear();
                return;
            }
            if (this.done && this.queue.isEmpty() && !this.terminated) {
                this.terminated = true;
                final var error = this.error;
                if (error == null) {
                    this.downstream.onComplete();
                } else {
                    this.downstream.onError(error);
                }
                return;
            }
            if (emitted != 0L && requested != Long.MAX_VALUE) {
                this.requested.addAndGet(-emitted);
            }
            missed = this.wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private static void addCapped(final AtomicLong requested, final long n) {
        while (true) {
            final var current = requested.get();
            if (current == Long.MAX_VALUE) {
                return;
            }
            final var next = current + n;
            if (requested.compareAndSet(current, next < 0 ? Long.MAX_VALUE : next)) {
                return;
            }
        }
    }
}
