package com.xpdustry.apiresult.flow;

import java.util.List;
import java.util.concurrent.Flow;
import org.jspecify.annotations.Nullable;

/**
 * Synchronously emits the items on demand, then completes or fails with the given throwable.
 */
final class ListPublisher<T> implements Flow.Publisher<T> {

    private final List<T> items;
    private final @Nullable Throwable failure;
    private volatile boolean cancelled = false;
    private volatile long requested = 0L;

    ListPublisher(final List<T> items, final @Nullable Throwable failure) {
        this.items = items;
        this.failure = failure;
    }

    boolean isCancelled() {
        return this.cancelled;
    }

    long requested() {
        return this.requested;
    }

    @Override
    public void subscribe(final Flow.Subscriber<? super T> subscriber) {
        subscriber.onSubscribe(new Flow.Subscription() {

            private int index = 0;
            private boolean done = false;

            @Override
            public void request(final long n) {
                final var current = ListPublisher.this.requested;
                ListPublisher.this.requested = Long.MAX_VALUE - current < n ? Long.MAX_VALUE : current + n;
                for (long i = 0;
                        i < n && !ListPublisher.this.cancelled && this.index < ListPublisher.this.items.size();
                        i++) {
                    subscriber.onNext(ListPublisher.this.items.get(this.index++));
                }
                this.terminate();
            }

            @Override
            public void cancel() {
                ListPublisher.this.cancelled = true;
            }

            private void terminate() {
                if (this.done
                        || ListPublisher.this.cancelled
                        || this.index < ListPublisher.this.items.size()) {
                    return;
                }
                this.done = true;
                if (ListPublisher.this.failure == null) {
                    subscriber.onComplete();
                } else {
                    subscriber.onError(ListPublisher.this.failure);
                }
            }
        });
    }
}
