package com.xpdustry.apiresult.flow;

import com.xpdustry.apiresult.ApiResult;
import com.xpdustry.apiresult.Cancellation;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits Loading, then a success for each upstream item. A recoverable upstream error becomes a trailing
 * failure followed by completion, while cancellations and errors are passed on as {@code onError}.
 */
final class LoadingFirstPublisher<T> implements Flow.Publisher<ApiResult<T>> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoadingFirstPublisher.class);

    private final Flow.Publisher<? extends T> upstream;

    LoadingFirstPublisher(final Flow.Publisher<? extends T> upstream) {
        this.upstream = upstream;
    }

    @Override
    public void subscribe(final Flow.Subscriber<? super ApiResult<T>> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        this.upstream.subscribe(new Bridge<>(subscriber));
    }

    private static final class Bridge<T> extends ResultEmitter<T> implements Flow.Subscriber<T> {

        private final Flow.Subscriber<? super ApiResult<T>> downstream;
        private final AtomicBoolean loadingAccounted = new AtomicBoolean(false);
        private volatile Flow.@Nullable Subscription subscription = null;

        private Bridge(final Flow.Subscriber<? super ApiResult<T>> downstream) {
            super(downstream);
            this.downstream = downstream;
        }

        @Override
        public void onSubscribe(final Flow.Subscription subscription) {
            if (this.subscription != null) {
                LOGGER.warn("Upstream subscribed twice, cancelling the second subscription");
                subscription.cancel();
                return;
            }
            this.subscription = subscription;
            this.downstream.onSubscribe(this);
        }

        @Override
        public void onNext(final T item) {
            this.emit(ApiResult.success(item));
        }

        @Override
        public void onError(final Throwable throwable) {
            if (Cancellation.isCancellation(throwable)) {
                this.error(Cancellation.of(throwable));
            } else if (throwable instanceof Exception exception) {
                this.emit(ApiResult.failure(exception));
                this.complete();
            } else {
                this.error(throwable);
            }
        }

        @Override
        public void onComplete() {
            this.complete();
        }

        @Override
        protected void onRequest(final long n) {
            // The Loading item takes one unit of the first request
            final var upstreamDemand = this.loadingAccounted.getAndSet(true) ? n : n - 1;
            final var subscription = this.subscription;
            if (upstreamDemand > 0 && subscription != null) {
                subscription.request(upstreamDemand);
            }
        }

        @Override
        protected void onCancel() {
            final var subscription = this.subscription;
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }
}
