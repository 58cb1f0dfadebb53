package com.xpdustry.apiresult.flow;

import com.xpdustry.apiresult.functional.ThrowingFunction;
import java.util.Objects;
import java.util.concurrent.Flow;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps every upstream item. A {@code null} mapping drops the item, an exception cancels the upstream and is
 * signalled downstream as {@code onError}.
 */
final class TransformingPublisher<I, O> implements Flow.Publisher<O> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformingPublisher.class);

    private final Flow.Publisher<? extends I> upstream;
    private final ThrowingFunction<? super I, ? extends @Nullable O, ? extends Exception> mapper;

    TransformingPublisher(
            final Flow.Publisher<? extends I> upstream,
            final ThrowingFunction<? super I, ? extends @Nullable O, ? extends Exception> mapper) {
        this.upstream = upstream;
        this.mapper = mapper;
    }

    @Override
    public void subscribe(final Flow.Subscriber<? super O> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        this.upstream.subscribe(new Transformer(subscriber));
    }

    private final class Transformer implements Flow.Subscriber<I>, Flow.Subscription {

        private final Flow.Subscriber<? super O> downstream;
        private Flow.@Nullable Subscription subscription = null;
        private boolean done = false;

        private Transformer(final Flow.Subscriber<? super O> downstream) {
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
        public void onNext(final I item) {
            if (this.done) {
                return;
            }
            final O mapped;
            try {
                mapped = TransformingPublisher.this.mapper.apply(item);
            } catch (final Exception e) {
                this.cancel();
                this.onError(e);
                return;
            }
            if (mapped == null) {
                this.request(1);
            } else {
                this.downstream.onNext(mapped);
            }
        }

        @Override
        public void onError(final Throwable throwable) {
            if (this.done) {
                LOGGER.debug("Dropping error signalled after termination", throwable);
                return;
            }
            this.done = true;
            this.downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            if (this.done) {
                return;
            }
            this.done = true;
            this.downstream.onComplete();
        }

        @Override
        public void request(final long n) {
            Objects.requireNonNull(this.subscription).request(n);
        }

        @Override
        public void cancel() {
            Objects.requireNonNull(this.subscription).cancel();
        }
    }
}
