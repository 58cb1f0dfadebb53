package com.xpdustry.apiresult.flow;

import com.xpdustry.apiresult.ApiResult;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Emits Loading, then runs the call once per subscriber on the first request and emits its result.
 */
final class CallablePublisher<T> implements Flow.Publisher<ApiResult<T>> {

    private final Callable<? extends ApiResult<T>> call;
    private final Executor executor;

    CallablePublisher(final Callable<? extends ApiResult<T>> call, final Executor executor) {
        this.call = call;
        this.executor = executor;
    }

    @Override
    public void subscribe(final Flow.Subscriber<? super ApiResult<T>> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscriber.onSubscribe(new Emission(subscriber));
    }

    private final class Emission extends ResultEmitter<T> {

        private final AtomicBoolean started = new AtomicBoolean(false);

        private Emission(final Flow.Subscriber<? super ApiResult<T>> downstream) {
            super(downstream);
        }

        @Override
        protected void onRequest(final long n) {
            if (this.started.getAndSet(true)) {
                return;
            }
            try {
                CallablePublisher.this.executor.execute(this::invoke);
            } catch (final RejectedExecutionException e) {
                this.emit(ApiResult.failure(e));
                this.complete();
            }
        }

        @Override
        protected void onCancel() {
            this.started.set(true);
        }

        private void invoke() {
            if (this.isCancelled()) {
                return;
            }
            try {
                this.emit(ApiResult.unwrap(ApiResult.<ApiResult<T>>ofCallable(CallablePublisher.this.call)));
                this.complete();
            } catch (final CancellationException e) {
                this.error(e);
            } catch (final Error e) {
                this.error(e);
                throw e;
            }
        }
    }
}
