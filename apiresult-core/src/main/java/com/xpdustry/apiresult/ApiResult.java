package com.xpdustry.apiresult;

import com.google.common.base.Throwables;
import com.xpdustry.apiresult.functional.ThrowingConsumer;
import com.xpdustry.apiresult.functional.ThrowingFunction;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of an operation: a {@link Success} holding a value, a {@link Failure} holding the
 * {@link Exception} that was caught, or {@link Loading} while the operation is still running.
 *
 * <p>Operators are not a deferred callback chain. Each one runs its function immediately, in place, and
 * returns a new result (or this one, when the state is unaffected). Failure and Loading short-circuit every
 * value operator, so the supplied functions run at most once and only on the expected state.
 *
 * <p>Two families of operators invoke user code. The plain ones ({@link #map}, {@link #then}, {@link #chain},
 * {@link #recover}) let exceptions thrown by that code propagate to the caller. The {@code try*} ones
 * ({@link #tryMap}, {@link #tryChain}, {@link #tryRecover}) catch them through {@link #ofCallable}. Neither
 * family ever catches a {@link java.lang.Error} or a cancellation.
 */
public sealed interface ApiResult<T> permits ApiResult.Success, ApiResult.Failure, ApiResult.Loading {

    static <T> ApiResult<T> success(final @Nullable T value) {
        return new Success<>(value);
    }

    /**
     * An empty success, used to start a chain of operators that has no initial value.
     */
    static ApiResult<Void> success() {
        return new Success<>(null);
    }

    static <T> ApiResult<T> failure(final Exception error) {
        return new Failure<>(error);
    }

    @SuppressWarnings("unchecked")
    static <T> ApiResult<T> loading() {
        return (ApiResult<T>) Loading.INSTANCE;
    }

    /**
     * Classifies a plain value. An {@link Exception} becomes a {@link Failure}, the {@link Loading} sentinel
     * stays {@link Loading}, anything else becomes a {@link Success}. Use {@link #success(Object)} to hold an
     * exception as a value.
     */
    static <T> ApiResult<T> of(final @Nullable T value) {
        if (value instanceof Exception exception) {
            return failure(exception);
        } else if (value instanceof Loading<?>) {
            return loading();
        } else {
            return success(value);
        }
    }

    /**
     * Runs the callable and wraps its outcome. Exceptions become a {@link Failure}, except cancellations,
     * which are rethrown. An {@link InterruptedException} is rethrown as a {@link CancellationException} with
     * the interrupt flag restored. Errors are never caught.
     */
    static <T> ApiResult<T> ofCallable(final Callable<? extends T> callable) {
        try {
            return success(callable.call());
        } catch (final CancellationException e) {
            throw e;
        } catch (final InterruptedException e) {
            throw Cancellation.interrupted(e);
        } catch (final Exception e) {
            return failure(e);
        }
    }

    /**
     * Alias of {@link #ofCallable}.
     */
    static <T> ApiResult<T> runResulting(final Callable<? extends T> block) {
        return ofCallable(block);
    }

    /**
     * Applies the function to the receiver, wrapping the outcome like {@link #ofCallable}.
     */
    static <T, R> ApiResult<R> runResulting(
            final T receiver, final ThrowingFunction<? super T, ? extends R, ? extends Exception> block) {
        return ofCallable(() -> block.apply(receiver));
    }

    /**
     * Flattens a nested result by one level.
     */
    @SuppressWarnings("unchecked")
    static <T> ApiResult<T> unwrap(final ApiResult<? extends ApiResult<T>> nested) {
        if (nested instanceof Success<?> success) {
            final var inner = (ApiResult<T>) success.value();
            return inner == null ? success(null) : inner;
        }
        return cast(nested);
    }

    default boolean isSuccess() {
        return this instanceof Success<?>;
    }

    default boolean isError() {
        return this instanceof Failure<?>;
    }

    default boolean isLoading() {
        return this instanceof Loading<?>;
    }

    default @Nullable T orNull() {
        return this instanceof Success<T> success ? success.value() : null;
    }

    default @Nullable Exception exceptionOrNull() {
        return this instanceof Failure<T> failure ? failure.error() : null;
    }

    /**
     * Splits this result into its value and error components, exactly one of which is set unless this is
     * {@link Loading}, in which case neither is.
     */
    default Components<T> components() {
        return new Components<>(this.orNull(), this.exceptionOrNull());
    }

    default @Nullable String errorMessage() {
        final var error = this.exceptionOrNull();
        return error == null ? null : error.getMessage();
    }

    default @Nullable Throwable errorCause() {
        final var error = this.exceptionOrNull();
        return error == null ? null : error.getCause();
    }

    default @Nullable String stackTrace() {
        final var error = this.exceptionOrNull();
        return error == null ? null : Throwables.getStackTraceAsString(error);
    }

    /**
     * Returns the value, throws the wrapped error, or throws {@link NotFinishedException} when loading.
     */
    default T orThrow() throws Exception {
        if (this instanceof Success<T> success) {
            return success.value();
        } else if (this instanceof Failure<T> failure) {
            throw failure.error();
        } else {
            throw new NotFinishedException();
        }
    }

    /**
     * Alias of {@link #orThrow()}.
     */
    default T require() throws Exception {
        return this.orThrow();
    }

    default T or(final T fallback) {
        return this instanceof Success<T> success ? success.value() : fallback;
    }

    /**
     * Returns the value, or the result of the function applied to the error. Loading is handed to the
     * function as a {@link NotFinishedException}.
     */
    default T orElse(final Function<? super Exception, ? extends T> function) {
        if (this instanceof Success<T> success) {
            return success.value();
        } else if (this instanceof Failure<T> failure) {
            return function.apply(failure.error());
        } else {
            return function.apply(new NotFinishedException());
        }
    }

    /**
     * Folds this result into a plain value. Loading is handed to {@code onError} as a
     * {@link NotFinishedException}.
     */
    default <R> R fold(
            final Function<? super T, ? extends R> onSuccess, final Function<? super Exception, ? extends R> onError) {
        if (this instanceof Success<T> success) {
            return onSuccess.apply(success.value());
        } else if (this instanceof Failure<T> failure) {
            return onError.apply(failure.error());
        } else {
            return onError.apply(new NotFinishedException());
        }
    }

    default <R> R fold(
            final Function<? super T, ? extends R> onSuccess,
            final Function<? super Exception, ? extends R> onError,
            final Supplier<? extends R> onLoading) {
        return this.isLoading() ? onLoading.get() : this.fold(onSuccess, onError);
    }

    default ApiResult<T> onSuccess(final Consumer<? super T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
        return this;
    }

    default ApiResult<T> onError(final Consumer<? super Exception> consumer) {
        return this.onError(Exception.class, consumer);
    }

    default <E extends Exception> ApiResult<T> onError(final Class<E> type, final Consumer<? super E> consumer) {
        if (this instanceof Failure<T> failure && type.isInstance(failure.error())) {
            consumer.accept(type.cast(failure.error()));
        }
        return this;
    }

    default ApiResult<T> onLoading(final Runnable runnable) {
        if (this.isLoading()) {
            runnable.run();
        }
        return this;
    }

    /**
     * Transforms the value. Exceptions thrown by the function are not caught, see {@link #tryMap}.
     */
    default <R> ApiResult<R> map(final Function<? super T, ? extends R> function) {
        if (this instanceof Success<T> success) {
            return success(function.apply(success.value()));
        }
        return cast(this);
    }

    /**
     * Transforms the value, wrapping anything the function throws into a {@link Failure}.
     */
    default <R> ApiResult<R> tryMap(final ThrowingFunction<? super T, ? extends R, ? extends Exception> function) {
        if (this instanceof Success<T> success) {
            return ofCallable(() -> function.apply(success.value()));
        }
        return cast(this);
    }

    default <R> R mapOrDefault(
            final Function<? super Exception, ? extends R> fallback, final Function<? super T, ? extends R> transform) {
        return this.<R>map(transform).orElse(fallback);
    }

    /**
     * Maps both the value and the error. Loading is left alone.
     */
    default <R> ApiResult<R> mapEither(
            final Function<? super T, ? extends R> onSuccess,
            final Function<? super Exception, ? extends Exception> onError) {
        return this.<R>map(onSuccess).mapError(onError);
    }

    /**
     * Turns Loading into a success. The only operator that leaves the Loading state without failing.
     */
    default ApiResult<T> mapLoading(final Supplier<? extends T> supplier) {
        return this.isLoading() ? success(supplier.get()) : this;
    }

    default ApiResult<T> mapError(final Function<? super Exception, ? extends Exception> function) {
        return this.mapError(Exception.class, function);
    }

    /**
     * Maps the error, but only when it is an instance of the given type.
     */
    default <E extends Exception> ApiResult<T> mapError(
            final Class<E> type, final Function<? super E, ? extends Exception> function) {
        if (this instanceof Failure<T> failure && type.isInstance(failure.error())) {
            return failure(function.apply(type.cast(failure.error())));
        }
        return this;
    }

    /**
     * Replaces the error with its cause, when the cause is itself an exception.
     */
    default ApiResult<T> mapErrorToCause() {
        return this.mapError(error -> error.getCause() instanceof Exception cause ? cause : error);
    }

    /**
     * Continues with the result returned by the function. Alias of {@link #flatMap}.
     */
    default <R> ApiResult<R> then(final Function<? super T, ? extends ApiResult<R>> function) {
        if (this instanceof Success<T> success) {
            return function.apply(success.value());
        }
        return cast(this);
    }

    default <R> ApiResult<R> flatMap(final Function<? super T, ? extends ApiResult<R>> function) {
        return this.then(function);
    }

    /**
     * Requires another result to succeed before proceeding with this one. The value of the other result is
     * discarded, its failure or loading state replaces this result.
     */
    default ApiResult<T> chain(final Function<? super T, ? extends ApiResult<?>> function) {
        if (!(this instanceof Success<T> success)) {
            return this;
        }
        final ApiResult<?> other = function.apply(success.value());
        return other.isSuccess() ? this : cast(other);
    }

    /**
     * Like {@link #chain}, for a side effect that does not return a result but may throw.
     */
    default ApiResult<T> tryChain(final ThrowingConsumer<? super T, ? extends Exception> consumer) {
        return this.chain(value -> ofCallable(() -> consumer.asFunction().apply(value)));
    }

    default ApiResult<T> recover(final Function<? super Exception, ? extends ApiResult<T>> function) {
        return this.recover(Exception.class, function);
    }

    /**
     * Replaces the failure with the result returned by the function, but only when the error is an instance
     * of the given type.
     */
    default <E extends Exception> ApiResult<T> recover(
            final Class<E> type, final Function<? super E, ? extends ApiResult<T>> function) {
        if (this instanceof Failure<T> failure && type.isInstance(failure.error())) {
            return function.apply(type.cast(failure.error()));
        }
        return this;
    }

    default ApiResult<T> tryRecover(
            final ThrowingFunction<? super Exception, ? extends T, ? extends Exception> function) {
        return this.tryRecover(Exception.class, function);
    }

    default <E extends Exception> ApiResult<T> tryRecover(
            final Class<E> type, final ThrowingFunction<? super E, ? extends T, ? extends Exception> function) {
        return this.recover(type, error -> ofCallable(() -> function.apply(error)));
    }

    default ApiResult<T> recoverIf(
            final Predicate<? super Exception> condition,
            final Function<? super Exception, ? extends ApiResult<T>> function) {
        if (this instanceof Failure<T> failure && condition.test(failure.error())) {
            return function.apply(failure.error());
        }
        return this;
    }

    default ApiResult<T> tryRecoverIf(
            final Predicate<? super Exception> condition,
            final ThrowingFunction<? super Exception, ? extends T, ? extends Exception> function) {
        return this.recoverIf(condition, error -> ofCallable(() -> function.apply(error)));
    }

    default ApiResult<T> errorIf(final Predicate<? super T> predicate) {
        return this.errorIf(predicate, ConditionNotSatisfiedException::new);
    }

    /**
     * Fails with the supplied exception when the value matches the predicate.
     */
    default ApiResult<T> errorIf(final Predicate<? super T> predicate, final Supplier<? extends Exception> exception) {
        if (this instanceof Success<T> success && predicate.test(success.value())) {
            return failure(exception.get());
        }
        return this;
    }

    default ApiResult<T> errorUnless(final Predicate<? super T> predicate) {
        return this.errorUnless(predicate, ConditionNotSatisfiedException::new);
    }

    default ApiResult<T> errorUnless(
            final Predicate<? super T> predicate, final Supplier<? extends Exception> exception) {
        return this.errorIf(value -> !predicate.test(value), exception);
    }

    default ApiResult<T> errorOnLoading() {
        return this.errorOnLoading(NotFinishedException::new);
    }

    default ApiResult<T> errorOnLoading(final Supplier<? extends Exception> exception) {
        return this.isLoading() ? failure(exception.get()) : this;
    }

    default ApiResult<T> errorOnNull() {
        return this.errorOnNull(() -> new ConditionNotSatisfiedException("Value was null"));
    }

    /**
     * Fails with the supplied exception when the success value is {@code null}.
     */
    default ApiResult<T> errorOnNull(final Supplier<? extends Exception> exception) {
        return this.errorIf(Objects::isNull, exception);
    }

    /**
     * Alias of {@link #errorOnNull()}.
     */
    default ApiResult<T> requireNotNull() {
        return this.errorOnNull();
    }

    default ApiResult<T> require(final Predicate<? super T> predicate) {
        return this.require(predicate, () -> null);
    }

    /**
     * Fails with a {@link ConditionNotSatisfiedException} carrying the supplied message when the value does
     * not match the predicate.
     */
    default ApiResult<T> require(
            final Predicate<? super T> predicate, final Supplier<? extends @Nullable String> message) {
        return this.errorUnless(predicate, () -> new ConditionNotSatisfiedException(message.get()));
    }

    default <R> ApiResult<R> requireIs(final Class<R> type) {
        return this.requireIs(
                type,
                value -> new ConditionNotSatisfiedException("Result value is of type "
                        + (value == null ? null : value.getClass().getSimpleName())
                        + " but expected "
                        + type.getSimpleName()));
    }

    /**
     * Narrows the value to the given type, failing with the supplied exception when it is not an instance.
     */
    default <R> ApiResult<R> requireIs(
            final Class<R> type, final Function<? super T, ? extends Exception> exception) {
        return this.tryMap(value -> {
            if (!type.isInstance(value)) {
                throw exception.apply(value);
            }
            return type.cast(value);
        });
    }

    /**
     * Maps a failure to a {@code null} success.
     */
    default ApiResult<T> nullOnError() {
        return this.isError() ? success(null) : this;
    }

    default ApiResult<Void> unit() {
        return this.map(ignored -> null);
    }

    /**
     * Throws the wrapped error if it is an instance of the given type. The returned result is guaranteed not to
     * hold such an error.
     */
    default <E extends Exception> ApiResult<T> rethrow(final Class<E> type) throws E {
        if (this instanceof Failure<T> failure && type.isInstance(failure.error())) {
            throw type.cast(failure.error());
        }
        return this;
    }

    /**
     * Throws the wrapped error if it is a {@link CancellationException}. Needed for results that were built
     * without {@link #ofCallable}, such as {@link #of(Object)} applied to a caught exception.
     */
    default ApiResult<T> rethrowCancellation() {
        return this.rethrow(CancellationException.class);
    }

    @SuppressWarnings("unchecked")
    private static <R> ApiResult<R> cast(final ApiResult<?> result) {
        return (ApiResult<R>) result;
    }

    record Success<T>(@Nullable T value) implements ApiResult<T> {
        @Override
        public String toString() {
            return "ApiResult.Success: " + this.value;
        }
    }

    record Failure<T>(Exception error) implements ApiResult<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String toString() {
            return "ApiResult.Failure: message=" + this.error.getMessage() + " and cause: " + this.error;
        }
    }

    final class Loading<T> implements ApiResult<T> {

        private static final Loading<?> INSTANCE = new Loading<>();

        private Loading() {}

        @Override
        public String toString() {
            return "ApiResult.Loading";
        }
    }

    record Components<T>(@Nullable T value, @Nullable Exception error) {}
}
