package com.xpdustry.apiresult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jspecify.annotations.Nullable;

/**
 * Operators over groups of results, and over results holding a collection.
 * Iterables are consumed eagerly, streams stay lazy.
 */
public final class ApiResults {

    private ApiResults() {}

    /**
     * Merges all the values into a single list, in order. The first result that is not a success, in scan
     * order, decides the failure: a {@link ApiResult.Failure} as is, a {@link ApiResult.Loading} as a
     * {@link NotFinishedException}. Later results are not inspected.
     */
    public static <T> ApiResult<List<T>> merge(final Iterable<? extends ApiResult<? extends T>> results) {
        final List<T> values = new ArrayList<>();
        for (final var result : results) {
            if (result instanceof ApiResult.Success<? extends T> success) {
                values.add(success.value());
            } else if (result instanceof ApiResult.Failure<? extends T> failure) {
                return ApiResult.failure(failure.error());
            } else {
                return ApiResult.failure(new NotFinishedException());
            }
        }
        return ApiResult.success(values);
    }

    @SafeVarargs
    public static <T> ApiResult<List<T>> merge(final ApiResult<? extends T>... results) {
        return merge(Arrays.asList(results));
    }

    /**
     * Partitions the results into the success values and the errors, keeping arrival order in each. Loading
     * results are counted as errors, in the form of a {@link NotFinishedException}.
     */
    public static <T> Accumulated<T> accumulate(final Iterable<? extends ApiResult<? extends T>> results) {
        final List<T> values = new ArrayList<>();
        final List<Exception> errors = new ArrayList<>();
        for (final var result : results) {
            if (result instanceof ApiResult.Success<? extends T> success) {
                values.add(success.value());
            } else if (result instanceof ApiResult.Failure<? extends T> failure) {
                errors.add(failure.error());
            } else {
                errors.add(new NotFinishedException());
            }
        }
        return new Accumulated<>(values, errors);
    }

    public static <T> List<T> values(final Iterable<? extends ApiResult<? extends T>> results) {
        final List<T> values = new ArrayList<>();
        for (final var result : results) {
            if (result instanceof ApiResult.Success<? extends T> success) {
                values.add(success.value());
            }
        }
        return values;
    }

    public static <T> List<ApiResult.Success<T>> filterSuccesses(final Iterable<? extends ApiResult<T>> results) {
        return filterSuccesses(ApiResults.<ApiResult<T>>stream(results)).toList();
    }

    @SuppressWarnings("unchecked")
    public static <T> Stream<ApiResult.Success<T>> filterSuccesses(final Stream<? extends ApiResult<T>> results) {
        return results.filter(ApiResult::isSuccess).map(result -> (ApiResult.Success<T>) result);
    }

    public static <T> List<ApiResult.Failure<T>> filterErrors(final Iterable<? extends ApiResult<T>> results) {
        return filterErrors(ApiResults.<ApiResult<T>>stream(results)).toList();
    }

    @SuppressWarnings("unchecked")
    public static <T> Stream<ApiResult.Failure<T>> filterErrors(final Stream<? extends ApiResult<T>> results) {
        return results.filter(ApiResult::isError).map(result -> (ApiResult.Failure<T>) result);
    }

    /**
     * Drops the successes holding {@code null}, keeping failures and loading results.
     */
    public static <T> List<ApiResult<T>> filterNotNull(final Iterable<? extends ApiResult<T>> results) {
        return ApiResults.<ApiResult<T>>stream(results)
                .filter(result -> !(result instanceof ApiResult.Success<T> success) || success.value() != null)
                .toList();
    }

    /**
     * Returns the first success, or a failure holding a {@link NoSuchElementException} if there is none.
     */
    public static <T> ApiResult<T> firstSuccess(final Iterable<? extends ApiResult<? extends T>> results) {
        for (final var result : results) {
            if (result instanceof ApiResult.Success<? extends T> success) {
                return ApiResult.success(success.value());
            }
        }
        return ApiResult.failure(new NoSuchElementException("No success found"));
    }

    public static <T> @Nullable T firstSuccessOrNull(final Iterable<? extends ApiResult<? extends T>> results) {
        return firstSuccess(results).orNull();
    }

    /**
     * @throws NoSuchElementException if none of the results is a success
     */
    public static <T> T firstSuccessOrThrow(final Iterable<? extends ApiResult<? extends T>> results) {
        for (final var result : results) {
            if (result instanceof ApiResult.Success<? extends T> success) {
                return success.value();
            }
        }
        throw new NoSuchElementException("No success found");
    }

    public static <T, R> List<ApiResult<R>> mapResults(
            final Iterable<? extends ApiResult<T>> results, final Function<? super T, ? extends R> function) {
        return ApiResults.<T, R>mapResults(ApiResults.<ApiResult<T>>stream(results), function).toList();
    }

    public static <T, R> Stream<ApiResult<R>> mapResults(
            final Stream<? extends ApiResult<T>> results, final Function<? super T, ? extends R> function) {
        return results.map(result -> result.<R>map(function));
    }

    public static <T> List<ApiResult<T>> mapErrors(
            final Iterable<? extends ApiResult<T>> results,
            final Function<? super Exception, ? extends Exception> function) {
        return ApiResults.<T>mapErrors(ApiResults.<ApiResult<T>>stream(results), function).toList();
    }

    public static <T> Stream<ApiResult<T>> mapErrors(
            final Stream<? extends ApiResult<T>> results,
            final Function<? super Exception, ? extends Exception> function) {
        return results.map(result -> result.mapError(function));
    }

    /**
     * Maps every element of the collection held by a successful result.
     */
    public static <T, R> ApiResult<List<R>> mapValues(
            final ApiResult<? extends Iterable<? extends T>> result, final Function<? super T, ? extends R> function) {
        return result.map(iterable -> ApiResults.<T>stream(iterable).<R>map(function).toList());
    }

    /**
     * Filters the collection held by a successful result.
     */
    public static <T> ApiResult<List<T>> filter(
            final ApiResult<? extends Iterable<? extends T>> result, final Predicate<? super T> predicate) {
        return result.map(iterable -> ApiResults.<T>stream(iterable).filter(predicate).toList());
    }

    /**
     * Runs the block if the result is a success holding an empty collection.
     */
    public static <C extends Iterable<?>> ApiResult<C> onEmpty(final ApiResult<C> result, final Runnable block) {
        return result.onSuccess(iterable -> {
            if (isEmpty(iterable)) {
                block.run();
            }
        });
    }

    /**
     * Alias of {@link #onEmpty(ApiResult, Runnable)}.
     */
    public static <C extends Iterable<?>> ApiResult<C> ifEmpty(final ApiResult<C> result, final Runnable block) {
        return onEmpty(result, block);
    }

    public static <C extends Iterable<?>> ApiResult<C> errorIfEmpty(final ApiResult<C> result) {
        return errorIfEmpty(result, () -> new ConditionNotSatisfiedException("Collection was empty"));
    }

    /**
     * Fails with the supplied exception if the result is a success holding an empty collection.
     */
    public static <C extends Iterable<?>> ApiResult<C> errorIfEmpty(
            final ApiResult<C> result, final Supplier<? extends Exception> exception) {
        return result.errorIf(ApiResults::isEmpty, exception);
    }

    /**
     * Returns the held list, or an empty one if the result is not a success.
     */
    public static <T> List<T> orEmpty(final ApiResult<List<T>> result) {
        final var list = result.orNull();
        return list == null ? List.of() : list;
    }

    private static boolean isEmpty(final @Nullable Iterable<?> iterable) {
        if (iterable == null) {
            return true;
        } else if (iterable instanceof Collection<?> collection) {
            return collection.isEmpty();
        } else {
            return !iterable.iterator().hasNext();
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Stream<T> stream(final Iterable<? extends T> iterable) {
        final Stream<? extends T> stream = iterable instanceof Collection<? extends T> collection
                ? collection.stream()
                : StreamSupport.stream(iterable.spliterator(), false);
        return (Stream<T>) stream;
    }

    /**
     * The outcome of {@link #accumulate(Iterable)}.
     */
    public record Accumulated<T>(List<T> values, List<Exception> errors) {

        public Accumulated {
            values = Collections.unmodifiableList(new ArrayList<>(values));
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !this.errors.isEmpty();
        }
    }
}
