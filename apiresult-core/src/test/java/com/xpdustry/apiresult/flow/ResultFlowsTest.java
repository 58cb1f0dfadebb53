package com.xpdustry.apiresult.flow;

import static org.assertj.core.api.Assertions.assertThat;

import com.xpdustry.apiresult.ApiResult;
import com.xpdustry.apiresult.NotFinishedException;
import com.xpdustry.apiresult.concurrent.ResultExecutor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ResultFlowsTest {

    @Test
    void test_as_result() {
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.asResult(new ListPublisher<>(List.of(1, 2), null)).subscribe(subscriber);
        Assertions.assertEquals(
                List.of(ApiResult.loading(), ApiResult.success(1), ApiResult.success(2)), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_as_result_failure_is_last_item() {
        final var error = new IOException("upstream");
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.asResult(new ListPublisher<>(List.of(1), error)).subscribe(subscriber);
        Assertions.assertEquals(
                List.of(ApiResult.loading(), ApiResult.success(1), ApiResult.failure(error)), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
        Assertions.assertNull(subscriber.error());
    }

    @Test
    void test_as_result_cancellation_is_not_an_item() {
        final var cancellation = new CancellationException("upstream");
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.asResult(new ListPublisher<>(List.of(1), cancellation)).subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.success(1)), subscriber.items());
        Assertions.assertSame(cancellation, subscriber.error());
    }

    @Test
    void test_as_result_loading_consumes_demand() {
        final var upstream = new ListPublisher<>(List.of(1, 2), new IOException("late"));
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>(1);
        ResultFlows.asResult(upstream).subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading()), subscriber.items());
        Assertions.assertEquals(0L, upstream.requested());

        subscriber.request(2);
        Assertions.assertEquals(2L, upstream.requested());
        Assertions.assertEquals(3, subscriber.items().size());
        Assertions.assertFalse(subscriber.isCompleted());

        subscriber.request(1);
        Assertions.assertTrue(subscriber.items().get(3).isError());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_as_result_cancel() {
        final var upstream = new ListPublisher<>(List.of(1, 2, 3), null);
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>(2);
        ResultFlows.asResult(upstream).subscribe(subscriber);
        subscriber.cancel();
        subscriber.request(5);
        Assertions.assertTrue(upstream.isCancelled());
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.success(1)), subscriber.items());
        Assertions.assertFalse(subscriber.isCompleted());
    }

    @Test
    void test_non_positive_request_is_an_error() {
        final var upstream = new ListPublisher<>(List.of(1), null);
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>(0);
        ResultFlows.asResult(upstream).subscribe(subscriber);
        subscriber.request(0);
        assertThat(subscriber.error()).isInstanceOf(IllegalArgumentException.class);
        Assertions.assertTrue(upstream.isCancelled());
    }

    @Test
    void test_flow() {
        final var subscriber = new RecordingSubscriber<ApiResult<String>>();
        ResultFlows.<String>flow(() -> ApiResult.success("done")).subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.success("done")), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_flow_runs_on_first_request() {
        final var calls = new AtomicInteger();
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>(0);
        ResultFlows.<Integer>tryFlow(calls::incrementAndGet).subscribe(subscriber);
        Assertions.assertEquals(0, calls.get());
        Assertions.assertTrue(subscriber.items().isEmpty());

        subscriber.request(1);
        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals(List.of(ApiResult.loading()), subscriber.items());

        subscriber.request(1);
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.success(1)), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void test_try_flow_failure() {
        final var error = new IOException("call");
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.<Integer>tryFlow(() -> {
                    throw error;
                })
                .subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.failure(error)), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_try_flow_cancellation() {
        final var cancellation = new CancellationException("call");
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.<Integer>tryFlow(() -> {
                    throw cancellation;
                })
                .subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading()), subscriber.items());
        Assertions.assertSame(cancellation, subscriber.error());
    }

    @Test
    void test_flow_on_executor() throws InterruptedException {
        final var subscriber = new RecordingSubscriber<ApiResult<String>>();
        ResultFlows.<String>tryFlow(ResultExecutor.shared(), () -> Thread.currentThread().getName())
                .subscribe(subscriber);
        Assertions.assertTrue(subscriber.await());
        Assertions.assertEquals(2, subscriber.items().size());
        assertThat(subscriber.items().get(1).orNull()).startsWith("apiresult-worker-");
    }

    @Test
    void test_map_results() {
        final List<ApiResult<Integer>> items = List.of(ApiResult.loading(), ApiResult.success(2));
        final var subscriber = new RecordingSubscriber<ApiResult<String>>();
        ResultFlows.<Integer, String>mapResults(new ListPublisher<>(items, null), value -> "#" + value)
                .subscribe(subscriber);
        Assertions.assertEquals(List.of(ApiResult.loading(), ApiResult.success("#2")), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_on_each_success() {
        final var error = new IOException("item");
        final List<ApiResult<Integer>> items =
                List.of(ApiResult.success(1), ApiResult.failure(error), ApiResult.success(3));
        final var seen = new ArrayList<Integer>();
        final var subscriber = new RecordingSubscriber<ApiResult<Integer>>();
        ResultFlows.onEachSuccess(new ListPublisher<>(items, null), seen::add).subscribe(subscriber);
        Assertions.assertEquals(List.of(1, 3), seen);
        Assertions.assertEquals(items, subscriber.items());
    }

    @Test
    void test_values() {
        final List<ApiResult<Integer>> items =
                List.of(ApiResult.loading(), ApiResult.success(1), ApiResult.success(null), ApiResult.success(2));
        final var subscriber = new RecordingSubscriber<Integer>();
        ResultFlows.values(new ListPublisher<>(items, null)).subscribe(subscriber);
        Assertions.assertEquals(List.of(1, 2), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_values_failure_terminates() {
        final var error = new IOException("item");
        final List<ApiResult<Integer>> items =
                List.of(ApiResult.success(1), ApiResult.failure(error), ApiResult.success(3));
        final var upstream = new ListPublisher<>(items, null);
        final var subscriber = new RecordingSubscriber<Integer>();
        ResultFlows.values(upstream).subscribe(subscriber);
        Assertions.assertEquals(List.of(1), subscriber.items());
        Assertions.assertSame(error, subscriber.error());
        Assertions.assertTrue(upstream.isCancelled());
        Assertions.assertFalse(subscriber.isCompleted());
    }

    @Test
    void test_or_throw() {
        final List<ApiResult<Integer>> items = List.of(ApiResult.success(1), ApiResult.success(2));
        final var subscriber = new RecordingSubscriber<Integer>();
        ResultFlows.orThrow(new ListPublisher<>(items, null)).subscribe(subscriber);
        Assertions.assertEquals(List.of(1, 2), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }

    @Test
    void test_or_throw_fails_on_loading() {
        final List<ApiResult<Integer>> items = List.of(ApiResult.loading(), ApiResult.success(1));
        final var upstream = new ListPublisher<>(items, null);
        final var subscriber = new RecordingSubscriber<Integer>();
        ResultFlows.orThrow(upstream).subscribe(subscriber);
        Assertions.assertTrue(subscriber.items().isEmpty());
        assertThat(subscriber.error()).isInstanceOf(NotFinishedException.class);
        Assertions.assertTrue(upstream.isCancelled());
    }

    @Test
    void test_or_null() {
        final var error = new IOException("item");
        final List<ApiResult<Integer>> items =
                List.of(ApiResult.loading(), ApiResult.success(1), ApiResult.failure(error), ApiResult.success(null));
        final var subscriber = new RecordingSubscriber<Optional<Integer>>();
        ResultFlows.orNull(new ListPublisher<>(items, null)).subscribe(subscriber);
        Assertions.assertEquals(
                List.of(Optional.empty(), Optional.of(1), Optional.empty(), Optional.empty()), subscriber.items());
        Assertions.assertTrue(subscriber.isCompleted());
    }
}
