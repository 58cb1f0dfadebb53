package com.xpdustry.apiresult.concurrent;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cached pool of daemon worker threads, used by default to run the children of a {@link ResultScope}
 * and the tasks of {@link ResultFutures}.
 */
public final class ResultExecutor implements Executor, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultExecutor.class);
    private static final ResultExecutor SHARED = new ResultExecutor("apiresult-worker");

    private final ExecutorService executor;

    public ResultExecutor(final String name) {
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, throwable) ->
                        LOGGER.error("Uncaught exception in worker {}", thread.getName(), throwable))
                .build());
    }

    public static ResultExecutor shared() {
        return SHARED;
    }

    @Override
    public void execute(final Runnable command) {
        this.executor.execute(command);
    }

    public boolean isShutdown() {
        return this.executor.isShutdown();
    }

    @Override
    public void close() {
        Preconditions.checkState(this != SHARED, "The shared executor cannot be closed");
        this.executor.shutdown();
        try {
            if (!this.executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Workers did not finish in time, interrupting them");
                this.executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            LOGGER.error("Interrupted while waiting for workers to finish", e);
            this.executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
