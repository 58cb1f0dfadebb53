package com.xpdustry.apiresult;

import java.util.concurrent.CancellationException;

/**
 * Helpers for the two cancellation signals of the platform, {@link CancellationException} and
 * {@link InterruptedException}. Neither is ever turned into a failed result.
 */
public final class Cancellation {

    private Cancellation() {}

    public static boolean isCancellation(final Throwable throwable) {
        return throwable instanceof CancellationException || throwable instanceof InterruptedException;
    }

    /**
     * Restores the interrupt flag of the current thread and converts the interruption into an unchecked
     * cancellation, so it can travel through code that only declares unchecked exceptions.
     */
    public static CancellationException interrupted(final InterruptedException exception) {
        Thread.currentThread().interrupt();
        return of(exception);
    }

    /**
     * Converts any cancellation signal into a {@link CancellationException}, leaving interrupt flags alone.
     *
     * @throws IllegalArgumentException if the throwable is not a cancellation signal
     */
    public static CancellationException of(final Throwable throwable) {
        if (throwable instanceof CancellationException cancellation) {
            return cancellation;
        } else if (throwable instanceof InterruptedException) {
            final var cancellation = new CancellationException("Interrupted");
            cancellation.initCause(throwable);
            return cancellation;
        } else {
            throw new IllegalArgumentException("Not a cancellation signal: " + throwable);
        }
    }
}
