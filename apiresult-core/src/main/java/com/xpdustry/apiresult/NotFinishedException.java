package com.xpdustry.apiresult;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a value is requested from an {@link ApiResult} that is still {@link ApiResult.Loading}.
 */
public final class NotFinishedException extends IllegalArgumentException {

    public NotFinishedException() {
        this("ApiResult is still in Loading state");
    }

    public NotFinishedException(final @Nullable String message) {
        super(message);
    }
}
