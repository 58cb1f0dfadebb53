package com.xpdustry.apiresult;

import org.jspecify.annotations.Nullable;

/**
 * Produced by the gating operators ({@code errorIf}, {@code errorUnless}, {@code errorOnNull}, {@code require})
 * when their condition does not hold.
 */
public final class ConditionNotSatisfiedException extends IllegalArgumentException {

    public ConditionNotSatisfiedException() {
        this("ApiResult condition was not satisfied");
    }

    public ConditionNotSatisfiedException(final @Nullable String message) {
        super(message);
    }
}
