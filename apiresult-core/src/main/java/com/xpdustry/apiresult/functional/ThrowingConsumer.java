package com.xpdustry.apiresult.functional;

/**
 * A consumer that may fail with a checked exception.
 */
@FunctionalInterface
public interface ThrowingConsumer<I, X extends Exception> {

    void accept(final I input) throws X;

    default ThrowingFunction<I, I, X> asFunction() {
        return input -> {
            this.accept(input);
            return input;
        };
    }
}
