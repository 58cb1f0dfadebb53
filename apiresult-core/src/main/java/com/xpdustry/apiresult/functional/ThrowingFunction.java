package com.xpdustry.apiresult.functional;

/**
 * A function that may fail with a checked exception.
 * Used by the {@code try*} operators, which wrap whatever it throws into a failed result.
 */
@FunctionalInterface
public interface ThrowingFunction<I, O, X extends Exception> {

    O apply(final I input) throws X;
}
