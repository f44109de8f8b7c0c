package org.javai.retry;

/**
 * A supplier that may throw a checked exception.
 * Used as the blocking form of a retried operation.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
