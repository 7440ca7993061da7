package org.javai.resilient.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Boundary} to wrap a blocking transport call.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
