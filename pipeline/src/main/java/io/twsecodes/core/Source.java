package io.twsecodes.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * Produces records in seq order.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record, or empty once the source has nothing more to give. Finite sources
     * report completion through {@link #isFinished()}.
     */
    Optional<Record<T>> poll();

    boolean isFinished();

    @Override
    default void close() {}
}
