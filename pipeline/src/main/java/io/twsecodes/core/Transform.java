package io.twsecodes.core;

import java.util.List;

/**
 * Maps one input record to zero or more outputs. Outputs keep the input's seq and number
 * their subSeq from zero.
 */
@FunctionalInterface
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;
}
