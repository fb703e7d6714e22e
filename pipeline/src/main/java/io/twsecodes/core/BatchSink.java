package io.twsecodes.core;

import java.util.List;

/** Sink that can take a whole batch at once, e.g. inside one transaction. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;
}
