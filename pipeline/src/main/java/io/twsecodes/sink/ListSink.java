package io.twsecodes.sink;

import io.twsecodes.core.BatchSink;
import io.twsecodes.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects payloads in arrival order. Used when the caller wants the pipeline output in memory.
 */
public class ListSink<T> implements BatchSink<T> {
    private final List<T> items = new ArrayList<>();

    @Override
    public void accept(Record<T> record) {
        items.add(record.payload());
    }

    @Override
    public void acceptBatch(List<Record<T>> records) {
        for (Record<T> r : records) accept(r);
    }

    public List<T> items() { return List.copyOf(items); }

    public int size() { return items.size(); }
}
