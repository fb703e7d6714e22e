package io.twsecodes.core;

/**
 * Envelope carried between pipeline stages. {@code seq} is assigned by the source,
 * {@code subSeq} orders the fan-out of a single input inside a transform.
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {

    public <R> Record<R> withPayload(int subSeq, R payload) {
        return new Record<>(seq, subSeq, payload);
    }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(seq, o.seq);
        return c != 0 ? c : Integer.compare(subSeq, o.subSeq);
    }
}
