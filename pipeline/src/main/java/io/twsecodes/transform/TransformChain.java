package io.twsecodes.transform;

import io.twsecodes.core.Record;
import io.twsecodes.core.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Two transforms applied back to back, outputs of the first flattened into the second.
 * Final outputs are renumbered so subSeq runs 0..n-1 under the input's seq.
 */
public class TransformChain<I, M, O> implements Transform<I, O> {
    private final Transform<I, M> first;
    private final Transform<M, O> second;

    public TransformChain(Transform<I, M> first, Transform<M, O> second) {
        this.first = first;
        this.second = second;
    }

    public static <I, M, O> TransformChain<I, M, O> of(Transform<I, M> first, Transform<M, O> second) {
        return new TransformChain<>(first, second);
    }

    public <P> TransformChain<I, O, P> then(Transform<O, P> next) {
        return new TransformChain<>(this, next);
    }

    @Override
    public List<Record<O>> apply(Record<I> input) throws Exception {
        List<Record<O>> out = new ArrayList<>();
        for (Record<M> mid : first.apply(input)) {
            List<Record<O>> produced = second.apply(mid);
            if (produced != null) out.addAll(produced);
        }
        List<Record<O>> result = new ArrayList<>(out.size());
        int i = 0;
        for (Record<O> r : out) {
            result.add(new Record<>(input.seq(), i++, r.payload()));
        }
        return result;
    }
}
