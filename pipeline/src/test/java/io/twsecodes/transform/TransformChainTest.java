package io.twsecodes.transform;

import io.twsecodes.core.Record;
import io.twsecodes.core.Transform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformChainTest {
    @Test
    void applies_stages_in_order_and_reindexes() throws Exception {
        Transform<String, String> stage1 = r -> List.of(new Record<>(r.seq(), 3, r.payload() + "A"));
        Transform<String, String> stage2 = r -> List.of(new Record<>(r.seq(), 7, r.payload() + "B"));
        TransformChain<String, String, String> chain = TransformChain.of(stage1, stage2);
        List<Record<String>> out = chain.apply(new Record<>(42, 0, ""));
        assertEquals(1, out.size());
        assertEquals(42, out.get(0).seq());
        assertEquals(0, out.get(0).subSeq());
        assertEquals("AB", out.get(0).payload());
    }

    @Test
    void flattens_fan_out_of_first_stage() throws Exception {
        Transform<String, String> split = r -> List.of(
                r.withPayload(0, r.payload() + "1"),
                r.withPayload(1, r.payload() + "2"));
        Transform<String, Integer> length = r -> List.of(r.withPayload(0, r.payload().length()));
        Transform<Integer, String> show = r -> List.of(r.withPayload(0, "n=" + r.payload()));
        List<Record<String>> out = TransformChain.of(split, length).then(show).apply(new Record<>(5, 0, "ab"));
        assertEquals(2, out.size());
        assertEquals(new Record<>(5, 0, "n=3"), out.get(0));
        assertEquals(new Record<>(5, 1, "n=3"), out.get(1));
    }

    @Test
    void empty_first_stage_yields_nothing() throws Exception {
        Transform<String, String> none = r -> List.of();
        Transform<String, String> boom = r -> { throw new AssertionError("must not be called"); };
        assertTrue(TransformChain.of(none, boom).apply(new Record<>(1, 0, "x")).isEmpty());
    }
}
