package io.twsecodes.runtime;

import com.codahale.metrics.Timer;
import io.twsecodes.core.BatchSink;
import io.twsecodes.core.Record;
import io.twsecodes.core.Sink;
import io.twsecodes.core.Source;
import io.twsecodes.core.Transform;
import io.twsecodes.metrics.Metrics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-threaded source -> transform -> sink drain for finite sources.
 * The first failing stage aborts the run: no retries, no dead letters, and the sink only sees
 * the outputs of inputs that were fully transformed.
 */
public class SequentialPipeline<I, O> {
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Metrics metrics;

    public SequentialPipeline(Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.metrics = metrics == null ? new Metrics(null) : metrics;
        this.sourceTimer = this.metrics.timer("pipeline.source.time");
        this.transformTimer = this.metrics.timer("pipeline.transform.time");
        this.sinkTimer = this.metrics.timer("pipeline.sink.time");
    }

    /**
     * Drains the source to completion.
     *
     * @return number of records handed to the sink
     */
    public long run() throws Exception {
        long emitted = 0;
        try {
            while (!source.isFinished()) {
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                }
                if (next.isEmpty()) break;
                metrics.inc("pipeline.input.count");

                List<Record<O>> out;
                try (Timer.Context ignored = transformTimer.time()) {
                    out = transform.apply(next.get());
                } catch (Exception e) {
                    metrics.inc("pipeline.error.count");
                    throw e;
                }
                if (out == null || out.isEmpty()) continue;

                try (Timer.Context ignored = sinkTimer.time()) {
                    if (sink instanceof BatchSink<O> batch) {
                        batch.acceptBatch(out);
                    } else {
                        for (Record<O> r : out) sink.accept(r);
                    }
                }
                emitted += out.size();
                metrics.inc("pipeline.output.count", out.size());
            }
        } finally {
            source.close();
        }
        return emitted;
    }
}
