package io.twsecodes.codes.source;

import io.twsecodes.core.Record;
import io.twsecodes.core.Source;

import java.util.List;
import java.util.Optional;

/**
 * Emits a fixed list of listing sources as records, then completes.
 */
public class ListingSourceList implements Source<ListingSource> {
    private final List<ListingSource> sources;
    private int idx = 0;

    public ListingSourceList(List<ListingSource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public Optional<Record<ListingSource>> poll() {
        if (idx >= sources.size()) return Optional.empty();
        Record<ListingSource> r = new Record<>(idx, 0, sources.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= sources.size();
    }
}
