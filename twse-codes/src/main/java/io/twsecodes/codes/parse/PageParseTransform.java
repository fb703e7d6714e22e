package io.twsecodes.codes.parse;

import io.twsecodes.codes.error.ListingParseException;
import io.twsecodes.codes.schema.DataColumn;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.schema.RecordSchema;
import io.twsecodes.codes.source.FetchedPage;
import io.twsecodes.core.Record;
import io.twsecodes.core.Transform;
import io.twsecodes.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a fetched page and types each row into a {@link ListingRecord}, normalizing fields on the way.
 */
public class PageParseTransform implements Transform<FetchedPage, ListingRecord> {
    private static final Logger LOG = LoggerFactory.getLogger(PageParseTransform.class);

    private final TableParser parser;
    private final Metrics metrics;

    public PageParseTransform(TableParser parser, Metrics metrics) {
        this.parser = parser;
        this.metrics = metrics == null ? new Metrics(null) : metrics;
    }

    @Override
    public List<Record<ListingRecord>> apply(Record<FetchedPage> input) throws ListingParseException {
        FetchedPage page = input.payload();
        List<List<String>> rows = parser.parse(page);
        List<Record<ListingRecord>> out = new ArrayList<>(rows.size());
        int sub = 0;
        for (List<String> row : rows) {
            out.add(input.withPayload(sub++, toRecord(normalize(row))));
        }
        metrics.inc("codes.parse.rows", out.size());
        LOG.info("Parsed {} rows from {} page", out.size(), page.source());
        return out;
    }

    private static ListingRecord toRecord(List<String> row) throws ListingParseException {
        try {
            return RecordSchema.fromRow(row);
        } catch (IllegalArgumentException e) {
            throw new ListingParseException(e.getMessage(), e);
        }
    }

    /** Listing dates arrive as YYYY/MM/DD; stored as YYYYMMDD. */
    static List<String> normalize(List<String> row) {
        List<String> out = new ArrayList<>(row);
        int dl = DataColumn.DATE_OF_LISTING.ordinal();
        out.set(dl, normalizeDate(out.get(dl)));
        return out;
    }

    static String normalizeDate(String published) {
        if (published == null) return "";
        return published.strip().replace("/", "").replace("-", "");
    }
}
