package io.twsecodes.codes.parse;

import io.twsecodes.codes.error.CategorySequenceException;
import io.twsecodes.codes.error.ListingParseException;
import io.twsecodes.codes.error.TableNotFoundException;
import io.twsecodes.codes.schema.CodesCategory;
import io.twsecodes.codes.schema.DataColumn;
import io.twsecodes.codes.source.FetchedPage;
import io.twsecodes.codes.source.ListingSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the listing table of an ISIN page into flat rows in {@link DataColumn} order.
 *
 * <p>On the exchange-listed and OTC pages the category is not a column. It is a row with a
 * single cell ("股票", "ETF", ...) that applies to every data row below it until the next such
 * row. The futures/index page has no header rows; all of its rows are {@link CodesCategory#INDEX}
 * and lack the listing-date and market-type columns, which are filled with empty strings.
 *
 * <p>The first cell of a data row holds code and name separated by an ideographic space
 * (U+3000). Regular spaces inside the code are dropped, so {@code "91 01"} becomes {@code "9101"}.
 */
public class TableParser {
    public static final String TABLE_SELECTOR = "table.h4";
    static final char NAME_SEPARATOR = '\u3000';

    /** code+name, ISIN, listing date, market, industry, CFI, notes */
    static final int LISTED_CELLS = 7;
    /** code+name, ISIN, industry, CFI, notes */
    static final int FUTURES_CELLS = 5;
    private static final int FUTURES_PLACEHOLDER_AT = 2;

    public List<List<String>> parse(FetchedPage page) throws ListingParseException {
        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(page.body()), page.charset(), page.uri().toString());
        } catch (IOException | IllegalArgumentException e) {
            throw new ListingParseException("Unreadable " + page.source() + " page: " + e.getMessage(), e);
        }
        return parse(doc, page.source());
    }

    public List<List<String>> parse(String html, ListingSource source) throws ListingParseException {
        return parse(Jsoup.parse(html), source);
    }

    public List<List<String>> parse(Document doc, ListingSource source) throws ListingParseException {
        Element table = doc.selectFirst(TABLE_SELECTOR);
        if (table == null) throw new TableNotFoundException(source.name(), TABLE_SELECTOR);

        Elements rows = table.select("tr");
        CodesCategory current = source.fixedCategory().orElse(null);
        boolean fixed = source.fixedCategory().isPresent();
        List<List<String>> out = new ArrayList<>();

        // row 0 is the column header
        for (int i = 1; i < rows.size(); i++) {
            List<String> cells = new ArrayList<>();
            for (Element td : rows.get(i).select("td")) cells.add(td.text());
            if (cells.isEmpty()) continue;

            if (fixed) {
                checkArity(source, i, cells, FUTURES_CELLS);
                cells.add(FUTURES_PLACEHOLDER_AT, "");
                cells.add(FUTURES_PLACEHOLDER_AT, "");
            } else if (cells.size() == 1) {
                current = CodesCategory.fromLabel(cells.get(0).strip());
                continue;
            } else {
                if (current == null) throw new CategorySequenceException(source.name(), i);
                checkArity(source, i, cells, LISTED_CELLS);
            }
            out.add(toTuple(source, i, current, cells));
        }
        return out;
    }

    private static List<String> toTuple(ListingSource source, int row, CodesCategory category, List<String> cells)
            throws ListingParseException {
        String first = cells.get(0);
        int sep = first.indexOf(NAME_SEPARATOR);
        String symbol = (sep < 0 ? first : first.substring(0, sep)).replace(" ", "").strip();
        String name = sep < 0 ? "" : first.substring(sep + 1).strip();
        if (symbol.isEmpty()) {
            throw new ListingParseException("Empty symbol in row " + row + " of " + source + " page");
        }
        List<String> tuple = new ArrayList<>(DataColumn.count());
        tuple.add(symbol);
        tuple.add(name);
        tuple.add(category.label());
        for (int c = 1; c < cells.size(); c++) tuple.add(cells.get(c).strip());
        return tuple;
    }

    private static void checkArity(ListingSource source, int row, List<String> cells, int expected)
            throws ListingParseException {
        if (cells.size() != expected) {
            throw new ListingParseException("Row " + row + " of " + source + " page has " + cells.size()
                    + " cells, expected " + expected);
        }
    }
}
