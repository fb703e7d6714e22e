package io.twsecodes.codes.parse;

import io.twsecodes.codes.error.CategorySequenceException;
import io.twsecodes.codes.error.ListingParseException;
import io.twsecodes.codes.error.TableNotFoundException;
import io.twsecodes.codes.error.UnrecognizedCategoryException;
import io.twsecodes.codes.source.FetchedPage;
import io.twsecodes.codes.source.ListingSource;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.Charset;
import java.util.List;

import static io.twsecodes.codes.ListingPages.*;
import static org.junit.jupiter.api.Assertions.*;

class TableParserTest {
    private final TableParser parser = new TableParser();

    @Test
    void categoryCarriesOverUntilNextHeader() throws Exception {
        String html = page(
                header("股票"),
                stock("1101", "台泥"), stock("2317", "鴻海"), stock("2330", "台積電"),
                header("ETF"),
                row("0050", "元大台灣50", "TW0000050004", "2003/06/30", "上市", "", "CEOGEU"),
                row("0056", "元大高股息", "TW0000056001", "2007/12/26", "上市", "", "CEOGEU"));

        List<List<String>> rows = parser.parse(html, ListingSource.LISTED);

        assertEquals(5, rows.size());
        assertEquals(List.of("1101", "2317", "2330", "0050", "0056"), rows.stream().map(r -> r.get(0)).toList());
        assertEquals(List.of("股票", "股票", "股票", "ETF", "ETF"), rows.stream().map(r -> r.get(2)).toList());
    }

    @Test
    void dataRowKeepsRemainingCellsInColumnOrder() throws Exception {
        List<List<String>> rows = parser.parse(page(header("股票"),
                row("2330", "台積電", "TW0002330008", "1994/09/05", "上市", "半導體業", "ESVUFR")), ListingSource.LISTED);
        assertEquals(List.of("2330", "台積電", "股票", "TW0002330008", "1994/09/05", "上市", "半導體業", "ESVUFR", ""), rows.get(0));
    }

    @Test
    void splitsSymbolAndNameOnIdeographicSpace() throws Exception {
        List<List<String>> rows = parser.parse(page(header("上市認購(售)權證"),
                row("91 01", "某權證", "TW0009101000", "2020/01/02", "上市", "", "RWSCCE")), ListingSource.LISTED);
        assertEquals("9101", rows.get(0).get(0));
        assertEquals("某權證", rows.get(0).get(1));
        assertEquals("上市認購(售)權證", rows.get(0).get(2));
    }

    @Test
    void symbolWithoutNameSeparatorGetsEmptyName() throws Exception {
        String html = page(header("股票"),
                "<tr><td>2330</td><td>TW0002330008</td><td>1994/09/05</td><td>上市</td><td>半導體業</td><td>ESVUFR</td><td></td></tr>");
        List<String> row = parser.parse(html, ListingSource.OTC).get(0);
        assertEquals("2330", row.get(0));
        assertEquals("", row.get(1));
    }

    @Test
    void futuresRowsAreAllIndexWithEmptyListingDateAndMarket() throws Exception {
        String html = page(
                futuresRow("IX0001", "發行量加權股價指數", "TW0000IX0012"),
                futuresRow("IX0043", "臺灣50指數", "TW0000IX0436"));

        List<List<String>> rows = parser.parse(html, ListingSource.FUTURES_INDEX);

        assertEquals(2, rows.size());
        for (List<String> r : rows) {
            assertEquals(9, r.size());
            assertEquals("指數", r.get(2));
            assertEquals("", r.get(4));
            assertEquals("", r.get(5));
            assertEquals("MRIXXX", r.get(7));
        }
        assertEquals(List.of("IX0001", "發行量加權股價指數", "指數", "TW0000IX0012", "", "", "", "MRIXXX", ""), rows.get(0));
    }

    @Test
    void futuresSourceIgnoresSingleCellRowsAsHeaders() {
        // a single cell on the futures page is a malformed data row, not a category switch
        assertThrows(ListingParseException.class,
                () -> parser.parse(page(header("股票")), ListingSource.FUTURES_INDEX));
    }

    @Test
    void missingTableIsAStructuralError() {
        TableNotFoundException e = assertThrows(TableNotFoundException.class,
                () -> parser.parse("<html><body><table class='h1'><tr><td>x</td></tr></table></body></html>", ListingSource.LISTED));
        assertTrue(e.getMessage().contains("table.h4"));
    }

    @Test
    void dataRowBeforeAnyHeaderIsASequencingError() {
        assertThrows(CategorySequenceException.class,
                () -> parser.parse(page(stock("2330", "台積電"), header("股票")), ListingSource.LISTED));
    }

    @Test
    void unknownHeaderIsRejected() {
        UnrecognizedCategoryException e = assertThrows(UnrecognizedCategoryException.class,
                () -> parser.parse(page(header("債券"), stock("2330", "台積電")), ListingSource.OTC));
        assertEquals("債券", e.label());
    }

    @Test
    void rowsWithUnexpectedCellCountAreRejected() {
        String shortRow = "<tr><td>2330" + SEP + "台積電</td><td>TW0002330008</td></tr>";
        assertThrows(ListingParseException.class, () -> parser.parse(page(header("股票"), shortRow), ListingSource.LISTED));
    }

    @Test
    void headerOnlyTableYieldsNothing() throws Exception {
        assertTrue(parser.parse(page(), ListingSource.LISTED).isEmpty());
        assertTrue(parser.parse(page(header("股票")), ListingSource.LISTED).isEmpty());
    }

    @Test
    void decodesPageBytesWithDeclaredCharset() throws Exception {
        Charset big5 = Charset.forName("Big5");
        String html = page(header("股票"), stock("2330", "台積電"));
        FetchedPage fetched = new FetchedPage(ListingSource.LISTED, URI.create("http://localhost/listed"), html.getBytes(big5), "Big5");

        List<List<String>> rows = parser.parse(fetched);

        assertEquals("台積電", rows.get(0).get(1));
        assertEquals("股票", rows.get(0).get(2));
    }

    @Test
    void unknownCharsetIsAParseError() {
        FetchedPage fetched = new FetchedPage(ListingSource.LISTED, URI.create("http://localhost/listed"), new byte[] {1}, "no-such-charset");
        assertThrows(ListingParseException.class, () -> parser.parse(fetched));
    }
}
