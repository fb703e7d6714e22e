package io.twsecodes.codes.store;

import io.twsecodes.codes.Fixtures;
import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.ListingRecord;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodesCsvTest {
    @Test
    void writeThenReadGivesBackTheSameRecords() throws Exception {
        StringWriter out = new StringWriter();
        CodesCsv.write(out, Fixtures.SAMPLE);

        String csv = out.toString();
        assertTrue(csv.startsWith("sc,cn,ca,ic,dl,ma,si,cc,no\n"));
        assertTrue(csv.contains("2330,台積電,股票,TW0002330008,19940905,上市,半導體業,ESVUFR,\"Note, with \"\"quotes\"\"\"\n"));

        List<ListingRecord> back = CodesCsv.read(new StringReader(csv), "test");
        assertEquals(Fixtures.SAMPLE, back);
    }

    @Test
    void skipsRowsWithoutSymbol() throws Exception {
        String csv = "sc,cn,ca,ic,dl,ma,si,cc,no\n"
                + ",孤兒,股票,,,,,,\n"
                + "1101,台泥,股票,TW0001101004,19620209,上市,水泥工業,ESVUFR,\n";
        List<ListingRecord> back = CodesCsv.read(new StringReader(csv), "test");
        assertEquals(1, back.size());
        assertEquals("1101", back.get(0).symbol());
    }

    @Test
    void toleratesByteOrderMark() throws Exception {
        String csv = "\uFEFFsc,cn,ca,ic,dl,ma,si,cc,no\n1101,台泥,股票,TW0001101004,19620209,上市,水泥工業,ESVUFR,\n";
        assertEquals(1, CodesCsv.read(new StringReader(csv), "test").size());
    }

    @Test
    void rejectsForeignLayouts() {
        assertThrows(StorageException.class,
                () -> CodesCsv.read(new StringReader("symbol,name\n2330,台積電\n"), "test"));
        assertThrows(StorageException.class,
                () -> CodesCsv.read(new StringReader("sc,cn,ca,ic,dl,ma,si,cc,no\n2330,台積電,債券,,,,,,\n"), "test"));
        assertThrows(StorageException.class,
                () -> CodesCsv.read(new StringReader("sc,cn,ca,ic,dl,ma,si,cc,no\n2330,台積電,股票\n"), "test"));
    }

    @Test
    void emptyInputReadsAsNoRecords() throws Exception {
        assertTrue(CodesCsv.read(new StringReader(""), "test").isEmpty());
    }
}
