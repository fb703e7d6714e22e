package io.twsecodes.codes.store;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.error.UnrecognizedCategoryException;
import io.twsecodes.codes.schema.DataColumn;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.schema.RecordSchema;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CSV layout shared by the bundled fallback file and the disk cache: a header of short column
 * names ({@code sc,cn,ca,...}) followed by one record per row.
 */
public final class CodesCsv {
    private CodesCsv() {}

    /**
     * Reads every row with a symbol; rows with a blank symbol are skipped.
     */
    public static List<ListingRecord> read(Reader in, String origin) throws IOException, StorageException {
        List<ListingRecord> out = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(in).withCSVParser(new RFC4180ParserBuilder().build()).build()) {
            String[] header = reader.readNext();
            if (header == null) return out;
            if (header.length > 0) header[0] = stripBom(header[0]);
            if (!Arrays.asList(header).equals(RecordSchema.header())) {
                throw new StorageException(origin + ": unexpected header " + Arrays.toString(header));
            }
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 0 || row[0].isBlank()) continue;
                if (row.length != DataColumn.count()) {
                    throw new StorageException(origin + ": line " + reader.getLinesRead() + " has " + row.length + " columns");
                }
                try {
                    out.add(RecordSchema.fromRow(Arrays.asList(row)));
                } catch (UnrecognizedCategoryException | IllegalArgumentException e) {
                    throw new StorageException(origin + ": line " + reader.getLinesRead() + ": " + e.getMessage(), e);
                }
            }
        } catch (CsvValidationException e) {
            throw new StorageException(origin + ": " + e.getMessage(), e);
        }
        return out;
    }

    public static void write(Writer out, List<ListingRecord> records) throws IOException {
        ICSVWriter writer = new CSVWriter(out, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
        writer.writeNext(RecordSchema.header().toArray(new String[0]), false);
        for (ListingRecord r : records) {
            writer.writeNext(RecordSchema.toRow(r), false);
        }
        writer.flush();
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
