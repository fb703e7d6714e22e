package io.twsecodes.codes.store;

import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.CategoryFilter;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.schema.RecordSchema;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Static snapshot of the code list shipped with the application, or a file configured in its place.
 * The file is read whole and filtered in memory.
 */
public class CsvFallbackTier implements CodesTier {
    public static final String BUNDLED_RESOURCE = "/codes.csv";

    private final Path file;
    private final String resource;

    private CsvFallbackTier(Path file, String resource) {
        this.file = file;
        this.resource = resource;
    }

    public static CsvFallbackTier ofFile(Path file) {
        return new CsvFallbackTier(file, null);
    }

    public static CsvFallbackTier bundled() {
        return ofResource(BUNDLED_RESOURCE);
    }

    public static CsvFallbackTier ofResource(String resource) {
        return new CsvFallbackTier(null, resource);
    }

    @Override
    public String name() { return "csv"; }

    private String origin() { return file != null ? file.toString() : "classpath:" + resource; }

    @Override
    public TierResult lookup(CategoryFilter filter) {
        try (Reader in = open()) {
            if (in == null) return new TierResult.NotFound(origin() + " does not exist");
            List<ListingRecord> all = CodesCsv.read(in, origin());
            return TierResult.of(RecordSchema.mergeBySymbol(RecordSchema.filter(all, filter)),
                    origin() + " has no " + filter.key() + " rows");
        } catch (IOException | StorageException e) {
            return TierResult.failed(origin() + " unreadable: " + e.getMessage(), e);
        }
    }

    private Reader open() throws IOException {
        if (file != null) {
            return Files.isRegularFile(file) ? Files.newBufferedReader(file, StandardCharsets.UTF_8) : null;
        }
        InputStream stream = CsvFallbackTier.class.getResourceAsStream(resource);
        return stream == null ? null : new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    }
}
