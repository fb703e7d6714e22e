package io.twsecodes.codes.store;

import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.CategoryFilter;
import io.twsecodes.codes.schema.CodesCategory;
import io.twsecodes.codes.schema.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One CSV file per query under a cache directory: {@code stock.csv}, {@code etf.csv}, ...,
 * {@code all.csv}. Files carry no freshness information and are served until invalidated.
 * Writes land in a temporary file first and are moved into place, so a reader never sees half a file.
 */
public class DiskCacheTier implements CodesTier {
    private static final Logger LOG = LoggerFactory.getLogger(DiskCacheTier.class);
    private static final String SUFFIX = ".csv";

    private final Path dir;

    public DiskCacheTier(Path dir) {
        this.dir = dir;
    }

    @Override
    public String name() { return "cache"; }

    public Path fileFor(CategoryFilter filter) {
        return dir.resolve(filter.key() + SUFFIX);
    }

    @Override
    public TierResult lookup(CategoryFilter filter) {
        Path file = fileFor(filter);
        if (!Files.isRegularFile(file)) return new TierResult.NotFound("no cache file " + file.getFileName());
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return TierResult.of(CodesCsv.read(in, file.toString()), "cache file " + file.getFileName() + " is empty");
        } catch (IOException | StorageException e) {
            return TierResult.failed("cache file " + file + " unreadable: " + e.getMessage(), e);
        }
    }

    public void store(CategoryFilter filter, List<ListingRecord> records) throws StorageException {
        Path file = fileFor(filter);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, filter.key() + ".", ".tmp");
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                CodesCsv.write(out, records);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Cached {} records in {}", records.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Could not write cache file " + file, e);
        }
    }

    /**
     * Removes the files this cache writes, one per category plus {@code all}. Other files in the
     * directory are left alone, so the cache may share a directory with the fallback CSV.
     */
    public void invalidate() throws StorageException {
        if (!Files.isDirectory(dir)) return;
        List<CategoryFilter> owned = new ArrayList<>();
        owned.add(CategoryFilter.all());
        for (CodesCategory c : CodesCategory.values()) owned.add(CategoryFilter.of(c));
        int removed = 0;
        for (CategoryFilter filter : owned) {
            Path f = fileFor(filter);
            try {
                if (Files.deleteIfExists(f)) removed++;
            } catch (IOException e) {
                throw new StorageException("Could not remove cache file " + f, e);
            }
        }
        LOG.info("Cleared {} codes cache files in {}", removed, dir);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary cache file {}", tmp, e);
        }
    }
}
