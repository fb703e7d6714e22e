package io.twsecodes.codes.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.twsecodes.codes.DownloadOrchestrator;
import io.twsecodes.codes.RefreshResult;
import io.twsecodes.codes.config.CodesConfig;
import io.twsecodes.codes.config.CodesModule;
import io.twsecodes.codes.error.CodesException;
import io.twsecodes.codes.schema.CategoryFilter;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.store.CodesCsv;
import io.twsecodes.codes.store.ConnectionProvider;
import io.twsecodes.codes.store.TieredStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI to download the TWSE ISIN code lists and query them.
 */
@CommandLine.Command(name = "twse-codes", mixinStandardHelpOptions = true,
        description = "Downloads the latest TWSE security codes and reads them back through cache, database and bundled CSV")
public final class TwseCodesMain implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(TwseCodesMain.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_NOT_PERSISTED = 3;

    @CommandLine.Option(names = {"-d", "--download"}, description = "Download codes from TWSE and replace the database contents")
    boolean download;

    @CommandLine.Option(names = {"-g", "--get"}, description = "Get codes (cache, database, bundled CSV, then download)")
    boolean get;

    @CommandLine.Option(names = {"-c", "--category"}, defaultValue = "ALL", converter = CategoryFilterConverter.class,
            description = "ALL or one of STOCK, WARRANT, SPECIAL_STOCK, INNOVATION_BOARD, ETF, ETN, TDR, ASSET_BASED_SECURITIES, REIT, OTC_WARRANT, INDEX (default: ${DEFAULT-VALUE})")
    CategoryFilter category;

    @CommandLine.Option(names = {"-s", "--symbols-only"}, description = "Print symbols only")
    boolean symbolsOnly;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Also write the records to this CSV file; with both --download and --get, the query result")
    Path output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Injector injector;

    public TwseCodesMain() { this(null); }

    TwseCodesMain(Injector injector) { this.injector = injector; }

    public static void main(String[] args) {
        int code = new CommandLine(new TwseCodesMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        Injector inj = injector != null ? injector : Guice.createInjector(new CodesModule(CodesConfig.fromEnv()));
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            int code = 0;
            List<ListingRecord> last = null;
            if (download) {
                RefreshResult result = inj.getInstance(DownloadOrchestrator.class).refresh();
                last = result.records();
                print(out, last);
                if (!result.persisted()) {
                    err.println("warning: " + result.warningMessage().orElse("records were not persisted"));
                    code = EXIT_NOT_PERSISTED;
                }
            }
            if (get || !download) {
                last = inj.getInstance(TieredStore.class).query(category);
                print(out, last);
            }
            out.flush();
            // with both -d and -g the file holds the query result
            if (output != null) writeOutput(last);
            return code;
        } catch (CodesException e) {
            LOG.debug("Command failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            if (injector == null) inj.getInstance(ConnectionProvider.class).close();
        }
    }

    private void print(PrintWriter out, List<ListingRecord> records) throws IOException {
        if (symbolsOnly) {
            for (ListingRecord r : records) out.println(r.symbol());
        } else {
            CodesCsv.write(out, records);
        }
    }

    private void writeOutput(List<ListingRecord> records) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            CodesCsv.write(w, records);
        }
        LOG.debug("Wrote {} records to {}", records.size(), output);
    }

    public static final class CategoryFilterConverter implements CommandLine.ITypeConverter<CategoryFilter> {
        @Override
        public CategoryFilter convert(String value) {
            try {
                return CategoryFilter.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
