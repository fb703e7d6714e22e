package io.twsecodes.codes.store;

import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.error.UnrecognizedCategoryException;
import io.twsecodes.codes.schema.CategoryFilter;
import io.twsecodes.codes.schema.DataColumn;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.schema.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Listing codes in a relational table keyed by symbol. Column names are the short keys of
 * {@link DataColumn}; the category column stores the published label.
 */
public class JdbcCodesRepository implements CodesRepository {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcCodesRepository.class);
    public static final String DEFAULT_TABLE = "twse";

    private final ConnectionProvider connections;
    private final String table;

    public JdbcCodesRepository(ConnectionProvider connections) {
        this(connections, DEFAULT_TABLE);
    }

    public JdbcCodesRepository(ConnectionProvider connections, String table) {
        this.connections = connections;
        this.table = table;
    }

    @Override
    public String name() { return "database"; }

    public boolean tableExists() throws StorageException {
        try (Connection c = connections.getConnection()) {
            return tableExists(c);
        } catch (SQLException e) {
            throw new StorageException("Could not inspect table " + table, e);
        }
    }

    /** Creates the table when it is missing. */
    public void provision() throws StorageException {
        try (Connection c = connections.getConnection()) {
            provision(c);
        } catch (SQLException e) {
            throw new StorageException("Could not create table " + table, e);
        }
    }

    @Override
    public TierResult lookup(CategoryFilter filter) {
        try (Connection c = connections.getConnection()) {
            if (!tableExists(c)) return new TierResult.NotFound("table " + table + " does not exist");
            String q = quote(c);
            String sql = "SELECT " + columnList(q) + " FROM " + q + table + q
                    + (filter instanceof CategoryFilter.Specific ? " WHERE " + q + DataColumn.CATEGORY.shortName() + q + " = ?" : "")
                    + " ORDER BY " + q + DataColumn.SYMBOL.shortName() + q;
            List<ListingRecord> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (filter instanceof CategoryFilter.Specific s) ps.setString(1, s.category().label());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(readRow(rs));
                }
            }
            return TierResult.of(out, "table " + table + " has no " + filter.key() + " rows");
        } catch (SQLException e) {
            return TierResult.failed("database unavailable: " + e.getMessage(), e);
        } catch (UnrecognizedCategoryException e) {
            return TierResult.failed("table " + table + " holds an unknown category: " + e.label(), e);
        }
    }

    /**
     * Drops a table with an outdated layout and provisions the table if needed, then deletes
     * every row and inserts {@code records} in one
     * transaction. On failure the previous contents are kept.
     */
    @Override
    public int replaceAll(List<ListingRecord> records) throws StorageException {
        try (Connection c = connections.getConnection()) {
            dropIfStale(c);
            provision(c);
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            String q = quote(c);
            String placeholders = DataColumn.shortNames().stream().map(x -> "?").collect(Collectors.joining(", "));
            try (Statement del = c.createStatement();
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO " + q + table + q + " (" + columnList(q) + ") VALUES (" + placeholders + ")")) {
                int removed = del.executeUpdate("DELETE FROM " + q + table + q);
                for (ListingRecord r : records) {
                    String[] row = RecordSchema.toRow(r);
                    for (int i = 0; i < row.length; i++) ins.setString(i + 1, row[i]);
                    if (r.notes() == null) ins.setNull(DataColumn.NOTES.ordinal() + 1, java.sql.Types.VARCHAR);
                    ins.addBatch();
                }
                int affected = 0;
                for (int n : ins.executeBatch()) affected += (n == Statement.SUCCESS_NO_INFO) ? 1 : Math.max(0, n);
                c.commit();
                LOG.info("Replaced {} rows of {} with {} rows", removed, table, affected);
                return affected;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StorageException("Could not insert data into table " + table + ": " + e.getMessage(), e);
        }
    }

    private boolean tableExists(Connection c) throws SQLException {
        DatabaseMetaData meta = c.getMetaData();
        try (ResultSet rs = meta.getTables(null, null, table, new String[] {"TABLE"})) {
            return rs.next();
        }
    }

    /**
     * A table left by an older layout (missing columns, non-text columns) cannot take a full
     * replace; it is dropped so {@link #provision(Connection)} recreates it.
     */
    private void dropIfStale(Connection c) throws SQLException {
        if (!tableExists(c)) return;
        Map<String, String> existing = new HashMap<>();
        DatabaseMetaData meta = c.getMetaData();
        try (ResultSet rs = meta.getColumns(null, null, table, null)) {
            while (rs.next()) {
                existing.put(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT),
                        String.valueOf(rs.getString("TYPE_NAME")).toUpperCase(Locale.ROOT));
            }
        }
        boolean current = existing.size() == DataColumn.count();
        for (String col : DataColumn.shortNames()) {
            String type = existing.get(col.toLowerCase(Locale.ROOT));
            if (type == null || !type.contains("CHAR")) current = false;
        }
        if (current) return;
        LOG.warn("Table {} has an outdated layout {}; dropping it", table, existing);
        String q = quote(c);
        try (Statement s = c.createStatement()) {
            s.execute("DROP TABLE " + q + table + q);
        }
    }

    private void provision(Connection c) throws SQLException {
        if (tableExists(c)) return;
        String q = quote(c);
        StringBuilder ddl = new StringBuilder("CREATE TABLE ").append(q).append(table).append(q).append(" (");
        for (DataColumn col : DataColumn.values()) {
            if (col.ordinal() > 0) ddl.append(", ");
            ddl.append(q).append(col.shortName()).append(q);
            if (col == DataColumn.SYMBOL) ddl.append(" VARCHAR(20) NOT NULL PRIMARY KEY");
            else if (col == DataColumn.NOTES) ddl.append(" VARCHAR(255)");
            else ddl.append(" VARCHAR(255) NOT NULL");
        }
        ddl.append(")");
        try (Statement s = c.createStatement()) {
            s.execute(ddl.toString());
        }
        LOG.info("Created table {}", table);
    }

    private static ListingRecord readRow(ResultSet rs) throws SQLException, UnrecognizedCategoryException {
        List<String> row = new ArrayList<>(DataColumn.count());
        for (int i = 1; i <= DataColumn.count(); i++) row.add(rs.getString(i));
        return RecordSchema.fromRow(row);
    }

    private static String columnList(String q) {
        return DataColumn.shortNames().stream().map(n -> q + n + q).collect(Collectors.joining(", "));
    }

    private static String quote(Connection c) throws SQLException {
        String q = c.getMetaData().getIdentifierQuoteString();
        return q == null || q.isBlank() ? "" : q;
    }
}
