package com.govsense.pipeline.storage;

import com.govsense.pipeline.exception.StorageCommitException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * JDBC implementation of the storage contract.
 *
 * Upserts run as UPDATE-by-key then INSERT-the-rest inside a single
 * transaction per table, which keeps the SQL portable across PostgreSQL and
 * the embedded databases used in tests. Readers never see a half-written batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcStorageGateway implements StorageGateway {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");
        for (TableDefinition table : TableDefinition.ALL) {
            jdbcTemplate.execute(table.ddl());
        }
        log.info("Database schema ready.");
    }

    @Override
    public int upsertBatch(String table, List<Map<String, Object>> rows, List<String> naturalKey) {
        requireIdentifier(table);
        naturalKey.forEach(JdbcStorageGateway::requireIdentifier);
        if (rows.isEmpty()) return 0;

        List<String> columns = columnsOf(rows);
        for (String key : naturalKey) {
            if (!columns.contains(key)) {
                throw new IllegalArgumentException("Natural key column " + key + " absent from rows for " + table);
            }
        }
        List<String> valueColumns = columns.stream().filter(c -> !naturalKey.contains(c)).toList();

        log.info("Upserting {} rows into {} keyed by {}", rows.size(), table, naturalKey);
        try {
            Integer inserted = transactionTemplate.execute(status -> {
                List<Map<String, Object>> missing = updateExisting(table, rows, naturalKey, valueColumns);
                insert(table, missing, columns);
                return missing.size();
            });
            log.info("Committed {} rows into {} ({} new, {} replaced)",
                    rows.size(), table, inserted, rows.size() - (inserted == null ? 0 : inserted));
            return rows.size();

        } catch (DataAccessException | TransactionException | IllegalStateException e) {
            log.error("Upsert into {} rolled back: {}", table, e.getMessage(), e);
            throw new StorageCommitException(table, "Commit to " + table + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> read(String table, Map<String, Object> filter) {
        TableDefinition definition = TableDefinition.byName(table)
                .orElseThrow(() -> new IllegalArgumentException("Unknown table: " + table));

        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        filter.forEach((column, value) -> {
            if (value == null) return;
            requireIdentifier(column);
            conditions.add(column + " = ?");
            args.add(value);
        });

        String sql = "SELECT * FROM " + definition.name()
                + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions))
                + " ORDER BY " + String.join(", ", definition.naturalKey());

        return jdbcTemplate.queryForList(sql, args.toArray()).stream()
                .map(JdbcStorageGateway::lowerCaseKeys)
                .toList();
    }

    @Override
    public Map<String, Object> summary() {
        Map<String, Object> communes = jdbcTemplate.queryForMap(
                "SELECT COUNT(*) AS total_communes, COALESCE(SUM(population), 0) AS total_population FROM "
                        + TableDefinition.COMMUNES.name());
        Map<String, Object> budgets = jdbcTemplate.queryForMap(
                "SELECT COUNT(DISTINCT region_code) AS total_regions, MIN(year) AS min_year, MAX(year) AS max_year FROM "
                        + TableDefinition.REGION_BUDGETS.name());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.putAll(lowerCaseKeys(communes));
        summary.putAll(lowerCaseKeys(budgets));
        return summary;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Updates rows whose key already exists and returns the rows that matched nothing.
     */
    private List<Map<String, Object>> updateExisting(String table, List<Map<String, Object>> rows,
                                                     List<String> naturalKey, List<String> valueColumns) {
        String where = naturalKey.stream().map(k -> k + " = ?").collect(Collectors.joining(" AND "));
        int[] counts;
        if (valueColumns.isEmpty()) {
            String sql = "SELECT COUNT(*) FROM " + table + " WHERE " + where;
            counts = rows.stream()
                    .mapToInt(row -> jdbcTemplate.queryForObject(sql, Integer.class, values(row, naturalKey)))
                    .toArray();
        } else {
            String sql = "UPDATE " + table + " SET "
                    + valueColumns.stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
                    + " WHERE " + where;
            List<Object[]> batch = rows.stream()
                    .map(row -> concat(values(row, valueColumns), values(row, naturalKey)))
                    .toList();
            counts = jdbcTemplate.batchUpdate(sql, batch);
        }

        List<Map<String, Object>> missing = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (counts[i] == Statement.SUCCESS_NO_INFO) {
                throw new IllegalStateException("Driver did not report update counts for " + table);
            }
            if (counts[i] == 0) {
                missing.add(rows.get(i));
            }
        }
        return missing;
    }

    private void insert(String table, List<Map<String, Object>> rows, List<String> columns) {
        if (rows.isEmpty()) return;
        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
        jdbcTemplate.batchUpdate(sql, rows.stream().map(row -> values(row, columns)).toList());
    }

    private static List<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        columns.forEach(JdbcStorageGateway::requireIdentifier);
        return List.copyOf(columns);
    }

    private static Object[] values(Map<String, Object> row, List<String> columns) {
        return columns.stream().map(row::get).toArray();
    }

    private static Object[] concat(Object[] a, Object[] b) {
        Object[] result = new Object[a.length + b.length];
        System.arraycopy(a, 0, result, 0, a.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static Map<String, Object> lowerCaseKeys(Map<String, Object> row) {
        Map<String, Object> result = new LinkedHashMap<>();
        row.forEach((k, v) -> result.put(k.toLowerCase(Locale.ROOT), v));
        return result;
    }

    // Table and column names are concatenated into SQL
    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
    }
}
