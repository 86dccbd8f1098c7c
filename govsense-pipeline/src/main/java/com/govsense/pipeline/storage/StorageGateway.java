package com.govsense.pipeline.storage;

import java.util.List;
import java.util.Map;

/**
 * What the refresh pipeline and the read path need from the database.
 */
public interface StorageGateway {

    /**
     * Insert-or-update every row by its natural key, as one all-or-nothing unit.
     * A row whose key exists replaces that row's other columns; a new key inserts.
     *
     * @return number of rows committed
     * @throws com.govsense.pipeline.exception.StorageCommitException if the batch was rolled back
     */
    int upsertBatch(String table, List<Map<String, Object>> rows, List<String> naturalKey);

    /**
     * Rows of a table matching every equality filter (null filter values are ignored),
     * in natural key order. Column names are lower case.
     */
    List<Map<String, Object>> read(String table, Map<String, Object> filter);

    /**
     * Headline totals across the stored tables: commune count, distinct
     * budget regions, summed commune population and the budget year range.
     * Totals over empty tables are 0; the year bounds are null.
     */
    Map<String, Object> summary();
}
