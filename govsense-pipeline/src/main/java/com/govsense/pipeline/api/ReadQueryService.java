package com.govsense.pipeline.api;

import com.govsense.pipeline.cache.CacheKey;
import com.govsense.pipeline.cache.TtlCache;
import com.govsense.pipeline.model.DerivedRecord;
import com.govsense.pipeline.storage.StorageGateway;
import com.govsense.pipeline.storage.TableDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Read side of the stored data. Every query goes through the ttl cache and
 * only reaches the database on a miss.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReadQueryService {

    public static final String REGION_STATS = "region-stats";
    public static final String BUDGETS = "budgets";
    public static final String COMMUNES = "communes";
    public static final String EMPLOYMENT = "employment";
    public static final String DATASETS = "datasets";
    public static final String KPIS = "kpis";

    private static final Map<String, Function<String, Object>> FILTERS = Map.of(
            "region_code", ReadQueryService::regionCode,
            "year", ReadQueryService::year,
            "month", value -> value,
            "department_code", value -> value
    );

    private final StorageGateway storage;
    private final TtlCache cache;

    public List<Map<String, Object>> regionStats(String regionCode, String year) {
        return query(REGION_STATS, DerivedRecord.TABLE, filter("region_code", regionCode, "year", year));
    }

    public List<Map<String, Object>> budgets(String regionCode, String year) {
        return query(BUDGETS, TableDefinition.REGION_BUDGETS.name(), filter("region_code", regionCode, "year", year));
    }

    public List<Map<String, Object>> communes(String regionCode, String departmentCode) {
        return query(COMMUNES, TableDefinition.COMMUNES.name(),
                filter("region_code", regionCode, "department_code", departmentCode));
    }

    public List<Map<String, Object>> employment(String regionCode, String month) {
        return query(EMPLOYMENT, TableDefinition.REGION_EMPLOYMENT.name(),
                filter("region_code", regionCode, "month", month));
    }

    /**
     * Stored catalogue entries keyed by dataset id. Datasets never fetched
     * successfully have no entry.
     */
    public Map<String, Map<String, Object>> datasetMetadata() {
        return cache.getOrCompute(CacheKey.of(DATASETS), () -> {
            log.debug("Cache miss for {}", DATASETS);
            Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
            storage.read(TableDefinition.DATASETS.name(), Map.of())
                    .forEach(row -> byId.put(String.valueOf(row.get("id")), row));
            return byId;
        });
    }

    /**
     * Headline figures for the dashboard.
     *
     * {"total_communes": .., "total_regions": .., "total_population": ..,
     *  "budget_year_range": {"min": .., "max": ..}}
     */
    public Map<String, Object> kpis() {
        return cache.getOrCompute(CacheKey.of(KPIS), () -> {
            log.debug("Cache miss for {}", KPIS);
            Map<String, Object> summary = storage.summary();
            Map<String, Object> yearRange = new LinkedHashMap<>();
            yearRange.put("min", summary.get("min_year"));
            yearRange.put("max", summary.get("max_year"));

            Map<String, Object> kpis = new LinkedHashMap<>();
            kpis.put("total_communes", summary.get("total_communes"));
            kpis.put("total_regions", summary.get("total_regions"));
            kpis.put("total_population", summary.get("total_population"));
            kpis.put("budget_year_range", yearRange);
            return kpis;
        });
    }

    private List<Map<String, Object>> query(String queryType, String table, Map<String, String> params) {
        Map<String, Object> typed = new LinkedHashMap<>();
        Map<String, String> normalized = new LinkedHashMap<>();
        params.forEach((column, value) -> {
            Object filterValue = FILTERS.get(column).apply(value);
            typed.put(column, filterValue);
            normalized.put(column, filterValue.toString());
        });

        return cache.getOrCompute(CacheKey.of(queryType, normalized), () -> {
            log.debug("Cache miss for {} {}", queryType, params);
            return storage.read(table, typed);
        });
    }

    private static Map<String, String> filter(String firstColumn, String firstValue,
                                              String secondColumn, String secondValue) {
        Map<String, String> params = new LinkedHashMap<>();
        if (firstValue != null && !firstValue.isBlank()) params.put(firstColumn, firstValue.trim());
        if (secondValue != null && !secondValue.isBlank()) params.put(secondColumn, secondValue.trim());
        return params;
    }

    // Stored region codes have no leading zeros
    private static Object regionCode(String value) {
        return value.toUpperCase(Locale.ROOT).replaceFirst("^0+(?=.)", "");
    }

    private static Object year(String value) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("year must be a number, got '" + value + "'", e);
        }
    }
}
