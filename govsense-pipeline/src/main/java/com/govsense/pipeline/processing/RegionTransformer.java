package com.govsense.pipeline.processing;

import com.govsense.pipeline.model.CleanRecord;
import com.govsense.pipeline.model.DerivedRecord;
import com.govsense.pipeline.model.TransformResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Joins cleaned budget, commune and employment rows on region code and derives
 * per-region, per-year facts.
 *
 * Only sums and counts are used, accumulated in BigDecimal, so the result does
 * not depend on input order. An aggregate with no contributing row is null.
 */
@Component
@Slf4j
public class RegionTransformer {

    private static final Comparator<RegionYear> KEY_ORDER =
            Comparator.comparing(RegionYear::regionCode).thenComparing(RegionYear::year);

    public TransformResult transform(List<CleanRecord> budgets, List<CleanRecord> communes, List<CleanRecord> employment) {
        Map<String, Population> populations = new TreeMap<>();
        int unmapped = 0;
        for (CleanRecord commune : communes) {
            String region = commune.getString("region_code");
            if (region == null) {
                unmapped++;
                continue;
            }
            populations.computeIfAbsent(region, r -> new Population()).add(commune);
        }

        Map<RegionYear, Budget> budgetFacts = new TreeMap<>(KEY_ORDER);
        for (CleanRecord budget : budgets) {
            RegionYear key = new RegionYear(budget.getString("region_code"), budget.getLong("year").intValue());
            budgetFacts.computeIfAbsent(key, k -> new Budget()).add(budget);
        }

        Map<RegionYear, Employment> employmentFacts = new TreeMap<>(KEY_ORDER);
        for (CleanRecord row : employment) {
            int year = YearMonth.parse(row.getString("month")).getYear();
            RegionYear key = new RegionYear(row.getString("region_code"), year);
            employmentFacts.computeIfAbsent(key, k -> new Employment()).add(row);
        }

        TreeSet<RegionYear> keys = new TreeSet<>(KEY_ORDER);
        keys.addAll(budgetFacts.keySet());
        keys.addAll(employmentFacts.keySet());

        List<DerivedRecord> records = new ArrayList<>(keys.size());
        for (RegionYear key : keys) {
            records.add(derive(key, budgetFacts.get(key), populations.get(key.regionCode()), employmentFacts.get(key)));
        }

        if (unmapped > 0) {
            log.warn("{} communes carry no region code and were left out of regional totals", unmapped);
        }
        log.info("Derived {} region/year records from {} budget, {} commune and {} employment rows",
                records.size(), budgets.size(), communes.size(), employment.size());
        return new TransformResult(List.copyOf(records), unmapped);
    }

    private DerivedRecord derive(RegionYear key, Budget budget, Population population, Employment employment) {
        Long totalPopulation = population == null ? null : population.total();
        BigDecimal revenue = budget == null ? null : budget.revenue;
        BigDecimal expenditure = budget == null ? null : budget.expenditure;

        return DerivedRecord.builder()
                .regionCode(key.regionCode())
                .year(key.year())
                .regionName(firstNonNull(
                        budget == null ? null : budget.name,
                        population == null ? null : population.name,
                        employment == null ? null : employment.name))
                .totalPopulation(totalPopulation)
                .communeCount(population == null ? null : population.communes)
                .totalRevenue(toDouble(revenue))
                .totalExpenditure(toDouble(expenditure))
                .debt(budget == null ? null : toDouble(budget.debt))
                .revenuePerCapita(perCapita(revenue, totalPopulation))
                .expenditurePerCapita(perCapita(expenditure, totalPopulation))
                .salaryMass(employment == null ? null : toDouble(employment.salaryMass))
                .partialUnemploymentBase(employment == null ? null : toDouble(employment.partialUnemploymentBase))
                .employmentMonths(employment == null ? null : employment.months)
                .build();
    }

    /** Null when either side is absent or the population is zero */
    static Double perCapita(BigDecimal amount, Long population) {
        if (amount == null || population == null || population == 0) {
            return null;
        }
        return amount.divide(BigDecimal.valueOf(population), 2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * "REG ILE-DE-FRANCE" → "Ile-De-France"
     */
    static String cleanRegionName(String raw) {
        if (raw == null) return null;
        String name = raw.replaceFirst("(?i)^\\s*REG(\\s+|$)", "").trim();
        if (name.isEmpty()) return null;
        return Arrays.stream(name.toLowerCase(Locale.ROOT).split("(?<=[\\s-])"))
                .map(part -> part.isEmpty() ? part : Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining());
    }

    // ── Accumulators ─────────────────────────────────────────────────────────

    private record RegionYear(String regionCode, Integer year) {}

    private static final class Population {
        private Long population;
        private int communes;
        private String name;

        void add(CleanRecord commune) {
            communes++;
            Long value = commune.getLong("population");
            if (value != null) {
                population = population == null ? value : population + value;
            }
            name = minName(name, commune.getString("region_name"));
        }

        Long total() {
            return population;
        }
    }

    private static final class Budget {
        private BigDecimal revenue;
        private BigDecimal expenditure;
        private BigDecimal debt;
        private String name;

        void add(CleanRecord row) {
            revenue = plus(revenue, sum(row.getDouble("operating_revenue"), row.getDouble("investment_revenue")));
            expenditure = plus(expenditure, sum(row.getDouble("operating_expenditure"), row.getDouble("investment_expenditure")));
            debt = plus(debt, decimal(row.getDouble("debt")));
            name = minName(name, cleanRegionName(row.getString("region_name")));
        }
    }

    private static final class Employment {
        private BigDecimal salaryMass;
        private BigDecimal partialUnemploymentBase;
        private int months;
        private String name;

        void add(CleanRecord row) {
            months++;
            salaryMass = plus(salaryMass, decimal(row.getDouble("salary_mass")));
            partialUnemploymentBase = plus(partialUnemploymentBase, decimal(row.getDouble("partial_unemployment_base")));
            name = minName(name, row.getString("region_name"));
        }
    }

    // ── Null-aware arithmetic ────────────────────────────────────────────────

    private static BigDecimal decimal(Double value) {
        return value == null ? null : BigDecimal.valueOf(value);
    }

    /** Sum of the present components; null only when all are absent */
    private static BigDecimal sum(Double a, Double b) {
        return plus(decimal(a), decimal(b));
    }

    private static BigDecimal plus(BigDecimal acc, BigDecimal value) {
        if (value == null) return acc;
        return acc == null ? value : acc.add(value);
    }

    private static Double toDouble(BigDecimal value) {
        return value == null ? null : value.doubleValue();
    }

    // Smallest non-null name, so the pick does not depend on row order
    private static String minName(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) return current;
        return current == null || candidate.compareTo(current) < 0 ? candidate : current;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
