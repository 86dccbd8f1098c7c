package com.govsense.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Region-level facts for one budget year, joined across the budget, commune
 * and employment datasets.
 *
 * Every aggregate is nullable: null means no contributing row existed for
 * this region and year, which is not the same thing as zero.
 */
@Value
@Builder
public class DerivedRecord {

    public static final String TABLE = "region_stats";

    // ── Key ─────────────────────────────────────────────────────────────────
    String regionCode;
    Integer year;

    String regionName;

    // ── Demographics (communes) ─────────────────────────────────────────────
    Long totalPopulation;
    Integer communeCount;

    // ── Budget ──────────────────────────────────────────────────────────────
    /** Recettes: operating + investment revenue */
    Double totalRevenue;

    /** Dépenses: operating + investment expenditure */
    Double totalExpenditure;

    /** Dette: outstanding debt */
    Double debt;

    Double revenuePerCapita;
    Double expenditurePerCapita;

    // ── Employment (Urssaf) ─────────────────────────────────────────────────
    /** Sum of the monthly salary mass over the months published for the year */
    Double salaryMass;

    /** Sum of the monthly partial-unemployment base */
    Double partialUnemploymentBase;

    /** Number of months of employment data behind the two sums above */
    Integer employmentMonths;

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region_code", regionCode);
        row.put("year", year);
        row.put("region_name", regionName);
        row.put("total_population", totalPopulation);
        row.put("commune_count", communeCount);
        row.put("total_revenue", totalRevenue);
        row.put("total_expenditure", totalExpenditure);
        row.put("debt", debt);
        row.put("revenue_per_capita", revenuePerCapita);
        row.put("expenditure_per_capita", expenditurePerCapita);
        row.put("salary_mass", salaryMass);
        row.put("partial_unemployment_base", partialUnemploymentBase);
        row.put("employment_months", employmentMonths);
        return row;
    }
}
