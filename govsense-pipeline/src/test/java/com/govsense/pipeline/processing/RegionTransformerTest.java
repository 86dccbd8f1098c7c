package com.govsense.pipeline.processing;

import com.govsense.pipeline.model.CleanRecord;
import com.govsense.pipeline.model.DerivedRecord;
import com.govsense.pipeline.model.TransformResult;
import com.govsense.pipeline.registry.DatasetCatalog;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegionTransformerTest {

    private final RegionTransformer transformer = new RegionTransformer();

    @Test
    void perCapitaFromBudgetAndPopulation() {
        TransformResult result = transformer.transform(
                List.of(budget(2022, "11", "REG ILE-DE-FRANCE", 1000.0, 800.0)),
                List.of(commune("75056", "11", 500L)),
                List.of());

        DerivedRecord idf = result.records().get(0);
        assertEquals("11", idf.getRegionCode());
        assertEquals(2022, idf.getYear());
        assertEquals("Ile-De-France", idf.getRegionName());
        assertEquals(500L, idf.getTotalPopulation());
        assertEquals(1, idf.getCommuneCount());
        assertEquals(1000.0, idf.getTotalRevenue());
        assertEquals(2.0, idf.getRevenuePerCapita());
        assertEquals(1.6, idf.getExpenditurePerCapita());
    }

    @Test
    void revenueAddsOperatingAndInvestment() {
        Map<String, Object> fields = budgetFields(2022, "53", null, 100.0, 50.0);
        fields.put("investment_revenue", 25.5);
        fields.put("investment_expenditure", 10.0);

        DerivedRecord record = transformer.transform(
                List.of(new CleanRecord(DatasetCatalog.REGION_BUDGETS, 1, fields)), List.of(), List.of())
                .records().get(0);

        assertEquals(125.5, record.getTotalRevenue());
        assertEquals(60.0, record.getTotalExpenditure());
    }

    @Test
    void populationSumsEveryCommuneOfTheRegionOnce() {
        TransformResult result = transformer.transform(
                List.of(budget(2022, "11", null, 1.0, 1.0), budget(2022, "93", null, 1.0, 1.0)),
                List.of(commune("75056", "11", 2_000L), commune("92012", "11", 120L),
                        commune("13055", "93", 870L), commune("99999", null, 5_000L)),
                List.of());

        Map<String, Long> population = new HashMap<>();
        result.records().forEach(r -> population.put(r.getRegionCode(), r.getTotalPopulation()));
        assertEquals(Map.of("11", 2_120L, "93", 870L), population);
        assertEquals(1, result.unmappedCommunes());
    }

    @Test
    void missingEmploymentLeavesNullsNotZeros() {
        DerivedRecord record = transformer.transform(
                List.of(budget(2022, "24", null, 300.0, 200.0)), List.of(), List.of())
                .records().get(0);

        assertNull(record.getSalaryMass());
        assertNull(record.getPartialUnemploymentBase());
        assertNull(record.getEmploymentMonths());
        assertNull(record.getTotalPopulation());
        assertNull(record.getRevenuePerCapita());
    }

    @Test
    void zeroPopulationGivesNoPerCapita() {
        DerivedRecord record = transformer.transform(
                List.of(budget(2022, "24", null, 300.0, 200.0)),
                List.of(commune("37261", "24", 0L)),
                List.of()).records().get(0);

        assertEquals(0L, record.getTotalPopulation());
        assertNull(record.getRevenuePerCapita());
    }

    @Test
    void employmentAggregatesMonthsPerYear() {
        TransformResult result = transformer.transform(List.of(), List.of(), List.of(
                employment("11", "2023-01", 100.0, 10.0),
                employment("11", "2023-02", 150.0, null),
                employment("11", "2024-01", 90.0, 1.0)));

        assertEquals(2, result.records().size());
        DerivedRecord y2023 = result.records().get(0);
        assertEquals(2023, y2023.getYear());
        assertEquals(250.0, y2023.getSalaryMass());
        assertEquals(10.0, y2023.getPartialUnemploymentBase());
        assertEquals(2, y2023.getEmploymentMonths());
        assertNull(y2023.getTotalRevenue());
    }

    @Test
    void outputDoesNotDependOnInputOrder() {
        List<CleanRecord> budgets = new ArrayList<>(List.of(
                budget(2022, "11", "REG ILE-DE-FRANCE", 1000.0, 800.0),
                budget(2021, "11", "REG ILE-DE-FRANCE", 900.0, 700.0),
                budget(2022, "84", "REG AUVERGNE-RHONE-ALPES", 400.0, 350.0)));
        List<CleanRecord> communes = new ArrayList<>(List.of(
                commune("75056", "11", 2_000L), commune("69123", "84", 500L), commune("92012", "11", 120L)));

        TransformResult first = transformer.transform(budgets, communes, List.of());
        Collections.reverse(budgets);
        Collections.reverse(communes);
        TransformResult second = transformer.transform(budgets, communes, List.of());

        assertEquals(first, second);
    }

    @Test
    void perCapitaRoundsToCents() {
        assertEquals(0.33, RegionTransformer.perCapita(BigDecimal.ONE, 3L));
        assertNull(RegionTransformer.perCapita(BigDecimal.ONE, 0L));
        assertNull(RegionTransformer.perCapita(null, 3L));
    }

    @Test
    void cleansBudgetRegionNames() {
        assertEquals("Ile-De-France", RegionTransformer.cleanRegionName("REG ILE-DE-FRANCE"));
        assertEquals("Centre-Val De Loire", RegionTransformer.cleanRegionName("REG CENTRE-VAL DE LOIRE"));
        assertEquals("Bretagne", RegionTransformer.cleanRegionName("Bretagne"));
        assertNull(RegionTransformer.cleanRegionName("REG "));
        assertTrue(RegionTransformer.cleanRegionName("reg  corse").startsWith("Corse"));
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private static CleanRecord budget(int year, String region, String name, Double revenue, Double expenditure) {
        return new CleanRecord(DatasetCatalog.REGION_BUDGETS, 1, budgetFields(year, region, name, revenue, expenditure));
    }

    private static Map<String, Object> budgetFields(int year, String region, String name, Double revenue, Double expenditure) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("year", (long) year);
        fields.put("region_code", region);
        fields.put("region_name", name);
        fields.put("operating_revenue", revenue);
        fields.put("operating_expenditure", expenditure);
        fields.put("investment_revenue", null);
        fields.put("investment_expenditure", null);
        fields.put("debt", null);
        return fields;
    }

    private static CleanRecord commune(String code, String region, Long population) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("code_insee", code);
        fields.put("region_code", region);
        fields.put("population", population);
        return new CleanRecord(DatasetCatalog.COMMUNES, 1, fields);
    }

    private static CleanRecord employment(String region, String month, Double salaryMass, Double partialBase) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("region_code", region);
        fields.put("month", month);
        fields.put("salary_mass", salaryMass);
        fields.put("partial_unemployment_base", partialBase);
        return new CleanRecord(DatasetCatalog.REGIONAL_EMPLOYMENT, 1, fields);
    }
}
