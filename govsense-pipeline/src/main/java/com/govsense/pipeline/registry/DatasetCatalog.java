package com.govsense.pipeline.registry;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.model.ColumnSpec;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.DuplicatePolicy;
import com.govsense.pipeline.model.FieldType;
import com.govsense.pipeline.model.MissingValuePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * The three data.gouv.fr extracts behind the regional dashboard.
 *
 * Sources default to dataset slugs; {@code govsense.datasets.<id>.source}
 * can point any of them at another slug or at a direct CSV URL.
 */
@Configuration
@Slf4j
public class DatasetCatalog {

    public static final String REGION_BUDGETS = "region-budgets";
    public static final String COMMUNES = "communes";
    public static final String REGIONAL_EMPLOYMENT = "chomage-regional";

    @Bean
    public DatasetRegistry datasetRegistry(GovSenseProperties properties) {
        List<DatasetSpec> specs = defaults().stream()
                .map(spec -> {
                    GovSenseProperties.DatasetOverride override = properties.getDatasets().get(spec.getId());
                    if (override == null || override.getSource() == null || override.getSource().isBlank()) {
                        return spec;
                    }
                    log.info("Dataset {} source overridden: {}", spec.getId(), override.getSource());
                    return spec.toBuilder().source(override.getSource()).build();
                })
                .toList();
        return new DatasetRegistry(specs);
    }

    public static List<DatasetSpec> defaults() {
        return List.of(regionBudgets(), communes(), regionalEmployment());
    }

    /** Comptes individuels des régions: one row per region and fiscal year */
    public static DatasetSpec regionBudgets() {
        return DatasetSpec.builder()
                .id(REGION_BUDGETS)
                .displayName("Comptes individuels des régions")
                .description("Budget régional : recettes, dépenses, dette par région et par année.")
                .publisher("Ministère de l'Économie")
                .source("comptes-individuels-des-regions-fichier-global-a-compter-de-2008")
                .separator(';')
                .targetTable("region_budgets")
                .naturalKeyColumn("year")
                .naturalKeyColumn("region_code")
                .duplicatePolicy(DuplicatePolicy.KEEP_LAST)
                .refreshCadence(Duration.ofDays(365))
                .column(key("year", FieldType.INTEGER, "exer", "annee", "exercice"))
                .column(key("region_code", FieldType.CODE, "reg", "code_region"))
                .column(optional("region_name", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "lbudg", "nom_region"))
                .column(optional("operating_revenue", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "rec_totales_f"))
                .column(optional("operating_expenditure", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "dep_totales_f"))
                .column(optional("investment_revenue", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "rec_totales_i"))
                .column(optional("investment_expenditure", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "dep_totales_i"))
                .column(optional("debt", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "encours_de_dette", "dette"))
                .build();
    }

    /**
     * Communes et villes de France. The region code on each row is the only
     * commune-to-region mapping; rows without one stay out of regional totals.
     * A commune code listed twice is ambiguous, so every copy is rejected.
     */
    public static DatasetSpec communes() {
        return DatasetSpec.builder()
                .id(COMMUNES)
                .displayName("Communes et villes de France")
                .description("Démographie communale : population, superficie, densité.")
                .publisher("data.gouv.fr")
                .source("communes-et-villes-de-france-en-csv-excel-json-parquet-et-feather")
                .separator(',')
                .targetTable("communes")
                .naturalKeyColumn("code_insee")
                .duplicatePolicy(DuplicatePolicy.REJECT_ALL)
                .refreshCadence(Duration.ofDays(365))
                .column(key("code_insee", FieldType.TEXT, "code_commune_insee", "code_commune"))
                .column(optional("name", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "nom_standard", "nom_commune", "nom"))
                .column(optional("region_code", FieldType.CODE, MissingValuePolicy.LEAVE_NULL, "reg_code", "code_region"))
                .column(optional("region_name", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "reg_nom", "nom_region"))
                .column(optional("department_code", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "dep_code", "code_departement"))
                .column(optional("department_name", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "dep_nom", "nom_departement"))
                .column(optional("population", FieldType.INTEGER, MissingValuePolicy.LEAVE_NULL, "pop", "population_municipale"))
                .column(optional("area_km2", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "superficie_km2", "superficie"))
                .column(optional("density", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL, "densite"))
                .build();
    }

    /** Urssaf monthly salary mass and partial-unemployment base by region */
    public static DatasetSpec regionalEmployment() {
        return DatasetSpec.builder()
                .id(REGIONAL_EMPLOYMENT)
                .displayName("Masse salariale et chômage partiel par région")
                .description("Masse salariale brute et assiette chômage partiel mensuelles par région.")
                .publisher("Urssaf")
                .source("masse-salariale-et-assiette-chomage-partiel-mensuelles-du-secteur-prive-par-region")
                .separator(';')
                .targetTable("region_employment")
                .naturalKeyColumn("region_code")
                .naturalKeyColumn("month")
                .duplicatePolicy(DuplicatePolicy.KEEP_LAST)
                .refreshCadence(Duration.ofDays(30))
                .column(key("region_code", FieldType.CODE, "code_region", "reg"))
                .column(key("month", FieldType.MONTH, "mois", "date", "periode", "dernier_jour_du_mois"))
                .column(optional("region_name", FieldType.TEXT, MissingValuePolicy.LEAVE_NULL, "region", "libelle_region"))
                .column(optional("salary_mass", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL,
                        "masse_salariale_brute", "masse_salariale"))
                .column(optional("partial_unemployment_base", FieldType.DECIMAL, MissingValuePolicy.LEAVE_NULL,
                        "assiette_chomage_partiel", "assiette_chomage_partiel_brute"))
                .build();
    }

    private static ColumnSpec key(String name, FieldType type, String... aliases) {
        return ColumnSpec.builder()
                .name(name)
                .type(type)
                .required(true)
                .missingPolicy(MissingValuePolicy.REJECT_ROW)
                .aliases(List.of(aliases))
                .build();
    }

    private static ColumnSpec optional(String name, FieldType type, MissingValuePolicy policy, String... aliases) {
        return ColumnSpec.builder()
                .name(name)
                .type(type)
                .required(false)
                .missingPolicy(policy)
                .aliases(List.of(aliases))
                .build();
    }
}
