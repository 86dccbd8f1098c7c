package com.govsense.pipeline.storage;

import java.util.List;
import java.util.Optional;

/**
 * Target tables of the refresh pipeline. Each natural key is a UNIQUE
 * constraint (or the primary key) so the upsert can never create a second
 * row for one key.
 */
public record TableDefinition(String name, List<String> naturalKey, String ddl) {

    public static final TableDefinition DATASETS = new TableDefinition(
            "datasets", List.of("id"), """
            CREATE TABLE IF NOT EXISTS datasets
            (
                id                      VARCHAR(64)      PRIMARY KEY,
                source_id               VARCHAR(64),
                title                   VARCHAR(512),
                slug                    VARCHAR(512),
                description             TEXT,
                organization            VARCHAR(256),
                license                 VARCHAR(64),
                last_modified           TIMESTAMP,
                resource_url            VARCHAR(1024),
                ingested_at             TIMESTAMP
            )
            """);

    public static final TableDefinition REGION_BUDGETS = new TableDefinition(
            "region_budgets", List.of("year", "region_code"), """
            CREATE TABLE IF NOT EXISTS region_budgets
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                year                    INTEGER          NOT NULL,
                region_code             VARCHAR(8)       NOT NULL,
                region_name             VARCHAR(256),
                operating_revenue       DOUBLE PRECISION,
                operating_expenditure   DOUBLE PRECISION,
                investment_revenue      DOUBLE PRECISION,
                investment_expenditure  DOUBLE PRECISION,
                debt                    DOUBLE PRECISION,
                refreshed_at            TIMESTAMP,
                CONSTRAINT uq_region_budgets_key UNIQUE (year, region_code)
            )
            """);

    public static final TableDefinition COMMUNES = new TableDefinition(
            "communes", List.of("code_insee"), """
            CREATE TABLE IF NOT EXISTS communes
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                code_insee              VARCHAR(8)       NOT NULL,
                name                    VARCHAR(256),
                region_code             VARCHAR(8),
                region_name             VARCHAR(256),
                department_code         VARCHAR(8),
                department_name         VARCHAR(256),
                population              BIGINT,
                area_km2                DOUBLE PRECISION,
                density                 DOUBLE PRECISION,
                refreshed_at            TIMESTAMP,
                CONSTRAINT uq_communes_key UNIQUE (code_insee)
            )
            """);

    public static final TableDefinition REGION_EMPLOYMENT = new TableDefinition(
            "region_employment", List.of("region_code", "month"), """
            CREATE TABLE IF NOT EXISTS region_employment
            (
                id                          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                region_code                 VARCHAR(8)       NOT NULL,
                month                       VARCHAR(7)       NOT NULL,
                region_name                 VARCHAR(256),
                salary_mass                 DOUBLE PRECISION,
                partial_unemployment_base   DOUBLE PRECISION,
                refreshed_at                TIMESTAMP,
                CONSTRAINT uq_region_employment_key UNIQUE (region_code, month)
            )
            """);

    public static final TableDefinition REGION_STATS = new TableDefinition(
            "region_stats", List.of("region_code", "year"), """
            CREATE TABLE IF NOT EXISTS region_stats
            (
                id                          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                region_code                 VARCHAR(8)       NOT NULL,
                year                        INTEGER          NOT NULL,
                region_name                 VARCHAR(256),
                total_population            BIGINT,
                commune_count               INTEGER,
                total_revenue               DOUBLE PRECISION,
                total_expenditure           DOUBLE PRECISION,
                debt                        DOUBLE PRECISION,
                revenue_per_capita          DOUBLE PRECISION,
                expenditure_per_capita      DOUBLE PRECISION,
                salary_mass                 DOUBLE PRECISION,
                partial_unemployment_base   DOUBLE PRECISION,
                employment_months           INTEGER,
                refreshed_at                TIMESTAMP,
                CONSTRAINT uq_region_stats_key UNIQUE (region_code, year)
            )
            """);

    public static final List<TableDefinition> ALL = List.of(
            DATASETS, REGION_BUDGETS, COMMUNES, REGION_EMPLOYMENT, REGION_STATS);

    public static Optional<TableDefinition> byName(String name) {
        return ALL.stream().filter(t -> t.name().equals(name)).findFirst();
    }
}
