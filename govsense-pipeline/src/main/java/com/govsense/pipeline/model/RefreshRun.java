package com.govsense.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks one refresh of the whole pipeline for observability.
 * Only the orchestrator mutates it; readers get snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private RunStatus status;

    /**
     * Committed rows per dataset id, plus the derived rows under
     * {@link DerivedRecord#TABLE}. A dataset absent here contributed nothing.
     */
    @Builder.Default
    private Map<String, Integer> rowCounts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, CleaningReport> cleaningReports = new LinkedHashMap<>();

    @Builder.Default
    private List<String> succeededDatasets = new ArrayList<>();

    /** Dataset id to failure message */
    @Builder.Default
    private Map<String, String> failedDatasets = new LinkedHashMap<>();

    private int unmappedCommunes;
    private String errorSummary;    // null on success

    public boolean isDegraded() {
        return status == RunStatus.SUCCEEDED && !failedDatasets.isEmpty();
    }

    public RefreshRun snapshot() {
        return RefreshRun.builder()
                .runId(runId)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .status(status)
                .rowCounts(new LinkedHashMap<>(rowCounts))
                .cleaningReports(new LinkedHashMap<>(cleaningReports))
                .succeededDatasets(new ArrayList<>(succeededDatasets))
                .failedDatasets(new LinkedHashMap<>(failedDatasets))
                .unmappedCommunes(unmappedCommunes)
                .errorSummary(errorSummary)
                .build();
    }
}
