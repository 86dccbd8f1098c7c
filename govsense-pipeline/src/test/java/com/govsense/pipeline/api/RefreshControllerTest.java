package com.govsense.pipeline.api;

import com.govsense.pipeline.cache.TtlCache;
import com.govsense.pipeline.exception.AlreadyRunningException;
import com.govsense.pipeline.exception.DatasetNotFoundException;
import com.govsense.pipeline.model.RefreshRun;
import com.govsense.pipeline.model.RunStatus;
import com.govsense.pipeline.registry.DatasetCatalog;
import com.govsense.pipeline.registry.DatasetRegistry;
import com.govsense.pipeline.scheduler.RefreshOrchestrator;
import com.govsense.pipeline.scheduler.RefreshScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RefreshController.class)
class RefreshControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DatasetRegistry registry;

    @MockBean
    private RefreshOrchestrator orchestrator;

    @MockBean
    private RefreshScheduler scheduler;

    @MockBean
    private TtlCache cache;

    @MockBean
    private ReadQueryService queryService;

    @Test
    void listsDatasetsWithStoredCatalogueEntries() throws Exception {
        when(registry.listDatasets()).thenReturn(DatasetCatalog.defaults());
        when(queryService.datasetMetadata()).thenReturn(Map.of(
                DatasetCatalog.COMMUNES, Map.of("id", DatasetCatalog.COMMUNES, "license", "lov2")));

        mockMvc.perform(get("/api/v1/datasets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].id").value("region-budgets"))
                .andExpect(jsonPath("$[0].targetTable").value("region_budgets"))
                .andExpect(jsonPath("$[0].metadata").doesNotExist())
                .andExpect(jsonPath("$[1].metadata.license").value("lov2"));
    }

    @Test
    void unknownDatasetIs404() throws Exception {
        when(registry.get("elections")).thenThrow(new DatasetNotFoundException("elections"));

        mockMvc.perform(get("/api/v1/datasets/elections"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown dataset: elections"));
    }

    @Test
    void manualRefreshIsAccepted() throws Exception {
        when(orchestrator.startAsync()).thenReturn(RefreshRun.builder()
                .runId("r-1")
                .status(RunStatus.RUNNING)
                .startedAt(LocalDateTime.of(2024, 3, 1, 3, 0))
                .build());

        mockMvc.perform(post("/api/v1/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("r-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void refreshWhileRunningIs409() throws Exception {
        when(orchestrator.startAsync()).thenThrow(new AlreadyRunningException("r-1"));

        mockMvc.perform(post("/api/v1/refresh"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.runningRunId").value("r-1"));
    }

    @Test
    void refreshThatCannotBeQueuedIs500EvenWithoutMessage() throws Exception {
        when(orchestrator.startAsync()).thenThrow(new TaskRejectedException((String) null));

        mockMvc.perform(post("/api/v1/refresh"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("null"));
    }

    @Test
    void statusReportsLastRunAndSchedule() throws Exception {
        when(orchestrator.isRunning()).thenReturn(false);
        when(orchestrator.currentRun()).thenReturn(Optional.empty());
        when(orchestrator.lastRun()).thenReturn(Optional.of(RefreshRun.builder()
                .runId("r-0")
                .status(RunStatus.SUCCEEDED)
                .failedDatasets(Map.of(DatasetCatalog.REGIONAL_EMPLOYMENT, "HTTP 503"))
                .build()));
        when(scheduler.isPeriodicActive()).thenReturn(true);
        when(scheduler.getActiveInterval()).thenReturn(Duration.ofHours(6));

        mockMvc.perform(get("/api/v1/refresh/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.lastRun.runId").value("r-0"))
                .andExpect(jsonPath("$.lastRun.degraded").value(true))
                .andExpect(jsonPath("$.periodic").value(true));
    }

    @Test
    void clearCacheInvalidatesEverything() throws Exception {
        mockMvc.perform(post("/api/v1/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cleared"));

        verify(cache).invalidateAll();
    }

    @Test
    void readsGoThroughQueryService() throws Exception {
        when(queryService.regionStats("11", "2022"))
                .thenReturn(List.of(Map.of("region_code", "11", "year", 2022, "revenue_per_capita", 2.0)));

        mockMvc.perform(get("/api/v1/stats/regions").param("region_code", "11").param("year", "2022"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].revenue_per_capita").value(2.0));
    }

    @Test
    void badFilterIs400() throws Exception {
        when(queryService.budgets(null, "last")).thenThrow(new IllegalArgumentException("year must be a number, got 'last'"));

        mockMvc.perform(get("/api/v1/budgets").param("year", "last"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("year must be a number, got 'last'"));
    }

    @Test
    void storageFailureIs500() throws Exception {
        when(queryService.communes(null, null)).thenThrow(new IllegalStateException("database down"));

        mockMvc.perform(get("/api/v1/communes"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void kpisComeFromQueryService() throws Exception {
        when(queryService.kpis()).thenReturn(Map.of(
                "total_communes", 34945,
                "budget_year_range", Map.of("min", 2008, "max", 2022)));

        mockMvc.perform(get("/api/v1/kpis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_communes").value(34945))
                .andExpect(jsonPath("$.budget_year_range.max").value(2022));
    }
}
