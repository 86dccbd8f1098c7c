package com.govsense.pipeline.api;

import com.govsense.pipeline.cache.TtlCache;
import com.govsense.pipeline.exception.AlreadyRunningException;
import com.govsense.pipeline.exception.DatasetNotFoundException;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.RefreshRun;
import com.govsense.pipeline.registry.DatasetRegistry;
import com.govsense.pipeline.scheduler.RefreshOrchestrator;
import com.govsense.pipeline.scheduler.RefreshScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/v1")
@Slf4j
@RequiredArgsConstructor
public class RefreshController {

    private final DatasetRegistry registry;
    private final RefreshOrchestrator orchestrator;
    private final RefreshScheduler scheduler;
    private final TtlCache cache;
    private final ReadQueryService queryService;

    // ── Registry ─────────────────────────────────────────────────────────────

    /**
     * Registry entries, each with the catalogue metadata stored by the last
     * successful fetch ({@code metadata} is null before the first one).
     */
    @GetMapping("/datasets")
    public ResponseEntity<?> datasets() {
        return read("datasets", () -> {
            Map<String, Map<String, Object>> stored = queryService.datasetMetadata();
            return registry.listDatasets().stream().map(spec -> describe(spec, stored)).toList();
        });
    }

    @GetMapping("/datasets/{id}")
    public ResponseEntity<?> dataset(@PathVariable String id) {
        try {
            DatasetSpec spec = registry.get(id);
            return read("dataset " + id, () -> describe(spec, queryService.datasetMetadata()));
        } catch (DatasetNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Refresh ──────────────────────────────────────────────────────────────

    @PostMapping("/refresh")
    public ResponseEntity<?> triggerRefresh() {
        try {
            RefreshRun run = orchestrator.startAsync();
            return ResponseEntity.accepted().body(run);
        } catch (AlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", String.valueOf(e.getMessage()), "runningRunId", e.getRunningRunId()));
        } catch (Exception e) {
            log.error("Manual refresh could not be started: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/refresh/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", orchestrator.isRunning());
        body.put("currentRun", orchestrator.currentRun().orElse(null));
        body.put("lastRun", orchestrator.lastRun().orElse(null));
        body.put("periodic", scheduler.isPeriodicActive());
        body.put("interval", scheduler.getActiveInterval());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/refresh/history")
    public List<RefreshRun> history() {
        return orchestrator.history();
    }

    // ── Cache ────────────────────────────────────────────────────────────────

    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        cache.invalidateAll();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /**
     * Derived per-region statistics.
     *
     * GET /api/v1/stats/regions?region_code=11&year=2022
     */
    @GetMapping("/stats/regions")
    public ResponseEntity<?> regionStats(@RequestParam(name = "region_code", required = false) String regionCode,
                                         @RequestParam(required = false) String year) {
        return read("region stats", () -> queryService.regionStats(regionCode, year));
    }

    @GetMapping("/budgets")
    public ResponseEntity<?> budgets(@RequestParam(name = "region_code", required = false) String regionCode,
                                     @RequestParam(required = false) String year) {
        return read("budgets", () -> queryService.budgets(regionCode, year));
    }

    @GetMapping("/communes")
    public ResponseEntity<?> communes(@RequestParam(name = "region_code", required = false) String regionCode,
                                      @RequestParam(name = "department_code", required = false) String departmentCode) {
        return read("communes", () -> queryService.communes(regionCode, departmentCode));
    }

    @GetMapping("/employment")
    public ResponseEntity<?> employment(@RequestParam(name = "region_code", required = false) String regionCode,
                                        @RequestParam(required = false) String month) {
        return read("employment", () -> queryService.employment(regionCode, month));
    }

    /**
     * Summary totals: communes, regions, population and budget year range.
     */
    @GetMapping("/kpis")
    public ResponseEntity<?> kpis() {
        return read("kpis", queryService::kpis);
    }

    private ResponseEntity<?> read(String what, Supplier<?> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            log.error("{} query failed: {}", what, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static Map<String, Object> describe(DatasetSpec spec, Map<String, Map<String, Object>> stored) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", spec.getId());
        body.put("displayName", spec.getDisplayName());
        body.put("description", spec.getDescription());
        body.put("publisher", spec.getPublisher());
        body.put("source", spec.getSource());
        body.put("targetTable", spec.getTargetTable());
        body.put("naturalKey", spec.getNaturalKey());
        body.put("columns", spec.getColumns().stream().map(c -> c.getName()).toList());
        body.put("metadata", stored.get(spec.getId()));
        return body;
    }
}
