package com.govsense.pipeline.scheduler;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.exception.AlreadyRunningException;
import com.govsense.pipeline.model.RefreshRun;
import com.govsense.pipeline.storage.JdbcStorageGateway;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Manages periodic and on-startup refreshes.
 *
 * A tick never waits for a running refresh: if one is still in progress the
 * tick is skipped and logged, so a slow run never builds a queue behind it.
 *
 * Configure with govsense.refresh.interval (e.g. PT6H); leave it unset to
 * only refresh on demand.
 */
@Component
@Slf4j
public class RefreshScheduler {

    private final RefreshOrchestrator orchestrator;
    private final JdbcStorageGateway storageGateway;
    private final GovSenseProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private ScheduledFuture<?> periodic;
    private Duration activeInterval;

    public RefreshScheduler(RefreshOrchestrator orchestrator,
                            JdbcStorageGateway storageGateway,
                            GovSenseProperties properties,
                            @Qualifier("refreshTaskScheduler") TaskScheduler taskScheduler,
                            Clock clock) {
        this.orchestrator = orchestrator;
        this.storageGateway = storageGateway;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Start the periodic refresh if an interval is configured
     *  3. Optionally kick off one refresh straight away
     */
    @PostConstruct
    public void onStartup() {
        try {
            storageGateway.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema (refreshes will fail until it is reachable): {}",
                    e.getMessage());
        }

        GovSenseProperties.Refresh refresh = properties.getRefresh();
        if (refresh.getInterval() != null) {
            startPeriodic(refresh.getInterval());
        } else {
            log.info("No refresh interval configured, refreshes run on demand only");
        }

        if (refresh.isRunOnStartup()) {
            log.info("run-on-startup=true, starting an initial refresh");
            tick();
        }
    }

    /**
     * Schedule {@link #tick()} every {@code interval}, replacing any previous schedule.
     */
    public synchronized void startPeriodic(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be positive, got " + interval);
        }
        cancelPeriodic();
        Duration delay = properties.getRefresh().getInitialDelay();
        periodic = taskScheduler.scheduleAtFixedRate(this::tick,
                clock.instant().plus(delay == null ? Duration.ZERO : delay), interval);
        activeInterval = interval;
        log.info("Periodic refresh every {} (first in {})", interval, delay);
    }

    /**
     * Stop future ticks. A refresh already running is left to finish.
     */
    public synchronized void stopPeriodic() {
        if (cancelPeriodic()) {
            log.info("Periodic refresh stopped");
        }
    }

    public synchronized boolean isPeriodicActive() {
        return periodic != null && !periodic.isCancelled();
    }

    public synchronized Duration getActiveInterval() {
        return isPeriodicActive() ? activeInterval : null;
    }

    /**
     * One scheduler firing. Starts a refresh unless one is already running.
     */
    public void tick() {
        try {
            RefreshRun run = orchestrator.startAsync();
            log.info("Scheduled refresh {} started", run.getRunId());
        } catch (AlreadyRunningException e) {
            log.info("Scheduled refresh skipped: {}", e.getMessage());
        } catch (TaskRejectedException e) {
            log.error("Scheduled refresh could not be started: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void onShutdown() {
        stopPeriodic();
    }

    private boolean cancelPeriodic() {
        if (periodic == null) {
            return false;
        }
        periodic.cancel(false);
        periodic = null;
        activeInterval = null;
        return true;
    }
}
