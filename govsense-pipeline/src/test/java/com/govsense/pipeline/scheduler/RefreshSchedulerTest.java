package com.govsense.pipeline.scheduler;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.exception.AlreadyRunningException;
import com.govsense.pipeline.model.RefreshRun;
import com.govsense.pipeline.model.RunStatus;
import com.govsense.pipeline.storage.JdbcStorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T03:00:00Z");

    @Mock
    private RefreshOrchestrator orchestrator;

    @Mock
    private JdbcStorageGateway storageGateway;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private final GovSenseProperties properties = new GovSenseProperties();
    private RefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RefreshScheduler(orchestrator, storageGateway, properties, taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void startupWithoutIntervalOnlyPreparesSchema() {
        scheduler.onStartup();

        verify(storageGateway).ensureSchema();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertFalse(scheduler.isPeriodicActive());
    }

    @Test
    void startupSchedulesConfiguredInterval() {
        properties.getRefresh().setInterval(Duration.ofHours(6));
        properties.getRefresh().setInitialDelay(Duration.ofMinutes(1));
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(1))), eq(Duration.ofHours(6)));

        scheduler.onStartup();

        assertTrue(scheduler.isPeriodicActive());
        assertEquals(Duration.ofHours(6), scheduler.getActiveInterval());
    }

    @Test
    void unreachableDatabaseDoesNotStopStartup() {
        doThrow(new DataAccessResourceFailureException("connection refused")).when(storageGateway).ensureSchema();

        assertDoesNotThrow(() -> scheduler.onStartup());
    }

    @Test
    void runOnStartupTriggersOneRefresh() {
        properties.getRefresh().setRunOnStartup(true);
        when(orchestrator.startAsync()).thenReturn(running("r-1"));

        scheduler.onStartup();

        verify(orchestrator).startAsync();
    }

    @Test
    void tickIsSkippedWhileARunIsInProgress() {
        when(orchestrator.startAsync()).thenThrow(new AlreadyRunningException("r-1"));

        assertDoesNotThrow(() -> scheduler.tick());
        verify(orchestrator, times(1)).startAsync();
    }

    @Test
    void stopCancelsFutureTicksWithoutInterrupting() {
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        scheduler.startPeriodic(Duration.ofMinutes(30));

        scheduler.stopPeriodic();

        verify(future).cancel(false);
        assertFalse(scheduler.isPeriodicActive());
        assertNull(scheduler.getActiveInterval());
    }

    @Test
    void restartReplacesThePreviousSchedule() {
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.startPeriodic(Duration.ofMinutes(30));
        scheduler.startPeriodic(Duration.ofMinutes(10));

        verify(future).cancel(false);
        assertEquals(Duration.ofMinutes(10), scheduler.getActiveInterval());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.startPeriodic(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> scheduler.startPeriodic(null));
    }

    private static RefreshRun running(String runId) {
        return RefreshRun.builder().runId(runId).status(RunStatus.RUNNING).build();
    }
}
