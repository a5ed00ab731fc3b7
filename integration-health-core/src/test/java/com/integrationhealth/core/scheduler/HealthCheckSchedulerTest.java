package com.integrationhealth.core.scheduler;

import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.logging.EcsLogger;
import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.service.ProbeDispatcherService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthCheckSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private IntegrationCredentialStore credentialStore;

    @Mock
    private ProbeDispatcherService dispatcher;

    @Mock
    private EcsLogger ecsLogger;

    private HealthCheckScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = newScheduler(new IntegrationHealthProperties.SchedulerConfig(true, Duration.ofMinutes(5), Duration.ofHours(1)));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private HealthCheckScheduler newScheduler(IntegrationHealthProperties.SchedulerConfig config) {
        return new HealthCheckScheduler(credentialStore, dispatcher, new ProbeMetrics(new SimpleMeterRegistry()),
            ecsLogger, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCycleChecksEveryWorkspace() {
        when(credentialStore.findWorkspaceIdsWithIntegrations()).thenReturn(new LinkedHashSet<>(List.of("ws-1", "ws-2")));

        scheduler.runCycle();

        verify(dispatcher).checkWorkspaceHealth("ws-1");
        verify(dispatcher).checkWorkspaceHealth("ws-2");
        HealthCheckScheduler.SchedulerStatus status = scheduler.getStatus();
        assertEquals(2, status.lastCycleWorkspaces());
        assertEquals(0, status.lastCycleFailures());
        assertEquals(NOW, status.lastCycleStartedAt());
        assertEquals(NOW, status.lastCycleCompletedAt());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testFailingWorkspaceDoesNotStopCycle() {
        when(credentialStore.findWorkspaceIdsWithIntegrations())
            .thenReturn(new LinkedHashSet<>(List.of("ws-1", "ws-2", "ws-3")));
        lenient().when(dispatcher.checkWorkspaceHealth("ws-2")).thenThrow(new IllegalStateException("pool exhausted"));

        scheduler.runCycle();

        verify(dispatcher).checkWorkspaceHealth("ws-3");
        assertEquals(1, scheduler.getStatus().lastCycleFailures());
        verify(ecsLogger).logSchedulerCycle(eq(3), eq(1), anyLong());
    }

    @Test
    void testDiscoveryFailureSkipsCycle() {
        when(credentialStore.findWorkspaceIdsWithIntegrations()).thenThrow(new IllegalStateException("db down"));

        scheduler.runCycle();

        verifyNoInteractions(dispatcher, ecsLogger);
        assertNull(scheduler.getStatus().lastCycleCompletedAt());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testDisabledSchedulerDoesNotStart() {
        scheduler = newScheduler(new IntegrationHealthProperties.SchedulerConfig(false, null, null));

        scheduler.start();

        assertFalse(scheduler.isEnabled());
        assertFalse(scheduler.getStatus().enabled());
        assertEquals(300_000L, scheduler.getStatus().intervalMs());
        verifyNoInteractions(credentialStore);
    }

    @Test
    void testStartAndStop() {
        scheduler.start();
        scheduler.start();
        scheduler.stop();

        assertTrue(scheduler.isEnabled());
        verifyNoInteractions(credentialStore);
    }

    @Test
    void testReportingFailureDoesNotEscapeScheduledCycle() {
        when(credentialStore.findWorkspaceIdsWithIntegrations()).thenReturn(new LinkedHashSet<>(List.of("ws-1")));
        doThrow(new IllegalStateException("appender closed"))
            .when(ecsLogger).logSchedulerCycle(anyInt(), anyInt(), anyLong());

        assertDoesNotThrow(() -> scheduler.runScheduledCycle());
        assertDoesNotThrow(() -> scheduler.runScheduledCycle());

        verify(dispatcher, times(2)).checkWorkspaceHealth("ws-1");
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testTimerKeepsRunningAfterFailedCycle() {
        when(credentialStore.findWorkspaceIdsWithIntegrations()).thenReturn(new LinkedHashSet<>(List.of("ws-1")));
        doThrow(new IllegalStateException("appender closed"))
            .when(ecsLogger).logSchedulerCycle(anyInt(), anyInt(), anyLong());
        scheduler = newScheduler(new IntegrationHealthProperties.SchedulerConfig(true, Duration.ofMillis(20), Duration.ZERO));

        scheduler.start();

        verify(credentialStore, timeout(5000).atLeast(3)).findWorkspaceIdsWithIntegrations();
    }
}
