package com.relaydesk.support.sla.service;

import com.relaydesk.support.common.lock.PgAdvisoryLockRepository;
import com.relaydesk.support.transfer.settings.ClientInactivitySettings;
import com.relaydesk.support.transfer.settings.SlaSettings;
import com.relaydesk.support.transfer.settings.TransferSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlaEscalationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final SlaSettingsCache cache = mock(SlaSettingsCache.class);
    private final PgAdvisoryLockRepository lockRepository = mock(PgAdvisoryLockRepository.class);
    private final SlaEscalationService escalationService = mock(SlaEscalationService.class);
    private final ClientInactivityService clientInactivityService = mock(ClientInactivityService.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final SlaEscalationScheduler scheduler = new SlaEscalationScheduler(
            cache, lockRepository, escalationService, clientInactivityService,
            Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry, 60_000);

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private void lockAlwaysGranted() {
        when(lockRepository.runWithLock(anyString(), any())).thenAnswer(inv -> {
            Runnable action = inv.getArgument(1);
            action.run();
            return true;
        });
    }

    private static TransferSettings tenant(String id, int responseMinutes, int escalationMinutes, int autoCloseHours, boolean reminders) {
        return new TransferSettings(id, false, true,
                new SlaSettings(true, responseMinutes, 0, escalationMinutes, autoCloseHours, null, null, List.of()),
                new ClientInactivitySettings(reminders, 5, "still there?", 15, null));
    }

    @Test
    void start_and_stop_are_idempotent() {
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void one_failing_tenant_does_not_stop_the_others() {
        lockAlwaysGranted();
        var broken = tenant("tn_broken", 10, 0, 0, false);
        var healthy = tenant("tn_ok", 10, 0, 0, false);
        when(cache.listSlaEnabled()).thenReturn(List.of(broken, healthy));
        when(escalationService.markBreached(eq(broken), any())).thenThrow(new IllegalStateException("db down"));
        when(escalationService.markBreached(eq(healthy), any())).thenReturn(2);

        scheduler.tick(NOW);

        verify(escalationService).markBreached(healthy, NOW);
        assertThat(meterRegistry.counter("relaydesk.sla.breached").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("relaydesk.sla.tick.failures").count()).isEqualTo(1.0);
    }

    @Test
    void steps_run_only_when_their_setting_is_positive() {
        lockAlwaysGranted();
        var s = tenant("tn1", 10, 0, 0, true);
        when(cache.listSlaEnabled()).thenReturn(List.of(s));
        when(clientInactivityService.process(s, NOW)).thenReturn(new ClientInactivityService.Result(1, 0));

        scheduler.tick(NOW);

        verify(escalationService, never()).autoCloseExpired(any(), any());
        verify(escalationService, never()).escalateDue(any(), any());
        verify(escalationService).markBreached(s, NOW);
        verify(clientInactivityService).process(s, NOW);
        assertThat(meterRegistry.counter("relaydesk.sla.client_reminders").count()).isEqualTo(1.0);
    }

    @Test
    void failing_step_does_not_skip_later_steps() {
        lockAlwaysGranted();
        var s = tenant("tn1", 10, 15, 24, false);
        when(cache.listSlaEnabled()).thenReturn(List.of(s));
        when(escalationService.autoCloseExpired(s, NOW)).thenThrow(new IllegalStateException("boom"));
        when(escalationService.escalateDue(s, NOW)).thenReturn(1);

        scheduler.tick(NOW);

        verify(escalationService).escalateDue(s, NOW);
        verify(escalationService).markBreached(s, NOW);
        assertThat(meterRegistry.counter("relaydesk.sla.escalated").count()).isEqualTo(1.0);
    }

    @Test
    void tenant_locked_by_another_instance_is_skipped() {
        var s = tenant("tn1", 10, 15, 24, true);
        when(cache.listSlaEnabled()).thenReturn(List.of(s));
        when(lockRepository.runWithLock(anyString(), any())).thenReturn(false);

        scheduler.tick(NOW);

        verify(escalationService, never()).markBreached(any(), any());
        verify(clientInactivityService, never()).process(any(), any());
    }

    @Test
    void settings_load_failure_is_counted() {
        when(cache.listSlaEnabled()).thenThrow(new IllegalStateException("db down"));

        scheduler.tick(NOW);

        assertThat(meterRegistry.counter("relaydesk.sla.tick.failures").count()).isEqualTo(1.0);
    }
}
