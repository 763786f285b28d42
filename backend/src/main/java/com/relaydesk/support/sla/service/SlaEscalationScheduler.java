package com.relaydesk.support.sla.service;

import com.relaydesk.support.common.lock.PgAdvisoryLockRepository;
import com.relaydesk.support.transfer.settings.TransferSettings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic SLA sweep: auto-close, escalation, breach marking and client inactivity, tenant by tenant.
 * <p>
 * Owns a single-thread executor, so ticks never overlap. {@link #start()} and {@link #stop()} are explicit;
 * {@link SlaSchedulerLauncher} wires them to the application lifecycle.
 */
@Component
public class SlaEscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(SlaEscalationScheduler.class);

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final SlaSettingsCache slaSettingsCache;
    private final PgAdvisoryLockRepository lockRepository;
    private final SlaEscalationService escalationService;
    private final ClientInactivityService clientInactivityService;
    private final Clock clock;
    private final long intervalMs;

    private final Counter expiredCounter;
    private final Counter escalatedCounter;
    private final Counter breachedCounter;
    private final Counter remindedCounter;
    private final Counter clientClosedCounter;
    private final Counter tickFailures;
    private final Timer tickDuration;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;

    public SlaEscalationScheduler(
            SlaSettingsCache slaSettingsCache,
            PgAdvisoryLockRepository lockRepository,
            SlaEscalationService escalationService,
            ClientInactivityService clientInactivityService,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.sla.scan-interval-ms:60000}") long intervalMs
    ) {
        this.slaSettingsCache = slaSettingsCache;
        this.lockRepository = lockRepository;
        this.escalationService = escalationService;
        this.clientInactivityService = clientInactivityService;
        this.clock = clock;
        this.intervalMs = Math.max(1_000, intervalMs);

        // Low-cardinality metrics: no tenant tags.
        this.expiredCounter = Counter.builder("relaydesk.sla.expired")
                .description("Transfers auto-closed after their SLA expiry")
                .register(meterRegistry);
        this.escalatedCounter = Counter.builder("relaydesk.sla.escalated")
                .description("Transfer escalation level increments")
                .register(meterRegistry);
        this.breachedCounter = Counter.builder("relaydesk.sla.breached")
                .description("Unassigned transfers flagged as breached by the sweep")
                .register(meterRegistry);
        this.remindedCounter = Counter.builder("relaydesk.sla.client_reminders")
                .description("Inactivity reminders sent to customers")
                .register(meterRegistry);
        this.clientClosedCounter = Counter.builder("relaydesk.sla.client_auto_closed")
                .description("Chatbot conversations closed for customer inactivity")
                .register(meterRegistry);
        this.tickFailures = Counter.builder("relaydesk.sla.tick.failures")
                .description("Tenant or step failures inside an SLA tick")
                .register(meterRegistry);
        this.tickDuration = Timer.builder("relaydesk.sla.tick.duration")
                .description("Duration of one SLA tick over all tenants")
                .register(meterRegistry);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (executor != null) {
                return;
            }
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "sla-escalation-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            task = executor.scheduleWithFixedDelay(this::runTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("sla_scheduler_started intervalMs={}", intervalMs);
        }
    }

    /**
     * Prevents further ticks. A tick already running is allowed to finish.
     */
    @PreDestroy
    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (lifecycleLock) {
            if (executor == null) {
                return;
            }
            task.cancel(false);
            toStop = executor;
            executor = null;
            task = null;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("sla_scheduler_stop_timeout seconds={}", STOP_TIMEOUT_SECONDS);
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toStop.shutdownNow();
        }
        log.info("sla_scheduler_stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null;
        }
    }

    public void tick() {
        tick(clock.instant());
    }

    /**
     * One sweep over every SLA-enabled tenant, evaluated against {@code now}.
     */
    public void tick(Instant now) {
        var sample = Timer.start();
        try {
            List<TransferSettings> tenants;
            try {
                tenants = slaSettingsCache.listSlaEnabled();
            } catch (RuntimeException e) {
                tickFailures.increment();
                log.error("sla_settings_load_failed", e);
                return;
            }
            for (var settings : tenants) {
                try {
                    var ran = lockRepository.runWithLock("sla_escalation:" + settings.tenantId(),
                            () -> processTenant(settings, now));
                    if (!ran) {
                        log.debug("sla_tenant_skipped tenant={} reason=locked_elsewhere", settings.tenantId());
                    }
                } catch (RuntimeException e) {
                    tickFailures.increment();
                    log.warn("sla_tenant_failed tenant={}", settings.tenantId(), e);
                }
            }
        } finally {
            sample.stop(tickDuration);
        }
    }

    void processTenant(TransferSettings settings, Instant now) {
        var sla = settings.sla();
        var tenantId = settings.tenantId();

        if (sla.autoCloseHours() > 0) {
            step(tenantId, "auto_close", () -> expiredCounter.increment(escalationService.autoCloseExpired(settings, now)));
        }
        if (sla.escalationMinutes() > 0) {
            step(tenantId, "escalate", () -> escalatedCounter.increment(escalationService.escalateDue(settings, now)));
        }
        if (sla.responseMinutes() > 0) {
            step(tenantId, "breach", () -> breachedCounter.increment(escalationService.markBreached(settings, now)));
        }
        if (settings.clientInactivity().reminderEnabled()) {
            step(tenantId, "client_inactivity", () -> {
                var r = clientInactivityService.process(settings, now);
                remindedCounter.increment(r.reminded());
                clientClosedCounter.increment(r.closed());
            });
        }
    }

    private void step(String tenantId, String name, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            tickFailures.increment();
            log.warn("sla_step_failed tenant={} step={}", tenantId, name, e);
        }
    }

    private void runTick() {
        // An exception escaping here would cancel all future runs of the scheduled task.
        try {
            tick();
        } catch (RuntimeException e) {
            tickFailures.increment();
            log.error("sla_tick_failed", e);
        }
    }
}
