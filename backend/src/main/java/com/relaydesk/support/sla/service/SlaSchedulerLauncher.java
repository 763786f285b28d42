package com.relaydesk.support.sla.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the SLA scheduler once the application is ready and stops it on shutdown.
 */
@Component
@ConditionalOnProperty(name = "app.sla.enabled", havingValue = "true", matchIfMissing = true)
public class SlaSchedulerLauncher {

    private final SlaEscalationScheduler scheduler;

    public SlaSchedulerLauncher(SlaEscalationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        scheduler.start();
    }

    @EventListener(ContextClosedEvent.class)
    public void onClosed() {
        scheduler.stop();
    }
}
