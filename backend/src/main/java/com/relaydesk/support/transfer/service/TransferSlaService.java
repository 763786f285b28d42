package com.relaydesk.support.transfer.service;

import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.transfer.repo.TransferDraft;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.transfer.settings.SlaSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * SLA bookkeeping on a transfer's lifecycle, plus the chatbot inactivity markers on contacts.
 */
@Service
public class TransferSlaService {

    private static final Logger log = LoggerFactory.getLogger(TransferSlaService.class);

    private final TransferRepository transferRepository;
    private final ContactRepository contactRepository;
    private final Clock clock;

    public TransferSlaService(TransferRepository transferRepository, ContactRepository contactRepository, Clock clock) {
        this.transferRepository = transferRepository;
        this.contactRepository = contactRepository;
        this.clock = clock;
    }

    /**
     * Attaches deadlines relative to {@code now}. Returns the draft unchanged when SLA is off;
     * each deadline is skipped independently when its duration is not positive.
     */
    public TransferDraft setSlaDeadlines(TransferDraft draft, SlaSettings settings, Instant now) {
        if (draft == null || settings == null || !settings.enabled()) return draft;

        var withSla = draft.withSlaDeadlines(
                plus(now, Duration.ofMinutes(settings.responseMinutes())),
                plus(now, Duration.ofMinutes(settings.resolutionMinutes())),
                plus(now, Duration.ofMinutes(settings.escalationMinutes())),
                plus(now, Duration.ofHours(settings.autoCloseHours()))
        );
        log.debug("sla_deadlines_set contactId={} response={} escalation={} expires={}",
                draft.contactId(), withSla.slaResponseDeadline(), withSla.slaEscalationAt(), withSla.slaExpiresAt());
        return withSla;
    }

    /**
     * Records the pickup time and flags the breach if the response deadline already passed.
     *
     * @return whether the pickup was late
     */
    public boolean updateSlaOnPickup(TransferRepository.TransferRow transfer, Instant now) {
        transferRepository.markPickedUp(transfer.id(), now);
        var deadline = transfer.slaResponseDeadline();
        var late = deadline != null && now.isAfter(deadline);
        if (late) {
            log.info("sla_breached_on_pickup tenant={} transferId={}", transfer.tenantId(), transfer.id());
        }
        return late;
    }

    /**
     * Sets first_response_at once; later calls are no-ops.
     */
    public boolean updateSlaOnFirstResponse(String tenantId, String transferId) {
        return transferRepository.markFirstResponse(tenantId, transferId, clock.instant()) == 1;
    }

    /**
     * The chatbot just messaged the contact: restart the inactivity clock.
     */
    public void markChatbotMessage(String contactId) {
        contactRepository.markChatbotMessage(contactId, clock.instant());
    }

    public void clearChatbotTracking(String contactId) {
        contactRepository.clearChatbotTracking(contactId);
    }

    private static Instant plus(Instant now, Duration d) {
        if (d.isZero() || d.isNegative()) return null;
        return now.plus(d);
    }
}
