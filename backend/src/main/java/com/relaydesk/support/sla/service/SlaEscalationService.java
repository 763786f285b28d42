package com.relaydesk.support.sla.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaydesk.support.common.ws.OrgNotifier;
import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.message.service.CustomerMessageSender;
import com.relaydesk.support.message.service.SendOptions;
import com.relaydesk.support.message.service.SendRequest;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.transfer.service.TransferEvents;
import com.relaydesk.support.transfer.settings.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * The per-tenant SLA steps run by {@link SlaEscalationScheduler}. Each step isolates failures per transfer,
 * and customer messages are best-effort: a failed send never blocks the state change.
 */
@Service
public class SlaEscalationService {

    private static final Logger log = LoggerFactory.getLogger(SlaEscalationService.class);

    private final TransferRepository transferRepository;
    private final ContactRepository contactRepository;
    private final CustomerMessageSender messageSender;
    private final TransferEvents transferEvents;
    private final OrgNotifier orgNotifier;

    public SlaEscalationService(
            TransferRepository transferRepository,
            ContactRepository contactRepository,
            CustomerMessageSender messageSender,
            TransferEvents transferEvents,
            OrgNotifier orgNotifier
    ) {
        this.transferRepository = transferRepository;
        this.contactRepository = contactRepository;
        this.messageSender = messageSender;
        this.transferEvents = transferEvents;
        this.orgNotifier = orgNotifier;
    }

    /**
     * @return number of transfers moved to expired
     */
    public int autoCloseExpired(TransferSettings settings, Instant now) {
        var tenantId = settings.tenantId();
        var message = settings.sla().autoCloseMessage();
        int closed = 0;
        for (var transfer : transferRepository.listExpired(tenantId, now)) {
            try {
                if (message != null && !message.isBlank()) {
                    sendToCustomer(transfer, message, "sla_auto_close");
                }
                if (transferRepository.expire(tenantId, transfer.id(), now) == 0) {
                    // Resumed or already expired since the scan.
                    continue;
                }
                closed++;
                log.info("sla_transfer_expired tenant={} transferId={} contactId={} expiresAt={}",
                        tenantId, transfer.id(), transfer.contactId(), transfer.slaExpiresAt());
                var updated = transferRepository.findInTenant(tenantId, transfer.id()).orElse(transfer);
                transferEvents.publish(updated, "transfer_expired", null);
            } catch (RuntimeException e) {
                log.warn("sla_expire_failed tenant={} transferId={}", tenantId, transfer.id(), e);
            }
        }
        return closed;
    }

    /**
     * @return number of transfers whose escalation level was raised
     */
    public int escalateDue(TransferSettings settings, Instant now) {
        var tenantId = settings.tenantId();
        int escalated = 0;
        for (var transfer : transferRepository.listDueForEscalation(tenantId, now)) {
            try {
                var newLevel = transfer.escalationLevel() + 1;
                if (transferRepository.escalate(tenantId, transfer.id(), transfer.escalationLevel(), now) == 0) {
                    continue;
                }
                escalated++;
                log.warn("sla_transfer_escalated tenant={} transferId={} contactId={} level={}",
                        tenantId, transfer.id(), transfer.contactId(), newLevel);

                var updated = transferRepository.findInTenant(tenantId, transfer.id()).orElse(transfer);
                notifyEscalation(updated, settings, newLevel);
                transferEvents.publish(updated, "transfer_escalated", null);

                var warning = settings.sla().warningMessage();
                if (newLevel == 1 && warning != null && !warning.isBlank()) {
                    sendToCustomer(updated, warning, "sla_warning");
                }
            } catch (RuntimeException e) {
                log.warn("sla_escalate_failed tenant={} transferId={}", tenantId, transfer.id(), e);
            }
        }
        return escalated;
    }

    /**
     * @return number of unassigned transfers newly flagged as breached
     */
    public int markBreached(TransferSettings settings, Instant now) {
        var n = transferRepository.markBreachedUnassigned(settings.tenantId(), now);
        if (n > 0) {
            log.warn("sla_transfers_breached tenant={} count={}", settings.tenantId(), n);
        }
        return n;
    }

    /**
     * Org-wide broadcast naming the configured escalation recipients; clients filter on the ids.
     */
    void notifyEscalation(TransferRepository.TransferRow transfer, TransferSettings settings, int level) {
        var notifyIds = settings.sla().escalationNotifyIds();
        if (notifyIds.isEmpty()) return;

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("transfer_id", transfer.id());
        payload.put("contact_id", transfer.contactId());
        contactRepository.findInTenant(transfer.tenantId(), transfer.contactId()).ifPresent(c -> {
            payload.put("contact_name", c.profileName());
            payload.put("phone_number", c.phoneNumber());
        });
        payload.put("escalation_level", level);
        payload.put("level_name", level >= 2 ? "critical" : "warning");
        payload.put("waiting_since", transfer.transferredAt() == null ? null : transfer.transferredAt().toString());
        payload.put("team_id", transfer.teamId());
        var ids = payload.putArray("escalation_notify_ids");
        notifyIds.forEach(ids::add);

        orgNotifier.notifyOrg(transfer.tenantId(), "transfer_escalation", payload);
        log.info("sla_escalation_notified tenant={} transferId={} level={} recipients={}",
                transfer.tenantId(), transfer.id(), level, notifyIds.size());
    }

    private void sendToCustomer(TransferRepository.TransferRow transfer, String message, String purpose) {
        var contact = contactRepository.findInTenant(transfer.tenantId(), transfer.contactId()).orElse(null);
        if (contact == null) {
            log.warn("sla_message_skipped tenant={} transferId={} purpose={} reason=contact_not_found",
                    transfer.tenantId(), transfer.id(), purpose);
            return;
        }
        var channelAccount = transfer.channelAccount() != null ? transfer.channelAccount() : contact.channelAccount();
        try {
            messageSender.send(new SendRequest(
                    transfer.tenantId(),
                    contact.id(),
                    channelAccount,
                    contact.phoneNumber(),
                    message,
                    purpose
            ), SendOptions.sla());
            log.info("sla_message_sent tenant={} transferId={} purpose={}", transfer.tenantId(), transfer.id(), purpose);
        } catch (RuntimeException e) {
            log.warn("sla_message_failed tenant={} transferId={} purpose={}", transfer.tenantId(), transfer.id(), purpose, e);
        }
    }
}
