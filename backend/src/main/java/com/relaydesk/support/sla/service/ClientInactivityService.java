package com.relaydesk.support.sla.service;

import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.message.service.CustomerMessageSender;
import com.relaydesk.support.message.service.SendOptions;
import com.relaydesk.support.message.service.SendRequest;
import com.relaydesk.support.transfer.settings.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Reminds or closes chatbot conversations where the customer stopped answering.
 * Contacts with an active human transfer are left alone.
 */
@Service
public class ClientInactivityService {

    private static final Logger log = LoggerFactory.getLogger(ClientInactivityService.class);

    public record Result(int reminded, int closed) {
    }

    private final ContactRepository contactRepository;
    private final CustomerMessageSender messageSender;

    public ClientInactivityService(ContactRepository contactRepository, CustomerMessageSender messageSender) {
        this.contactRepository = contactRepository;
        this.messageSender = messageSender;
    }

    public Result process(TransferSettings settings, Instant now) {
        var ci = settings.clientInactivity();
        if (!ci.reminderEnabled()) return new Result(0, 0);

        var tenantId = settings.tenantId();
        int reminded = 0;
        int closed = 0;
        for (var contact : contactRepository.listAwaitingChatbotReply(tenantId)) {
            try {
                var elapsed = Duration.between(contact.chatbotLastMessageAt(), now);

                // Auto-close wins over the reminder.
                if (ci.autoCloseMinutes() > 0 && elapsed.compareTo(Duration.ofMinutes(ci.autoCloseMinutes())) >= 0) {
                    if (ci.autoCloseMessage() != null && !ci.autoCloseMessage().isBlank()) {
                        trySend(contact, ci.autoCloseMessage(), "client_auto_close");
                    }
                    contactRepository.clearChatbotTracking(contact.id());
                    closed++;
                    log.info("client_inactivity_closed tenant={} contactId={} inactiveSince={}",
                            tenantId, contact.id(), contact.chatbotLastMessageAt());
                    continue;
                }

                if (ci.reminderMinutes() > 0
                        && !contact.chatbotReminderSent()
                        && elapsed.compareTo(Duration.ofMinutes(ci.reminderMinutes())) >= 0) {
                    if (ci.reminderMessage() == null || ci.reminderMessage().isBlank()) {
                        continue;
                    }
                    // The flag is only set after a successful send, so a failed reminder is retried next tick.
                    if (trySend(contact, ci.reminderMessage(), "client_reminder")
                            && contactRepository.markReminderSent(contact.id()) == 1) {
                        reminded++;
                        log.info("client_inactivity_reminded tenant={} contactId={} inactiveSince={}",
                                tenantId, contact.id(), contact.chatbotLastMessageAt());
                    }
                }
            } catch (RuntimeException e) {
                log.warn("client_inactivity_failed tenant={} contactId={}", tenantId, contact.id(), e);
            }
        }
        return new Result(reminded, closed);
    }

    private boolean trySend(ContactRepository.ChatbotTrackingRow contact, String message, String purpose) {
        try {
            messageSender.send(new SendRequest(
                    contact.tenantId(),
                    contact.id(),
                    contact.channelAccount(),
                    contact.phoneNumber(),
                    message,
                    purpose
            ), SendOptions.sla());
            return true;
        } catch (RuntimeException e) {
            log.warn("client_inactivity_send_failed tenant={} contactId={} purpose={}",
                    contact.tenantId(), contact.id(), purpose, e);
            return false;
        }
    }
}
