package com.relaydesk.support.transfer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaydesk.support.common.ws.OrgNotifier;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.webhook.service.TransferEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Org broadcasts and webhooks for transfer changes. Inside a transaction both fire only after commit.
 */
@Component
public class TransferEvents {

    private static final Logger log = LoggerFactory.getLogger(TransferEvents.class);

    private final OrgNotifier orgNotifier;
    private final TransferEventDispatcher eventDispatcher;
    private final TransferViews transferViews;

    public TransferEvents(OrgNotifier orgNotifier, TransferEventDispatcher eventDispatcher, TransferViews transferViews) {
        this.orgNotifier = orgNotifier;
        this.eventDispatcher = eventDispatcher;
        this.transferViews = transferViews;
    }

    /**
     * @param webhookEvent null to skip the webhook
     */
    public void publish(TransferRepository.TransferRow transfer, String wsType, String webhookEvent) {
        if (transfer == null) return;
        // Payload is read now, while the transaction still sees its own writes.
        var payload = transferViews.toPayload(transfer);
        publish(transfer.tenantId(), wsType, webhookEvent, payload);
    }

    public void publish(String tenantId, String wsType, String webhookEvent, ObjectNode payload) {
        afterCommit(() -> {
            if (wsType != null) {
                orgNotifier.notifyOrg(tenantId, wsType, payload);
            }
            if (webhookEvent != null) {
                eventDispatcher.dispatch(tenantId, webhookEvent, payload);
            }
        });
    }

    void afterCommit(Runnable r) {
        if (r == null) return;
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    runQuietly(r);
                }
            });
        } else {
            runQuietly(r);
        }
    }

    private static void runQuietly(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            log.warn("transfer_event_publish_failed", e);
        }
    }
}
