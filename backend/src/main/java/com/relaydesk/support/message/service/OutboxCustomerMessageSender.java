package com.relaydesk.support.message.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.relaydesk.support.common.ws.OrgNotifier;
import com.relaydesk.support.message.repo.OutboundMessageRepository;
import com.relaydesk.support.webhook.service.TransferEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Writes outgoing customer texts to the outbound_message table, where the channel worker picks them up.
 */
@Service
public class OutboxCustomerMessageSender implements CustomerMessageSender {

    private static final Logger log = LoggerFactory.getLogger(OutboxCustomerMessageSender.class);

    private final OutboundMessageRepository outboundMessageRepository;
    private final OrgNotifier orgNotifier;
    private final TransferEventDispatcher eventDispatcher;
    private final Clock clock;

    public OutboxCustomerMessageSender(
            OutboundMessageRepository outboundMessageRepository,
            OrgNotifier orgNotifier,
            TransferEventDispatcher eventDispatcher,
            Clock clock
    ) {
        this.outboundMessageRepository = outboundMessageRepository;
        this.orgNotifier = orgNotifier;
        this.eventDispatcher = eventDispatcher;
        this.clock = clock;
    }

    @Override
    public SendResult send(SendRequest request, SendOptions options) {
        if (request == null || request.contactId() == null || request.contactId().isBlank()) {
            throw new IllegalArgumentException("contact_id_required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("message_content_required");
        }
        var opts = options == null ? SendOptions.sla() : options;

        var id = outboundMessageRepository.insertPending(
                request.tenantId(),
                request.contactId(),
                request.channelAccount(),
                request.content(),
                request.purpose() == null ? "text" : request.purpose(),
                clock.instant()
        );

        var data = JsonNodeFactory.instance.objectNode();
        data.put("message_id", id);
        data.put("contact_id", request.contactId());
        data.put("purpose", request.purpose());
        data.put("content", request.content());

        if (opts.broadcast()) {
            orgNotifier.notifyOrg(request.tenantId(), "message_queued", data);
        }
        if (opts.webhook()) {
            eventDispatcher.dispatch(request.tenantId(), "message.queued", data);
        }

        log.debug("outbound_message_queued tenant={} contactId={} purpose={} messageId={}",
                request.tenantId(), request.contactId(), request.purpose(), id);
        return new SendResult(id, "pending");
    }
}
