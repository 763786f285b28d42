package com.relaydesk.support.transfer.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.team.repo.TeamRepository;
import com.relaydesk.support.transfer.api.TransferItem;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.user.repo.UserAccountRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Builds API items and event payloads for transfers, resolving contact, agent and team names.
 */
@Component
public class TransferViews {

    private final ContactRepository contactRepository;
    private final UserAccountRepository userAccountRepository;
    private final TeamRepository teamRepository;

    public TransferViews(
            ContactRepository contactRepository,
            UserAccountRepository userAccountRepository,
            TeamRepository teamRepository
    ) {
        this.contactRepository = contactRepository;
        this.userAccountRepository = userAccountRepository;
        this.teamRepository = teamRepository;
    }

    public TransferItem toItem(TransferRepository.TransferRow t) {
        var contact = contactRepository.findInTenant(t.tenantId(), t.contactId()).orElse(null);
        return new TransferItem(
                t.id(),
                t.contactId(),
                contact == null ? null : contact.profileName(),
                contact == null ? null : contact.phoneNumber(),
                t.channelAccount(),
                t.status(),
                t.source(),
                t.agentUserId(),
                userName(t.agentUserId()),
                t.teamId(),
                teamRepository.findName(t.teamId()).orElse(null),
                t.transferredByUserId(),
                userName(t.transferredByUserId()),
                t.notes(),
                toEpochSeconds(t.transferredAt()),
                toEpochSecondsOrNull(t.resumedAt()),
                t.resumedByUserId(),
                toEpochSecondsOrNull(t.slaResponseDeadline()),
                toEpochSecondsOrNull(t.slaExpiresAt()),
                t.slaBreached(),
                t.escalationLevel(),
                toEpochSecondsOrNull(t.pickedUpAt()),
                toEpochSecondsOrNull(t.firstResponseAt())
        );
    }

    /**
     * Payload for org broadcasts and webhooks.
     */
    public ObjectNode toPayload(TransferRepository.TransferRow t) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("id", t.id());
        data.put("contact_id", t.contactId());
        contactRepository.findInTenant(t.tenantId(), t.contactId()).ifPresent(c -> {
            data.put("contact_name", c.profileName());
            data.put("phone_number", c.phoneNumber());
        });
        data.put("channel_account", t.channelAccount());
        data.put("status", t.status());
        data.put("source", t.source());
        data.put("notes", t.notes());
        if (t.agentUserId() != null) {
            data.put("agent_id", t.agentUserId());
            userAccountRepository.findFullName(t.agentUserId()).ifPresent(n -> data.put("agent_name", n));
        }
        if (t.teamId() != null) {
            data.put("team_id", t.teamId());
            teamRepository.findName(t.teamId()).ifPresent(n -> data.put("team_name", n));
        }
        data.put("transferred_at", toEpochSeconds(t.transferredAt()));
        data.put("escalation_level", t.escalationLevel());
        data.put("sla_breached", t.slaBreached());
        return data;
    }

    private String userName(String userId) {
        return userAccountRepository.findFullName(userId).orElse(null);
    }

    private static long toEpochSeconds(Instant instant) {
        if (instant == null) return 0L;
        return instant.getEpochSecond();
    }

    private static Long toEpochSecondsOrNull(Instant instant) {
        return instant == null ? null : instant.getEpochSecond();
    }
}
