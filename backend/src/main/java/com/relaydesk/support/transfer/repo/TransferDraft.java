package com.relaydesk.support.transfer.repo;

import java.time.Instant;

/**
 * A transfer about to be inserted. SLA deadlines are null until attached.
 */
public record TransferDraft(
        String tenantId,
        String contactId,
        String channelAccount,
        String source,
        String agentUserId,
        String teamId,
        String transferredByUserId,
        String notes,
        Instant transferredAt,
        Instant slaResponseDeadline,
        Instant slaResolutionDeadline,
        Instant slaEscalationAt,
        Instant slaExpiresAt
) {

    public static TransferDraft of(
            String tenantId,
            String contactId,
            String channelAccount,
            String source,
            String agentUserId,
            String teamId,
            String transferredByUserId,
            String notes,
            Instant transferredAt
    ) {
        return new TransferDraft(tenantId, contactId, channelAccount, source, agentUserId, teamId,
                transferredByUserId, notes, transferredAt, null, null, null, null);
    }

    public TransferDraft withSlaDeadlines(Instant response, Instant resolution, Instant escalation, Instant expires) {
        return new TransferDraft(tenantId, contactId, channelAccount, source, agentUserId, teamId,
                transferredByUserId, notes, transferredAt, response, resolution, escalation, expires);
    }
}
