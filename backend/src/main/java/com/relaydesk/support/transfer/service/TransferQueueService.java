package com.relaydesk.support.transfer.service;

import com.relaydesk.support.auth.service.jwt.JwtClaims;
import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.team.repo.TeamMemberRepository;
import com.relaydesk.support.transfer.api.TransferItem;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.transfer.settings.TransferSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Self-service pickup from the transfer queue.
 */
@Service
public class TransferQueueService {

    private static final Logger log = LoggerFactory.getLogger(TransferQueueService.class);

    private final TransferRepository transferRepository;
    private final ContactRepository contactRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final TransferSettingsRepository settingsRepository;
    private final TransferSlaService transferSlaService;
    private final TransferEvents transferEvents;
    private final TransferViews transferViews;
    private final Clock clock;
    private final int maxAttempts;

    public TransferQueueService(
            TransferRepository transferRepository,
            ContactRepository contactRepository,
            TeamMemberRepository teamMemberRepository,
            TransferSettingsRepository settingsRepository,
            TransferSlaService transferSlaService,
            TransferEvents transferEvents,
            TransferViews transferViews,
            Clock clock,
            @Value("${app.transfer.pick-max-attempts:5}") int maxAttempts
    ) {
        this.transferRepository = transferRepository;
        this.contactRepository = contactRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.settingsRepository = settingsRepository;
        this.transferSlaService = transferSlaService;
        this.transferEvents = transferEvents;
        this.transferViews = transferViews;
        this.clock = clock;
        this.maxAttempts = Math.max(1, Math.min(maxAttempts, 50));
    }

    /**
     * Claims the oldest unassigned transfer visible to the caller.
     * Concurrent callers never receive the same transfer: rows locked by another picker are skipped,
     * and the claim itself only succeeds while the row is still unassigned.
     *
     * @param teamFilter null for the caller's default scope, {@code general} for unteamed rows, otherwise a team id
     * @return empty when nothing in scope is waiting
     */
    @Transactional
    public Optional<TransferItem> pickNextTransfer(JwtClaims claims, String teamFilter) {
        TransferService.requireStaff(claims);
        var tenantId = claims.tenantId();

        if ("agent".equals(claims.role()) && !settingsRepository.getOrDefault(tenantId).allowAgentQueuePickup()) {
            throw new IllegalArgumentException("forbidden");
        }

        var scope = resolveScope(claims, teamFilter);

        var skipped = new ArrayList<String>();
        String claimedId = null;
        for (int attempt = 0; attempt < maxAttempts && claimedId == null; attempt++) {
            var candidate = transferRepository.lockNextQueued(tenantId, scope, skipped).orElse(null);
            if (candidate == null) {
                return Optional.empty();
            }
            if (transferRepository.tryClaim(tenantId, candidate, claims.userId()) == 1) {
                claimedId = candidate;
            } else {
                skipped.add(candidate);
            }
        }
        if (claimedId == null) {
            log.info("transfer_pick_exhausted tenant={} userId={} attempts={}", tenantId, claims.userId(), maxAttempts);
            return Optional.empty();
        }

        var claimed = transferRepository.findInTenant(tenantId, claimedId)
                .orElseThrow(() -> new IllegalStateException("transfer_claim_lost"));
        transferSlaService.updateSlaOnPickup(claimed, clock.instant());
        contactRepository.updateAssignedUser(claimed.contactId(), claims.userId());

        var row = transferRepository.findInTenant(tenantId, claimedId).orElse(claimed);
        transferEvents.publish(row, "agent_transfer_assign", null);
        log.info("transfer_picked tenant={} transferId={} userId={} teamId={}", tenantId, claimedId, claims.userId(), row.teamId());
        return Optional.of(transferViews.toItem(row));
    }

    private TransferRepository.QueueScope resolveScope(JwtClaims claims, String teamFilter) {
        var filter = teamFilter == null ? "" : teamFilter.trim();
        if (TransferRepository.GENERAL_QUEUE.equals(filter)) {
            return TransferRepository.QueueScope.generalOnly();
        }
        if (!filter.isEmpty()) {
            if (!claims.isAdmin()
                    && !teamMemberRepository.listTeamIdsForUser(claims.tenantId(), claims.userId()).contains(filter)) {
                throw new IllegalArgumentException("forbidden");
            }
            return TransferRepository.QueueScope.team(filter);
        }
        if (claims.isAdmin()) {
            return TransferRepository.QueueScope.everything();
        }
        return TransferRepository.QueueScope.teamsAndGeneral(
                teamMemberRepository.listTeamIdsForUser(claims.tenantId(), claims.userId()));
    }
}
