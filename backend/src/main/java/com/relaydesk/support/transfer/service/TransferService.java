package com.relaydesk.support.transfer.service;

import com.relaydesk.support.auth.service.jwt.JwtClaims;
import com.relaydesk.support.contact.repo.ChatbotSessionRepository;
import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.team.repo.TeamMemberRepository;
import com.relaydesk.support.team.repo.TeamRepository;
import com.relaydesk.support.team.service.TeamAssignmentService;
import com.relaydesk.support.transfer.api.AssignTransferRequest;
import com.relaydesk.support.transfer.api.AssignTransferResponse;
import com.relaydesk.support.transfer.api.CreateTransferRequest;
import com.relaydesk.support.transfer.api.TransferItem;
import com.relaydesk.support.transfer.api.TransferListResponse;
import com.relaydesk.support.transfer.repo.TransferDraft;
import com.relaydesk.support.transfer.repo.TransferRepository;
import com.relaydesk.support.transfer.settings.TransferSettings;
import com.relaydesk.support.transfer.settings.TransferSettingsRepository;
import com.relaydesk.support.user.repo.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private static final Set<String> SOURCES = Set.of("manual", "flow", "keyword");
    private static final int LIST_LIMIT = 500;

    private final TransferRepository transferRepository;
    private final ContactRepository contactRepository;
    private final ChatbotSessionRepository chatbotSessionRepository;
    private final UserAccountRepository userAccountRepository;
    private final TeamRepository teamRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final TeamAssignmentService teamAssignmentService;
    private final TransferSettingsRepository settingsRepository;
    private final TransferSlaService transferSlaService;
    private final TransferEvents transferEvents;
    private final TransferViews transferViews;
    private final Clock clock;

    public TransferService(
            TransferRepository transferRepository,
            ContactRepository contactRepository,
            ChatbotSessionRepository chatbotSessionRepository,
            UserAccountRepository userAccountRepository,
            TeamRepository teamRepository,
            TeamMemberRepository teamMemberRepository,
            TeamAssignmentService teamAssignmentService,
            TransferSettingsRepository settingsRepository,
            TransferSlaService transferSlaService,
            TransferEvents transferEvents,
            TransferViews transferViews,
            Clock clock
    ) {
        this.transferRepository = transferRepository;
        this.contactRepository = contactRepository;
        this.chatbotSessionRepository = chatbotSessionRepository;
        this.userAccountRepository = userAccountRepository;
        this.teamRepository = teamRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.teamAssignmentService = teamAssignmentService;
        this.settingsRepository = settingsRepository;
        this.transferSlaService = transferSlaService;
        this.transferEvents = transferEvents;
        this.transferViews = transferViews;
        this.clock = clock;
    }

    @Transactional
    public TransferItem createTransfer(JwtClaims claims, CreateTransferRequest req) {
        requireStaff(claims);
        if (req == null || req.contact_id() == null || req.contact_id().isBlank()) {
            throw new IllegalArgumentException("contact_id_required");
        }
        var tenantId = claims.tenantId();
        var contact = contactRepository.findInTenant(tenantId, req.contact_id().trim())
                .orElseThrow(() -> new IllegalArgumentException("contact_not_found"));

        if (transferRepository.existsActiveForContact(tenantId, contact.id())) {
            throw new IllegalArgumentException("active_transfer_exists");
        }

        var teamId = requireTeamIfGiven(tenantId, req.team_id());

        String explicitAgentId = null;
        if (req.agent_id() != null && !req.agent_id().isBlank()) {
            explicitAgentId = requireAvailableAgent(tenantId, req.agent_id().trim());
        }

        var settings = settingsRepository.getOrDefault(tenantId);
        var transferId = insertTransfer(settings, contact, req.channel_account(), explicitAgentId, teamId,
                req.notes(), req.source(), claims.userId());

        var row = transferRepository.findInTenant(tenantId, transferId)
                .orElseThrow(() -> new IllegalStateException("transfer_insert_lost"));
        transferEvents.publish(row, "agent_transfer", "transfer.created");
        log.info("transfer_created tenant={} transferId={} contactId={} agentUserId={} teamId={} by={}",
                tenantId, transferId, contact.id(), row.agentUserId(), teamId, claims.userId());
        return transferViews.toItem(row);
    }

    /**
     * Entry point for chatbot flows and keyword rules. Returns empty instead of failing when the contact
     * already has an active transfer or the contact is gone.
     */
    @Transactional
    public Optional<String> createFromAutomation(
            String tenantId,
            String contactId,
            String channelAccount,
            String teamId,
            String notes,
            String source
    ) {
        var contact = contactRepository.findInTenant(tenantId, contactId).orElse(null);
        if (contact == null) {
            log.warn("automation_transfer_skipped tenant={} contactId={} reason=contact_not_found", tenantId, contactId);
            return Optional.empty();
        }
        if (transferRepository.existsActiveForContact(tenantId, contactId)) {
            log.debug("automation_transfer_skipped tenant={} contactId={} reason=active_transfer_exists", tenantId, contactId);
            return Optional.empty();
        }

        String effectiveTeamId = null;
        if (teamId != null && !teamId.isBlank()) {
            effectiveTeamId = teamRepository.findActive(tenantId, teamId).map(TeamRepository.TeamRow::id).orElse(null);
            if (effectiveTeamId == null) {
                log.warn("automation_transfer_team_ignored tenant={} teamId={} reason=team_not_found", tenantId, teamId);
            }
        }

        var settings = settingsRepository.getOrDefault(tenantId);
        String transferId;
        try {
            transferId = insertTransfer(settings, contact, channelAccount, null, effectiveTeamId, notes, source, null);
        } catch (IllegalArgumentException e) {
            if (!"active_transfer_exists".equals(e.getMessage())) throw e;
            // Lost the race against a concurrent create; nothing of ours may commit.
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            log.debug("automation_transfer_skipped tenant={} contactId={} reason=concurrent_create", tenantId, contactId);
            return Optional.empty();
        }

        var row = transferRepository.findInTenant(tenantId, transferId)
                .orElseThrow(() -> new IllegalStateException("transfer_insert_lost"));
        transferEvents.publish(row, "agent_transfer", "transfer.created");
        log.info("transfer_created tenant={} transferId={} contactId={} agentUserId={} teamId={} source={}",
                tenantId, transferId, contactId, row.agentUserId(), effectiveTeamId, row.source());
        return Optional.of(transferId);
    }

    @Transactional
    public AssignTransferResponse assignTransfer(JwtClaims claims, String transferId, AssignTransferRequest req) {
        requireStaff(claims);
        var tenantId = claims.tenantId();
        var transfer = transferRepository.findInTenant(tenantId, transferId)
                .orElseThrow(() -> new IllegalArgumentException("transfer_not_found"));
        if (!transfer.isActive()) {
            throw new IllegalArgumentException("transfer_not_active");
        }

        var requested = req == null ? null : req.agent_id();
        String target;
        if (requested != null && !requested.isBlank()) {
            if ("agent".equals(claims.role())) {
                throw new IllegalArgumentException("forbidden");
            }
            target = requireAvailableAgent(tenantId, requested.trim());
        } else if ("agent".equals(claims.role())) {
            target = claims.userId();
        } else {
            target = null;
        }

        if (transferRepository.assignAgent(tenantId, transferId, target) == 0) {
            throw new IllegalArgumentException("transfer_not_active");
        }
        if (target != null) {
            contactRepository.updateAssignedUser(transfer.contactId(), target);
        }

        var row = transferRepository.findInTenant(tenantId, transferId).orElse(transfer);
        transferEvents.publish(row, "agent_transfer_assign", "transfer.assigned");
        log.info("transfer_assigned tenant={} transferId={} from={} to={} by={}",
                tenantId, transferId, transfer.agentUserId(), target, claims.userId());
        return new AssignTransferResponse(target);
    }

    @Transactional
    public void resumeFromTransfer(JwtClaims claims, String transferId) {
        requireStaff(claims);
        var tenantId = claims.tenantId();
        var transfer = transferRepository.findInTenant(tenantId, transferId)
                .orElseThrow(() -> new IllegalArgumentException("transfer_not_found"));
        if (!transfer.isActive()) {
            throw new IllegalArgumentException("transfer_not_active");
        }

        if (transferRepository.resume(tenantId, transferId, claims.userId(), clock.instant()) == 0) {
            throw new IllegalArgumentException("transfer_not_active");
        }

        var settings = settingsRepository.getOrDefault(tenantId);
        if (!settings.assignToSameAgent()) {
            contactRepository.updateAssignedUser(transfer.contactId(), null);
        }

        var row = transferRepository.findInTenant(tenantId, transferId).orElse(transfer);
        transferEvents.publish(row, "agent_transfer_resume", "transfer.resumed");
        log.info("transfer_resumed tenant={} transferId={} by={}", tenantId, transferId, claims.userId());
    }

    @Transactional(readOnly = true)
    public TransferListResponse listTransfers(JwtClaims claims, String status, String teamFilter) {
        requireStaff(claims);
        var tenantId = claims.tenantId();
        List<String> myTeams = claims.isAdmin()
                ? List.of()
                : teamMemberRepository.listTeamIdsForUser(tenantId, claims.userId());

        var viewer = new TransferRepository.Viewer(claims.role(), claims.userId(), myTeams);
        var rows = transferRepository.list(tenantId, blankToNull(status), blankToNull(teamFilter), viewer, LIST_LIMIT);

        var counts = transferRepository.countQueuedByTeam(tenantId);
        var general = counts.getOrDefault(null, 0);
        var teamCounts = new LinkedHashMap<String, Integer>();
        counts.forEach((teamId, n) -> {
            if (teamId == null) return;
            if (claims.isAdmin() || myTeams.contains(teamId)) {
                teamCounts.put(teamId, n);
            }
        });

        var items = rows.stream().map(transferViews::toItem).toList();
        return new TransferListResponse(items, general, teamCounts);
    }

    /**
     * Agent resolution order: explicit agent, team strategy, the contact's current owner, otherwise queued.
     */
    private String insertTransfer(
            TransferSettings settings,
            ContactRepository.ContactRow contact,
            String channelAccount,
            String explicitAgentId,
            String teamId,
            String notes,
            String source,
            String byUserId
    ) {
        var tenantId = contact.tenantId();
        var now = clock.instant();

        String agentId = explicitAgentId;
        if (agentId == null && teamId != null) {
            agentId = teamAssignmentService.assignToTeam(teamId, tenantId).orElse(null);
        } else if (agentId == null && settings.assignToSameAgent() && contact.assignedUserId() != null) {
            agentId = userAccountRepository.findInTenant(tenantId, contact.assignedUserId())
                    .filter(u -> u.active() && u.available())
                    .map(UserAccountRepository.AgentRow::id)
                    .orElse(null);
        }

        var draft = TransferDraft.of(
                tenantId,
                contact.id(),
                channelAccount == null || channelAccount.isBlank() ? contact.channelAccount() : channelAccount.trim(),
                normalizeSource(source),
                agentId,
                teamId,
                byUserId,
                notes == null ? "" : notes,
                now
        );
        draft = transferSlaService.setSlaDeadlines(draft, settings.sla(), now);

        String transferId;
        try {
            transferId = transferRepository.insert(draft);
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("active_transfer_exists");
        }

        if (agentId != null) {
            contactRepository.updateAssignedUser(contact.id(), agentId);
        }
        chatbotSessionRepository.cancelActive(tenantId, contact.id(), now);
        transferSlaService.clearChatbotTracking(contact.id());
        return transferId;
    }

    private String requireTeamIfGiven(String tenantId, String teamId) {
        if (teamId == null || teamId.isBlank()) return null;
        return teamRepository.findActive(tenantId, teamId.trim())
                .map(TeamRepository.TeamRow::id)
                .orElseThrow(() -> new IllegalArgumentException("team_not_found"));
    }

    private String requireAvailableAgent(String tenantId, String agentId) {
        var agent = userAccountRepository.findInTenant(tenantId, agentId)
                .orElseThrow(() -> new IllegalArgumentException("agent_not_found"));
        if (!agent.active() || !agent.available()) {
            throw new IllegalArgumentException("agent_unavailable");
        }
        return agent.id();
    }

    static String normalizeSource(String raw) {
        var s = raw == null ? "" : raw.trim().toLowerCase();
        return SOURCES.contains(s) ? s : "manual";
    }

    static void requireStaff(JwtClaims claims) {
        if (claims == null) throw new IllegalArgumentException("unauthorized");
        var role = claims.role();
        if (!"agent".equals(role) && !"manager".equals(role) && !"admin".equals(role)) {
            throw new IllegalArgumentException("forbidden");
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
