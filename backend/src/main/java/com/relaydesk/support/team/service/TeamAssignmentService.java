package com.relaydesk.support.team.service;

import com.relaydesk.support.team.repo.TeamMemberRepository;
import com.relaydesk.support.team.repo.TeamRepository;
import com.relaydesk.support.team.service.assignment.AssignmentContext;
import com.relaydesk.support.team.service.assignment.AssignmentStrategyResolver;
import com.relaydesk.support.transfer.repo.TransferRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Picks an agent from a team according to the team's assignment strategy.
 * Runs inside the caller's transaction and takes no locks of its own.
 */
@Service
public class TeamAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(TeamAssignmentService.class);

    private final TeamRepository teamRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final TransferRepository transferRepository;
    private final AssignmentStrategyResolver assignmentStrategyResolver;
    private final Clock clock;

    public TeamAssignmentService(
            TeamRepository teamRepository,
            TeamMemberRepository teamMemberRepository,
            TransferRepository transferRepository,
            AssignmentStrategyResolver assignmentStrategyResolver,
            Clock clock
    ) {
        this.teamRepository = teamRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.transferRepository = transferRepository;
        this.assignmentStrategyResolver = assignmentStrategyResolver;
        this.clock = clock;
    }

    public Optional<String> assignToTeam(String teamId, String tenantId) {
        var team = teamRepository.findActive(tenantId, teamId).orElse(null);
        if (team == null) {
            log.info("team_assign_skipped tenant={} teamId={} reason=team_not_found_or_inactive", tenantId, teamId);
            return Optional.empty();
        }

        var strategy = assignmentStrategyResolver.resolve(team.assignmentStrategy());

        var candidates = strategy.advancesCursor()
                ? teamMemberRepository.listAvailableAgentsByLastAssigned(teamId)
                : teamMemberRepository.listAvailableAgents(teamId);
        if (candidates.isEmpty()) {
            log.debug("team_assign_no_candidates tenant={} teamId={}", tenantId, teamId);
            return Optional.empty();
        }

        Map<String, Integer> loads = strategy.needsActiveLoads()
                ? transferRepository.countActiveByAgents(tenantId, candidates.stream().map(TeamMemberRepository.AgentCandidateRow::userId).toList())
                : Map.of();

        var selected = strategy.select(new AssignmentContext(tenantId, teamId, candidates, loads));
        if (selected == null) {
            return Optional.empty();
        }

        if (strategy.advancesCursor()) {
            teamMemberRepository.touchLastAssigned(teamId, selected.userId(), clock.instant());
        }
        log.debug("team_assign_selected tenant={} teamId={} agentUserId={}", tenantId, teamId, selected.userId());
        return Optional.of(selected.userId());
    }
}
