package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository;

import java.util.List;
import java.util.Map;

public record AssignmentContext(
        String tenantId,
        String teamId,
        List<TeamMemberRepository.AgentCandidateRow> candidates,
        Map<String, Integer> activeLoads
) {
}
