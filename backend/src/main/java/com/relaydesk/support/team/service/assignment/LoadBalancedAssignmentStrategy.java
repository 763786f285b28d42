package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository;
import org.springframework.stereotype.Component;

/**
 * Picks the candidate with the fewest active transfers. Equal loads keep enumeration order.
 */
@Component("load_balanced")
public class LoadBalancedAssignmentStrategy implements AssignmentStrategy {

    @Override
    public TeamMemberRepository.AgentCandidateRow select(AssignmentContext ctx) {
        if (ctx == null || ctx.candidates() == null || ctx.candidates().isEmpty()) return null;

        var loads = ctx.activeLoads();

        TeamMemberRepository.AgentCandidateRow lowest = null;
        int lowestActive = Integer.MAX_VALUE;
        for (var c : ctx.candidates()) {
            if (c == null) continue;
            var active = loads == null ? 0 : loads.getOrDefault(c.userId(), 0);
            if (lowest == null || active < lowestActive) {
                lowest = c;
                lowestActive = active;
            }
        }
        return lowest;
    }

    @Override
    public boolean needsActiveLoads() {
        return true;
    }
}
