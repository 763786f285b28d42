package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository;
import org.springframework.stereotype.Component;

/**
 * Least recently assigned member wins; a member never assigned sorts before everyone else.
 * Candidates with the same cursor keep enumeration order.
 */
@Component("round_robin")
public class RoundRobinAssignmentStrategy implements AssignmentStrategy {

    @Override
    public TeamMemberRepository.AgentCandidateRow select(AssignmentContext ctx) {
        if (ctx == null || ctx.candidates() == null || ctx.candidates().isEmpty()) return null;

        TeamMemberRepository.AgentCandidateRow picked = null;
        for (var c : ctx.candidates()) {
            if (c == null) continue;
            if (picked == null) {
                picked = c;
                continue;
            }
            if (picked.lastAssignedAt() == null) {
                break;
            }
            if (c.lastAssignedAt() == null || c.lastAssignedAt().isBefore(picked.lastAssignedAt())) {
                picked = c;
            }
        }
        return picked;
    }

    @Override
    public boolean advancesCursor() {
        return true;
    }
}
