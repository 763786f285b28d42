package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository;
import org.springframework.stereotype.Component;

/**
 * Manual mode: never auto-assign.
 * Transfers stay queued until an agent picks them or a manager assigns them.
 */
@Component("manual")
public class ManualAssignmentStrategy implements AssignmentStrategy {

    @Override
    public TeamMemberRepository.AgentCandidateRow select(AssignmentContext ctx) {
        return null;
    }
}
