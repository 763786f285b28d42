package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository;

public interface AssignmentStrategy {

    /**
     * @return selected agent, or null if no eligible candidate
     */
    TeamMemberRepository.AgentCandidateRow select(AssignmentContext ctx);

    /**
     * Whether {@link AssignmentContext#activeLoads()} must be populated before {@link #select}.
     */
    default boolean needsActiveLoads() {
        return false;
    }

    /**
     * Whether the selected member's last_assigned_at cursor moves to now.
     */
    default boolean advancesCursor() {
        return false;
    }
}
