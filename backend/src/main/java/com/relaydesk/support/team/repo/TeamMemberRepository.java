package com.relaydesk.support.team.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class TeamMemberRepository {

    public record AgentCandidateRow(String userId, Instant lastAssignedAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public TeamMemberRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Members with role agent whose user is active and available, least recently assigned first.
     */
    public List<AgentCandidateRow> listAvailableAgentsByLastAssigned(String teamId) {
        var sql = """
                select m.user_id, m.last_assigned_at
                from team_member m
                join user_account u on u.id = m.user_id
                where m.team_id = ?
                  and m.role = 'agent'
                  and u.is_available = true
                  and u.is_active = true
                order by m.last_assigned_at asc nulls first
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> toCandidate(rs.getString("user_id"), rs.getTimestamp("last_assigned_at")), teamId);
    }

    public List<AgentCandidateRow> listAvailableAgents(String teamId) {
        var sql = """
                select m.user_id, m.last_assigned_at
                from team_member m
                join user_account u on u.id = m.user_id
                where m.team_id = ?
                  and m.role = 'agent'
                  and u.is_available = true
                  and u.is_active = true
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> toCandidate(rs.getString("user_id"), rs.getTimestamp("last_assigned_at")), teamId);
    }

    public int touchLastAssigned(String teamId, String userId, Instant at) {
        var sql = "update team_member set last_assigned_at = ? where team_id = ? and user_id = ?";
        return jdbcTemplate.update(sql, Timestamp.from(at), teamId, userId);
    }

    public List<String> listTeamIdsForUser(String tenantId, String userId) {
        var sql = """
                select m.team_id
                from team_member m
                join team t on t.id = m.team_id
                where m.user_id = ? and t.tenant_id = ?
                order by m.team_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("team_id"), userId, tenantId);
    }

    private static AgentCandidateRow toCandidate(String userId, Timestamp lastAssignedAt) {
        return new AgentCandidateRow(userId, lastAssignedAt == null ? null : lastAssignedAt.toInstant());
    }
}
