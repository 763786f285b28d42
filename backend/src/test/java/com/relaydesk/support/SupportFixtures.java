package com.relaydesk.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Seeds rows for integration tests. Every call creates fresh ids, so tests never share a tenant.
 */
public class SupportFixtures {

    private final JdbcTemplate jdbc;

    public SupportFixtures(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public String tenant() {
        var id = "tn_" + UUID.randomUUID();
        jdbc.update("insert into tenant(id, name) values (?, ?)", id, "Tenant " + id);
        return id;
    }

    public String user(String tenantId, String role) {
        return user(tenantId, role, true);
    }

    public String user(String tenantId, String role, boolean available) {
        var id = "u_" + UUID.randomUUID();
        jdbc.update("""
                insert into user_account(id, tenant_id, full_name, role, is_active, is_available)
                values (?, ?, ?, ?, true, ?)
                """, id, tenantId, "User " + id.substring(2, 8), role, available);
        return id;
    }

    public String team(String tenantId, String strategy) {
        var id = "team_" + UUID.randomUUID();
        jdbc.update("insert into team(id, tenant_id, name, assignment_strategy) values (?, ?, ?, ?)",
                id, tenantId, "Team " + id.substring(5, 11), strategy);
        return id;
    }

    public void member(String teamId, String userId) {
        jdbc.update("insert into team_member(team_id, user_id, role) values (?, ?, 'agent')", teamId, userId);
    }

    public String contact(String tenantId) {
        var id = "c_" + UUID.randomUUID();
        jdbc.update("""
                insert into contact(id, tenant_id, phone_number, profile_name, channel_account)
                values (?, ?, ?, ?, 'main')
                """, id, tenantId, "+1555" + Math.abs(id.hashCode() % 1_000_000), "Customer " + id.substring(2, 8));
        return id;
    }

    public void chatbotSession(String tenantId, String contactId) {
        jdbc.update("insert into chatbot_session(id, tenant_id, contact_id, status) values (?, ?, ?, 'active')",
                "cs_" + UUID.randomUUID(), tenantId, contactId);
    }

    public void chatbotLastMessageAt(String contactId, Instant at) {
        jdbc.update("update contact set chatbot_last_message_at = ?, chatbot_reminder_sent = false where id = ?",
                Timestamp.from(at), contactId);
    }

    public String queuedTransfer(String tenantId, String contactId, String teamId, Instant transferredAt) {
        return transfer(tenantId, contactId, teamId, null, transferredAt, null, null, null);
    }

    /**
     * Inserts an active transfer directly, bypassing assignment and SLA computation.
     */
    public String transfer(
            String tenantId,
            String contactId,
            String teamId,
            String agentUserId,
            Instant transferredAt,
            Instant responseDeadline,
            Instant escalationAt,
            Instant expiresAt
    ) {
        var id = "t_" + UUID.randomUUID();
        jdbc.update("""
                insert into agent_transfer(
                    id, tenant_id, contact_id, active_contact_key, channel_account, status, source,
                    agent_user_id, team_id, notes, transferred_at,
                    sla_response_deadline, sla_escalation_at, sla_expires_at
                ) values (?, ?, ?, ?, 'main', 'active', 'manual', ?, ?, '', ?, ?, ?, ?)
                """,
                id, tenantId, contactId, contactId, agentUserId, teamId, Timestamp.from(transferredAt),
                ts(responseDeadline), ts(escalationAt), ts(expiresAt));
        return id;
    }

    public int count(String sql, Object... args) {
        Integer n = jdbc.queryForObject(sql, Integer.class, args);
        return n == null ? 0 : n;
    }

    public String string(String sql, Object... args) {
        var list = jdbc.queryForList(sql, String.class, args);
        return list.isEmpty() ? null : list.get(0);
    }

    public Instant instant(String sql, Object... args) {
        var list = jdbc.queryForList(sql, Timestamp.class, args);
        return list.isEmpty() || list.get(0) == null ? null : list.get(0).toInstant();
    }

    private static Timestamp ts(Instant i) {
        return i == null ? null : Timestamp.from(i);
    }
}
