package com.relaydesk.support.transfer.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class TransferRepository {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_RESUMED = "resumed";
    public static final String STATUS_EXPIRED = "expired";

    public static final int MAX_ESCALATION_LEVEL = 2;

    public static final String GENERAL_QUEUE = "general";

    public static final String AUTO_CLOSE_NOTE = "[Auto-closed: No agent response within SLA]";

    public record TransferRow(
            String id,
            String tenantId,
            String contactId,
            String channelAccount,
            String status,
            String source,
            String agentUserId,
            String teamId,
            String transferredByUserId,
            String notes,
            Instant transferredAt,
            Instant resumedAt,
            String resumedByUserId,
            Instant slaResponseDeadline,
            Instant slaResolutionDeadline,
            Instant slaEscalationAt,
            Instant slaExpiresAt,
            boolean slaBreached,
            Instant slaBreachedAt,
            int escalationLevel,
            Instant escalatedAt,
            Instant pickedUpAt,
            Instant firstResponseAt
    ) {

        public boolean isActive() {
            return STATUS_ACTIVE.equals(status);
        }
    }

    /**
     * Which part of the queue a pick or listing may see.
     *
     * @param allTeams  no team restriction (admins)
     * @param general   include unteamed rows
     * @param teamIds   teams whose rows are visible
     */
    public record QueueScope(boolean allTeams, boolean general, List<String> teamIds) {

        public QueueScope {
            teamIds = teamIds == null ? List.of() : List.copyOf(teamIds);
        }

        public static QueueScope everything() {
            return new QueueScope(true, true, List.of());
        }

        public static QueueScope generalOnly() {
            return new QueueScope(false, true, List.of());
        }

        public static QueueScope team(String teamId) {
            return new QueueScope(false, false, List.of(teamId));
        }

        public static QueueScope teamsAndGeneral(List<String> teamIds) {
            return new QueueScope(false, true, teamIds);
        }
    }

    /**
     * Who is looking at the queue. {@code teamIds} are the viewer's team memberships.
     */
    public record Viewer(String role, String userId, List<String> teamIds) {

        public Viewer {
            teamIds = teamIds == null ? List.of() : List.copyOf(teamIds);
        }

        public boolean isAdmin() {
            return "admin".equals(role);
        }
    }

    private static final String COLUMNS = """
            id, tenant_id, contact_id, channel_account, status, source, agent_user_id, team_id,
            transferred_by_user_id, notes, transferred_at, resumed_at, resumed_by_user_id,
            sla_response_deadline, sla_resolution_deadline, sla_escalation_at, sla_expires_at,
            sla_breached, sla_breached_at, escalation_level, escalated_at, picked_up_at, first_response_at
            """;

    private final JdbcTemplate jdbcTemplate;

    public TransferRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String insert(TransferDraft d) {
        var id = "t_" + UUID.randomUUID();
        var sql = """
                insert into agent_transfer(
                    id, tenant_id, contact_id, active_contact_key, channel_account, status, source,
                    agent_user_id, team_id, transferred_by_user_id, notes, transferred_at,
                    sla_response_deadline, sla_resolution_deadline, sla_escalation_at, sla_expires_at,
                    sla_breached, escalation_level
                ) values (?, ?, ?, ?, ?, 'active', ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, false, 0)
                """;
        jdbcTemplate.update(sql,
                id,
                d.tenantId(),
                d.contactId(),
                d.contactId(),
                d.channelAccount(),
                d.source(),
                d.agentUserId(),
                d.teamId(),
                d.transferredByUserId(),
                d.notes() == null ? "" : d.notes(),
                ts(d.transferredAt()),
                ts(d.slaResponseDeadline()),
                ts(d.slaResolutionDeadline()),
                ts(d.slaEscalationAt()),
                ts(d.slaExpiresAt())
        );
        return id;
    }

    public Optional<TransferRow> findInTenant(String tenantId, String transferId) {
        var sql = "select " + COLUMNS + " from agent_transfer where id = ? and tenant_id = ? limit 1";
        var list = jdbcTemplate.query(sql, rowMapper(), transferId, tenantId);
        return list.stream().findFirst();
    }

    public boolean existsActiveForContact(String tenantId, String contactId) {
        var sql = "select count(1) from agent_transfer where tenant_id = ? and contact_id = ? and status = 'active'";
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, tenantId, contactId);
        return n != null && n > 0;
    }

    /**
     * Sets (or clears, when {@code agentUserId} is null) the agent of an active transfer.
     */
    public int assignAgent(String tenantId, String transferId, String agentUserId) {
        var sql = """
                update agent_transfer
                set agent_user_id = ?
                where id = ? and tenant_id = ? and status = 'active'
                """;
        return jdbcTemplate.update(sql, agentUserId, transferId, tenantId);
    }

    /**
     * Locks the oldest unassigned active row in scope, skipping rows other transactions hold.
     * Must run inside a transaction; the lock is held until it ends.
     */
    public Optional<String> lockNextQueued(String tenantId, QueueScope scope, List<String> excludeIds) {
        var args = new ArrayList<Object>();
        var sql = new StringBuilder("""
                select id
                from agent_transfer
                where tenant_id = ?
                  and status = 'active'
                  and agent_user_id is null
                """);
        args.add(tenantId);
        appendScope(sql, args, scope);
        if (excludeIds != null && !excludeIds.isEmpty()) {
            sql.append(" and id not in (").append(placeholders(excludeIds.size())).append(")\n");
            args.addAll(excludeIds);
        }
        sql.append("""
                order by transferred_at asc, id asc
                limit 1
                for update skip locked
                """);
        var list = jdbcTemplate.query(sql.toString(), (rs, rowNum) -> rs.getString("id"), args.toArray());
        return list.stream().findFirst();
    }

    /**
     * Compare-and-swap claim: succeeds only while the row is still active and unassigned.
     */
    public int tryClaim(String tenantId, String transferId, String agentUserId) {
        var sql = """
                update agent_transfer
                set agent_user_id = ?,
                    transferred_by_user_id = coalesce(transferred_by_user_id, ?)
                where id = ? and tenant_id = ? and status = 'active' and agent_user_id is null
                """;
        return jdbcTemplate.update(sql, agentUserId, agentUserId, transferId, tenantId);
    }

    /**
     * Records pickup; flags the breach when picked up after the response deadline.
     * An existing breach timestamp is kept.
     */
    public int markPickedUp(String transferId, Instant now) {
        var sql = """
                update agent_transfer
                set picked_up_at = ?,
                    sla_breached_at = case
                        when sla_breached = false and sla_response_deadline is not null and sla_response_deadline < ? then ?
                        else sla_breached_at end,
                    sla_breached = case
                        when sla_response_deadline is not null and sla_response_deadline < ? then true
                        else sla_breached end
                where id = ?
                """;
        var t = ts(now);
        return jdbcTemplate.update(sql, t, t, t, t, transferId);
    }

    public int markFirstResponse(String tenantId, String transferId, Instant now) {
        var sql = """
                update agent_transfer
                set first_response_at = ?
                where id = ? and tenant_id = ? and first_response_at is null
                """;
        return jdbcTemplate.update(sql, ts(now), transferId, tenantId);
    }

    public int resume(String tenantId, String transferId, String byUserId, Instant now) {
        var sql = """
                update agent_transfer
                set status = 'resumed', active_contact_key = null, resumed_at = ?, resumed_by_user_id = ?
                where id = ? and tenant_id = ? and status = 'active'
                """;
        return jdbcTemplate.update(sql, ts(now), byUserId, transferId, tenantId);
    }

    public List<TransferRow> listExpired(String tenantId, Instant now) {
        var sql = "select " + COLUMNS + """
                from agent_transfer
                where tenant_id = ? and status = 'active'
                  and sla_expires_at is not null and sla_expires_at < ?
                order by sla_expires_at asc
                """;
        return jdbcTemplate.query(sql, rowMapper(), tenantId, ts(now));
    }

    /**
     * Moves an active, past-expiry transfer to expired and appends the auto-close audit note.
     */
    public int expire(String tenantId, String transferId, Instant now) {
        var sql = """
                update agent_transfer
                set status = 'expired',
                    active_contact_key = null,
                    resumed_at = ?,
                    notes = case when notes is null or notes = '' then ? else notes || ? end
                where id = ? and tenant_id = ? and status = 'active'
                  and sla_expires_at is not null and sla_expires_at < ?
                """;
        var t = ts(now);
        return jdbcTemplate.update(sql, t, AUTO_CLOSE_NOTE, "\n" + AUTO_CLOSE_NOTE, transferId, tenantId, t);
    }

    public List<TransferRow> listDueForEscalation(String tenantId, Instant now) {
        var sql = "select " + COLUMNS + """
                from agent_transfer
                where tenant_id = ? and status = 'active'
                  and sla_escalation_at is not null and sla_escalation_at < ?
                  and escalation_level < ?
                order by sla_escalation_at asc
                """;
        return jdbcTemplate.query(sql, rowMapper(), tenantId, ts(now), MAX_ESCALATION_LEVEL);
    }

    /**
     * Raises the escalation level by one if it still equals {@code expectedLevel}; the same statement
     * flags the response breach when the deadline has passed and the row is not breached yet.
     */
    public int escalate(String tenantId, String transferId, int expectedLevel, Instant now) {
        var sql = """
                update agent_transfer
                set escalation_level = escalation_level + 1,
                    escalated_at = ?,
                    sla_breached_at = case
                        when sla_breached = false and sla_response_deadline is not null and sla_response_deadline < ? then ?
                        else sla_breached_at end,
                    sla_breached = case
                        when sla_response_deadline is not null and sla_response_deadline < ? then true
                        else sla_breached end
                where id = ? and tenant_id = ? and status = 'active'
                  and escalation_level = ? and escalation_level < ?
                """;
        var t = ts(now);
        return jdbcTemplate.update(sql, t, t, t, t, transferId, tenantId, expectedLevel, MAX_ESCALATION_LEVEL);
    }

    public int markBreachedUnassigned(String tenantId, Instant now) {
        var sql = """
                update agent_transfer
                set sla_breached = true, sla_breached_at = ?
                where tenant_id = ? and status = 'active' and sla_breached = false
                  and agent_user_id is null
                  and sla_response_deadline is not null and sla_response_deadline < ?
                """;
        var t = ts(now);
        return jdbcTemplate.update(sql, t, tenantId, t);
    }

    public Map<String, Integer> countActiveByAgents(String tenantId, List<String> agentUserIds) {
        var out = new HashMap<String, Integer>();
        if (agentUserIds == null || agentUserIds.isEmpty()) return out;
        var sql = "select agent_user_id, count(1) as n from agent_transfer where tenant_id = ? and status = 'active' and agent_user_id in ("
                + placeholders(agentUserIds.size()) + ") group by agent_user_id";
        var args = new ArrayList<Object>();
        args.add(tenantId);
        args.addAll(agentUserIds);
        jdbcTemplate.query(sql, rs -> {
            out.put(rs.getString("agent_user_id"), rs.getInt("n"));
        }, args.toArray());
        return out;
    }

    /**
     * Listing for the agent workspace, FIFO. Visibility follows the viewer's role:
     * agents see their own rows plus unassigned rows in their teams and the general queue,
     * managers see their teams' rows plus the unassigned general queue, admins see everything.
     *
     * @param teamFilter null for no filter, {@code general} for unteamed rows, otherwise a team id
     */
    public List<TransferRow> list(String tenantId, String status, String teamFilter, Viewer viewer, int limit) {
        var args = new ArrayList<Object>();
        var sql = new StringBuilder("select " + COLUMNS + " from agent_transfer where tenant_id = ?\n");
        args.add(tenantId);
        if (status != null && !status.isBlank()) {
            sql.append(" and status = ?\n");
            args.add(status);
        }
        if (GENERAL_QUEUE.equals(teamFilter)) {
            sql.append(" and team_id is null\n");
        } else if (teamFilter != null && !teamFilter.isBlank()) {
            sql.append(" and team_id = ?\n");
            args.add(teamFilter);
        }

        if (viewer != null && !viewer.isAdmin()) {
            var teams = viewer.teamIds();
            var teamsIn = teams.isEmpty() ? "1 = 0" : "team_id in (" + placeholders(teams.size()) + ")";
            if ("manager".equals(viewer.role())) {
                sql.append(" and (").append(teamsIn).append(" or (team_id is null and agent_user_id is null))\n");
                args.addAll(teams);
            } else {
                sql.append(" and (agent_user_id = ? or (agent_user_id is null and (team_id is null or ")
                        .append(teamsIn).append(")))\n");
                args.add(viewer.userId());
                args.addAll(teams);
            }
        }

        sql.append(" order by transferred_at asc, id asc limit ?");
        args.add(Math.max(1, Math.min(limit, 1000)));
        return jdbcTemplate.query(sql.toString(), rowMapper(), args.toArray());
    }

    /**
     * Unassigned active counts keyed by team id; the unteamed queue is keyed by null.
     */
    public Map<String, Integer> countQueuedByTeam(String tenantId) {
        var sql = """
                select team_id, count(1) as n
                from agent_transfer
                where tenant_id = ? and status = 'active' and agent_user_id is null
                group by team_id
                """;
        var out = new LinkedHashMap<String, Integer>();
        jdbcTemplate.query(sql, rs -> {
            out.put(rs.getString("team_id"), rs.getInt("n"));
        }, tenantId);
        return out;
    }

    private static void appendScope(StringBuilder sql, List<Object> args, QueueScope scope) {
        if (scope == null || scope.allTeams()) return;
        var teams = scope.teamIds();
        if (scope.general() && teams.isEmpty()) {
            sql.append(" and team_id is null\n");
        } else if (scope.general()) {
            sql.append(" and (team_id is null or team_id in (").append(placeholders(teams.size())).append("))\n");
            args.addAll(teams);
        } else if (!teams.isEmpty()) {
            sql.append(" and team_id in (").append(placeholders(teams.size())).append(")\n");
            args.addAll(teams);
        } else {
            sql.append(" and 1 = 0\n");
        }
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static Timestamp ts(Instant i) {
        return i == null ? null : Timestamp.from(i);
    }

    private static Instant instant(ResultSet rs, String col) throws SQLException {
        var t = rs.getTimestamp(col);
        return t == null ? null : t.toInstant();
    }

    private static RowMapper<TransferRow> rowMapper() {
        return (rs, rowNum) -> new TransferRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("contact_id"),
                rs.getString("channel_account"),
                rs.getString("status"),
                rs.getString("source"),
                rs.getString("agent_user_id"),
                rs.getString("team_id"),
                rs.getString("transferred_by_user_id"),
                rs.getString("notes"),
                instant(rs, "transferred_at"),
                instant(rs, "resumed_at"),
                rs.getString("resumed_by_user_id"),
                instant(rs, "sla_response_deadline"),
                instant(rs, "sla_resolution_deadline"),
                instant(rs, "sla_escalation_at"),
                instant(rs, "sla_expires_at"),
                rs.getBoolean("sla_breached"),
                instant(rs, "sla_breached_at"),
                rs.getInt("escalation_level"),
                instant(rs, "escalated_at"),
                instant(rs, "picked_up_at"),
                instant(rs, "first_response_at")
        );
    }
}
