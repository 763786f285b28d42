package com.relaydesk.support.message.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class OutboundMessageRepository {

    public record OutboundMessageRow(
            String id,
            String tenantId,
            String contactId,
            String channelAccount,
            String content,
            String purpose,
            String status,
            Instant createdAt
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public OutboundMessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String insertPending(String tenantId, String contactId, String channelAccount, String content, String purpose, Instant at) {
        var id = "om_" + UUID.randomUUID();
        var sql = """
                insert into outbound_message(id, tenant_id, contact_id, channel_account, content, purpose, status, created_at)
                values (?, ?, ?, ?, ?, ?, 'pending', ?)
                """;
        jdbcTemplate.update(sql, id, tenantId, contactId, channelAccount, content, purpose, Timestamp.from(at));
        return id;
    }

    public List<OutboundMessageRow> listByContact(String tenantId, String contactId) {
        var sql = """
                select id, tenant_id, contact_id, channel_account, content, purpose, status, created_at
                from outbound_message
                where tenant_id = ? and contact_id = ?
                order by created_at asc, id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new OutboundMessageRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("contact_id"),
                rs.getString("channel_account"),
                rs.getString("content"),
                rs.getString("purpose"),
                rs.getString("status"),
                rs.getTimestamp("created_at").toInstant()
        ), tenantId, contactId);
    }
}
