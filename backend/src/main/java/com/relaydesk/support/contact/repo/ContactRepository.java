package com.relaydesk.support.contact.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ContactRepository {

    public record ContactRow(
            String id,
            String tenantId,
            String phoneNumber,
            String profileName,
            String channelAccount,
            String assignedUserId
    ) {
    }

    public record ChatbotTrackingRow(
            String id,
            String tenantId,
            String phoneNumber,
            String channelAccount,
            Instant chatbotLastMessageAt,
            boolean chatbotReminderSent
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ContactRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ContactRow> findInTenant(String tenantId, String contactId) {
        var sql = """
                select id, tenant_id, phone_number, profile_name, channel_account, assigned_user_id
                from contact
                where id = ? and tenant_id = ?
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new ContactRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("phone_number"),
                rs.getString("profile_name"),
                rs.getString("channel_account"),
                rs.getString("assigned_user_id")
        ), contactId, tenantId);
        return list.stream().findFirst();
    }

    public int updateAssignedUser(String contactId, String userId) {
        return jdbcTemplate.update("update contact set assigned_user_id = ? where id = ?", userId, contactId);
    }

    /**
     * Contacts the chatbot is waiting on, skipping any contact that currently has an active human transfer.
     */
    public List<ChatbotTrackingRow> listAwaitingChatbotReply(String tenantId) {
        var sql = """
                select c.id, c.tenant_id, c.phone_number, c.channel_account, c.chatbot_last_message_at, c.chatbot_reminder_sent
                from contact c
                where c.tenant_id = ?
                  and c.chatbot_last_message_at is not null
                  and not exists (
                    select 1 from agent_transfer t
                    where t.tenant_id = c.tenant_id
                      and t.contact_id = c.id
                      and t.status = 'active'
                  )
                order by c.chatbot_last_message_at asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new ChatbotTrackingRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("phone_number"),
                rs.getString("channel_account"),
                rs.getTimestamp("chatbot_last_message_at").toInstant(),
                rs.getBoolean("chatbot_reminder_sent")
        ), tenantId);
    }

    public int markChatbotMessage(String contactId, Instant at) {
        var sql = "update contact set chatbot_last_message_at = ?, chatbot_reminder_sent = false where id = ?";
        return jdbcTemplate.update(sql, Timestamp.from(at), contactId);
    }

    public int markReminderSent(String contactId) {
        var sql = "update contact set chatbot_reminder_sent = true where id = ? and chatbot_reminder_sent = false";
        return jdbcTemplate.update(sql, contactId);
    }

    public int clearChatbotTracking(String contactId) {
        var sql = "update contact set chatbot_last_message_at = null, chatbot_reminder_sent = false where id = ?";
        return jdbcTemplate.update(sql, contactId);
    }
}
