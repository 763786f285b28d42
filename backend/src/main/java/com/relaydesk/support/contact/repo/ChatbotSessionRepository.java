package com.relaydesk.support.contact.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
public class ChatbotSessionRepository {

    private final JdbcTemplate jdbcTemplate;

    public ChatbotSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public int cancelActive(String tenantId, String contactId, Instant at) {
        var sql = """
                update chatbot_session
                set status = 'cancelled', completed_at = ?
                where tenant_id = ? and contact_id = ? and status = 'active'
                """;
        return jdbcTemplate.update(sql, Timestamp.from(at), tenantId, contactId);
    }
}
