package com.relaydesk.support.webhook.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.List;

@Repository
public class WebhookRepository {

    public record WebhookRow(String id, String tenantId, String url, List<String> events) {

        public boolean subscribes(String event) {
            return events.contains(event) || events.contains("*");
        }
    }

    private final JdbcTemplate jdbcTemplate;

    public WebhookRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<WebhookRow> listActive(String tenantId) {
        var sql = """
                select id, tenant_id, url, events
                from webhook
                where tenant_id = ? and is_active = true
                order by created_at asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new WebhookRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("url"),
                parseEvents(rs.getString("events"))
        ), tenantId);
    }

    static List<String> parseEvents(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
