package com.relaydesk.support.user.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Objects;
import java.util.Optional;

@Repository
public class UserAccountRepository {

    public record AgentRow(String id, String tenantId, String fullName, String role, boolean active, boolean available) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<AgentRow> findInTenant(String tenantId, String userId) {
        if (userId == null || userId.isBlank()) return Optional.empty();
        var sql = """
                select id, tenant_id, full_name, role, is_active, is_available
                from user_account
                where id = ? and tenant_id = ?
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new AgentRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("full_name"),
                rs.getString("role"),
                rs.getBoolean("is_active"),
                rs.getBoolean("is_available")
        ), userId, tenantId);
        return list.stream().findFirst();
    }

    public Optional<String> findFullName(String userId) {
        if (userId == null || userId.isBlank()) return Optional.empty();
        var sql = "select full_name from user_account where id = ? limit 1";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("full_name"), userId);
        // RowMapper may yield null for a NULL column; Stream#findFirst would throw on it.
        return list.stream().filter(Objects::nonNull).findFirst();
    }
}
