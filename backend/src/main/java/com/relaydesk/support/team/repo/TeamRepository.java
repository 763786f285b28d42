package com.relaydesk.support.team.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class TeamRepository {

    public record TeamRow(
            String id,
            String tenantId,
            String name,
            String assignmentStrategy,
            boolean active
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public TeamRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<TeamRow> findActive(String tenantId, String teamId) {
        if (teamId == null || teamId.isBlank()) return Optional.empty();
        var sql = """
                select id, tenant_id, name, assignment_strategy, is_active
                from team
                where id = ? and tenant_id = ? and is_active = true
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new TeamRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("assignment_strategy"),
                rs.getBoolean("is_active")
        ), teamId, tenantId);
        return list.stream().findFirst();
    }

    public Optional<String> findName(String teamId) {
        if (teamId == null || teamId.isBlank()) return Optional.empty();
        var list = jdbcTemplate.query("select name from team where id = ? limit 1",
                (rs, rowNum) -> rs.getString("name"), teamId);
        return list.stream().filter(java.util.Objects::nonNull).findFirst();
    }
}
