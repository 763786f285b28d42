package com.relaydesk.support.transfer.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class TransferSettingsRepository {

    private static final Logger log = LoggerFactory.getLogger(TransferSettingsRepository.class);

    private static final String COLUMNS = """
            tenant_id, assign_to_same_agent, allow_agent_queue_pickup,
            sla_enabled, sla_response_minutes, sla_resolution_minutes, sla_escalation_minutes, sla_auto_close_hours,
            sla_auto_close_message, sla_warning_message, sla_escalation_notify_ids,
            client_reminder_enabled, client_reminder_minutes, client_reminder_message,
            client_auto_close_minutes, client_auto_close_message
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TransferSettingsRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<TransferSettings> findByTenantId(String tenantId) {
        var sql = "select " + COLUMNS + " from transfer_settings where tenant_id = ? limit 1";
        var list = jdbcTemplate.query(sql, rowMapper(), tenantId);
        return list.stream().findFirst();
    }

    public TransferSettings getOrDefault(String tenantId) {
        return findByTenantId(tenantId).orElseGet(() -> TransferSettings.defaults(tenantId));
    }

    public List<TransferSettings> listSlaEnabled() {
        var sql = "select " + COLUMNS + " from transfer_settings where sla_enabled = true order by tenant_id asc";
        return jdbcTemplate.query(sql, rowMapper());
    }

    public void upsert(TransferSettings s) {
        var sla = s.sla();
        var ci = s.clientInactivity();
        var notifyJson = writeNotifyIds(sla.escalationNotifyIds());

        var updateSql = """
                update transfer_settings
                set assign_to_same_agent = ?, allow_agent_queue_pickup = ?,
                    sla_enabled = ?, sla_response_minutes = ?, sla_resolution_minutes = ?,
                    sla_escalation_minutes = ?, sla_auto_close_hours = ?,
                    sla_auto_close_message = ?, sla_warning_message = ?, sla_escalation_notify_ids = ?,
                    client_reminder_enabled = ?, client_reminder_minutes = ?, client_reminder_message = ?,
                    client_auto_close_minutes = ?, client_auto_close_message = ?,
                    updated_at = current_timestamp
                where tenant_id = ?
                """;
        var updated = jdbcTemplate.update(updateSql,
                s.assignToSameAgent(), s.allowAgentQueuePickup(),
                sla.enabled(), sla.responseMinutes(), sla.resolutionMinutes(),
                sla.escalationMinutes(), sla.autoCloseHours(),
                sla.autoCloseMessage(), sla.warningMessage(), notifyJson,
                ci.reminderEnabled(), ci.reminderMinutes(), ci.reminderMessage(),
                ci.autoCloseMinutes(), ci.autoCloseMessage(),
                s.tenantId());
        if (updated > 0) return;

        var insertSql = "insert into transfer_settings(" + COLUMNS
                + ", updated_at) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, current_timestamp)";
        jdbcTemplate.update(insertSql,
                s.tenantId(), s.assignToSameAgent(), s.allowAgentQueuePickup(),
                sla.enabled(), sla.responseMinutes(), sla.resolutionMinutes(), sla.escalationMinutes(), sla.autoCloseHours(),
                sla.autoCloseMessage(), sla.warningMessage(), notifyJson,
                ci.reminderEnabled(), ci.reminderMinutes(), ci.reminderMessage(),
                ci.autoCloseMinutes(), ci.autoCloseMessage());
    }

    private RowMapper<TransferSettings> rowMapper() {
        return (rs, rowNum) -> map(rs);
    }

    private TransferSettings map(ResultSet rs) throws SQLException {
        var tenantId = rs.getString("tenant_id");
        var sla = new SlaSettings(
                rs.getBoolean("sla_enabled"),
                rs.getInt("sla_response_minutes"),
                rs.getInt("sla_resolution_minutes"),
                rs.getInt("sla_escalation_minutes"),
                rs.getInt("sla_auto_close_hours"),
                rs.getString("sla_auto_close_message"),
                rs.getString("sla_warning_message"),
                readNotifyIds(tenantId, rs.getString("sla_escalation_notify_ids"))
        );
        var ci = new ClientInactivitySettings(
                rs.getBoolean("client_reminder_enabled"),
                rs.getInt("client_reminder_minutes"),
                rs.getString("client_reminder_message"),
                rs.getInt("client_auto_close_minutes"),
                rs.getString("client_auto_close_message")
        );
        return new TransferSettings(
                tenantId,
                rs.getBoolean("assign_to_same_agent"),
                rs.getBoolean("allow_agent_queue_pickup"),
                sla,
                ci
        );
    }

    private List<String> readNotifyIds(String tenantId, String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            List<String> ids = objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
            return ids == null ? List.of() : ids.stream().filter(id -> id != null && !id.isBlank()).toList();
        } catch (JsonProcessingException e) {
            log.warn("invalid_escalation_notify_ids tenant={} cause={}", tenantId, e.getOriginalMessage());
            return List.of();
        }
    }

    private String writeNotifyIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid_escalation_notify_ids");
        }
    }
}
