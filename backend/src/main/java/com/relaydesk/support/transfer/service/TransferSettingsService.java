package com.relaydesk.support.transfer.service;

import com.relaydesk.support.auth.service.jwt.JwtClaims;
import com.relaydesk.support.sla.service.SlaSettingsCache;
import com.relaydesk.support.transfer.api.TransferSettingsDto;
import com.relaydesk.support.transfer.settings.ClientInactivitySettings;
import com.relaydesk.support.transfer.settings.SlaSettings;
import com.relaydesk.support.transfer.settings.TransferSettings;
import com.relaydesk.support.transfer.settings.TransferSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class TransferSettingsService {

    private static final Logger log = LoggerFactory.getLogger(TransferSettingsService.class);

    private static final int MAX_MINUTES = 365 * 24 * 60;
    private static final int MAX_HOURS = 365 * 24;
    private static final int MAX_NOTIFY_IDS = 50;

    private final TransferSettingsRepository settingsRepository;
    private final SlaSettingsCache slaSettingsCache;

    public TransferSettingsService(TransferSettingsRepository settingsRepository, SlaSettingsCache slaSettingsCache) {
        this.settingsRepository = settingsRepository;
        this.slaSettingsCache = slaSettingsCache;
    }

    public TransferSettingsDto get(JwtClaims claims) {
        requireAdmin(claims);
        return toDto(settingsRepository.getOrDefault(claims.tenantId()));
    }

    /**
     * Partial update: null fields keep their stored value.
     */
    @Transactional
    public TransferSettingsDto update(JwtClaims claims, TransferSettingsDto req) {
        requireAdmin(claims);
        if (req == null) throw new IllegalArgumentException("invalid_request");

        var current = settingsRepository.getOrDefault(claims.tenantId());
        var sla = mergeSla(current.sla(), req.sla());
        var ci = mergeClientInactivity(current.clientInactivity(), req.client_inactivity());
        var next = new TransferSettings(
                claims.tenantId(),
                req.assign_to_same_agent() != null ? req.assign_to_same_agent() : current.assignToSameAgent(),
                req.allow_agent_queue_pickup() != null ? req.allow_agent_queue_pickup() : current.allowAgentQueuePickup(),
                sla,
                ci
        );

        settingsRepository.upsert(next);
        slaSettingsCache.invalidate();
        log.info("transfer_settings_updated tenant={} by={} slaEnabled={}", claims.tenantId(), claims.userId(), sla.enabled());
        return toDto(next);
    }

    private static SlaSettings mergeSla(SlaSettings cur, TransferSettingsDto.Sla req) {
        if (req == null) return cur;
        List<String> notifyIds = cur.escalationNotifyIds();
        if (req.escalation_notify_ids() != null) {
            notifyIds = req.escalation_notify_ids().stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(String::trim)
                    .distinct()
                    .toList();
            if (notifyIds.size() > MAX_NOTIFY_IDS) {
                throw new IllegalArgumentException("invalid_escalation_notify_ids");
            }
        }
        return new SlaSettings(
                req.enabled() != null ? req.enabled() : cur.enabled(),
                req.response_minutes() != null ? clamp(req.response_minutes(), MAX_MINUTES, "invalid_response_minutes") : cur.responseMinutes(),
                req.resolution_minutes() != null ? clamp(req.resolution_minutes(), MAX_MINUTES, "invalid_resolution_minutes") : cur.resolutionMinutes(),
                req.escalation_minutes() != null ? clamp(req.escalation_minutes(), MAX_MINUTES, "invalid_escalation_minutes") : cur.escalationMinutes(),
                req.auto_close_hours() != null ? clamp(req.auto_close_hours(), MAX_HOURS, "invalid_auto_close_hours") : cur.autoCloseHours(),
                req.auto_close_message() != null ? blankToNull(req.auto_close_message()) : cur.autoCloseMessage(),
                req.warning_message() != null ? blankToNull(req.warning_message()) : cur.warningMessage(),
                notifyIds
        );
    }

    private static ClientInactivitySettings mergeClientInactivity(ClientInactivitySettings cur, TransferSettingsDto.ClientInactivity req) {
        if (req == null) return cur;
        return new ClientInactivitySettings(
                req.reminder_enabled() != null ? req.reminder_enabled() : cur.reminderEnabled(),
                req.reminder_minutes() != null ? clamp(req.reminder_minutes(), MAX_MINUTES, "invalid_reminder_minutes") : cur.reminderMinutes(),
                req.reminder_message() != null ? blankToNull(req.reminder_message()) : cur.reminderMessage(),
                req.auto_close_minutes() != null ? clamp(req.auto_close_minutes(), MAX_MINUTES, "invalid_auto_close_minutes") : cur.autoCloseMinutes(),
                req.auto_close_message() != null ? blankToNull(req.auto_close_message()) : cur.autoCloseMessage()
        );
    }

    /**
     * Negative values are stored as 0 (disabled).
     */
    private static int clamp(int value, int max, String errorCode) {
        if (value > max) throw new IllegalArgumentException(errorCode);
        return Math.max(0, value);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static void requireAdmin(JwtClaims claims) {
        if (claims == null || !claims.isAdmin()) {
            throw new IllegalArgumentException("forbidden");
        }
    }

    static TransferSettingsDto toDto(TransferSettings s) {
        var sla = s.sla();
        var ci = s.clientInactivity();
        return new TransferSettingsDto(
                s.assignToSameAgent(),
                s.allowAgentQueuePickup(),
                new TransferSettingsDto.Sla(
                        sla.enabled(),
                        sla.responseMinutes(),
                        sla.resolutionMinutes(),
                        sla.escalationMinutes(),
                        sla.autoCloseHours(),
                        sla.autoCloseMessage(),
                        sla.warningMessage(),
                        sla.escalationNotifyIds()
                ),
                new TransferSettingsDto.ClientInactivity(
                        ci.reminderEnabled(),
                        ci.reminderMinutes(),
                        ci.reminderMessage(),
                        ci.autoCloseMinutes(),
                        ci.autoCloseMessage()
                )
        );
    }
}
