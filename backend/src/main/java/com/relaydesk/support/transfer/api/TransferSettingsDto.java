package com.relaydesk.support.transfer.api;

import java.util.List;

public record TransferSettingsDto(
        Boolean assign_to_same_agent,
        Boolean allow_agent_queue_pickup,
        Sla sla,
        ClientInactivity client_inactivity
) {

    public record Sla(
            Boolean enabled,
            Integer response_minutes,
            Integer resolution_minutes,
            Integer escalation_minutes,
            Integer auto_close_hours,
            String auto_close_message,
            String warning_message,
            List<String> escalation_notify_ids
    ) {
    }

    public record ClientInactivity(
            Boolean reminder_enabled,
            Integer reminder_minutes,
            String reminder_message,
            Integer auto_close_minutes,
            String auto_close_message
    ) {
    }
}
