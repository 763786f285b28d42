package com.relaydesk.support.transfer.settings;

import java.util.List;

/**
 * Per-tenant SLA policy. A zero or negative minute/hour value disables that deadline.
 */
public record SlaSettings(
        boolean enabled,
        int responseMinutes,
        int resolutionMinutes,
        int escalationMinutes,
        int autoCloseHours,
        String autoCloseMessage,
        String warningMessage,
        List<String> escalationNotifyIds
) {

    public SlaSettings {
        escalationNotifyIds = escalationNotifyIds == null ? List.of() : List.copyOf(escalationNotifyIds);
    }

    public static SlaSettings disabled() {
        return new SlaSettings(false, 0, 0, 0, 0, null, null, List.of());
    }
}
