package com.relaydesk.support.transfer.settings;

public record ClientInactivitySettings(
        boolean reminderEnabled,
        int reminderMinutes,
        String reminderMessage,
        int autoCloseMinutes,
        String autoCloseMessage
) {

    public static ClientInactivitySettings disabled() {
        return new ClientInactivitySettings(false, 0, null, 0, null);
    }
}
