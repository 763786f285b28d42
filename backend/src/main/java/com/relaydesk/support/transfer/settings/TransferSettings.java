package com.relaydesk.support.transfer.settings;

public record TransferSettings(
        String tenantId,
        boolean assignToSameAgent,
        boolean allowAgentQueuePickup,
        SlaSettings sla,
        ClientInactivitySettings clientInactivity
) {

    public TransferSettings {
        sla = sla == null ? SlaSettings.disabled() : sla;
        clientInactivity = clientInactivity == null ? ClientInactivitySettings.disabled() : clientInactivity;
    }

    /**
     * Values used for a tenant that never saved its transfer settings.
     */
    public static TransferSettings defaults(String tenantId) {
        return new TransferSettings(tenantId, false, true, SlaSettings.disabled(), ClientInactivitySettings.disabled());
    }
}
