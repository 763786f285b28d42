package com.relaydesk.support.transfer.api;

public record TransferItem(
        String id,
        String contact_id,
        String contact_name,
        String phone_number,
        String channel_account,
        String status,
        String source,
        String agent_id,
        String agent_name,
        String team_id,
        String team_name,
        String transferred_by,
        String transferred_by_name,
        String notes,
        long transferred_at,
        Long resumed_at,
        String resumed_by,
        Long sla_response_deadline,
        Long sla_expires_at,
        boolean sla_breached,
        int escalation_level,
        Long picked_up_at,
        Long first_response_at
) {
}
