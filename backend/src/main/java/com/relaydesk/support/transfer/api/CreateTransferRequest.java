package com.relaydesk.support.transfer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTransferRequest(
        @NotBlank(message = "contact_id_required") String contact_id,
        String channel_account,
        String agent_id,
        String team_id,
        @Size(max = 2000, message = "notes_too_long") String notes,
        String source
) {
}
