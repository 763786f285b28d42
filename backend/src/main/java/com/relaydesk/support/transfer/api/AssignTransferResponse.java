package com.relaydesk.support.transfer.api;

public record AssignTransferResponse(String agent_id) {
}
