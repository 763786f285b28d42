package com.relaydesk.support.transfer.api;

/**
 * A null {@code agent_id} means "assign to me" for agents and "unassign" for managers and admins.
 */
public record AssignTransferRequest(String agent_id) {
}
