package com.relaydesk.support.webhook.service;

import com.fasterxml.jackson.databind.node.ObjectNode;

public interface TransferEventDispatcher {

    /**
     * Fire-and-forget delivery of {@code event} to the tenant's subscribed webhooks.
     */
    void dispatch(String tenantId, String event, ObjectNode data);
}
