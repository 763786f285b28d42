package com.relaydesk.support.common.ws;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Real-time fan-out to every connected agent/admin UI of one organization.
 */
public interface OrgNotifier {

    void notifyOrg(String tenantId, String eventType, ObjectNode payload);
}
