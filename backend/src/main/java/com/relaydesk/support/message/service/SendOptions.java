package com.relaydesk.support.message.service;

/**
 * Sends always run on the caller's thread; the options only control the notifications around them.
 *
 * @param broadcast notify the org's agent UIs about the queued message
 * @param webhook   dispatch the message.queued webhook
 */
public record SendOptions(boolean broadcast, boolean webhook) {

    /**
     * Options for messages triggered by the SLA scheduler.
     */
    public static SendOptions sla() {
        return new SendOptions(true, false);
    }
}
