package com.relaydesk.support.message.service;

public record SendRequest(
        String tenantId,
        String contactId,
        String channelAccount,
        String phoneNumber,
        String content,
        String purpose
) {
}
