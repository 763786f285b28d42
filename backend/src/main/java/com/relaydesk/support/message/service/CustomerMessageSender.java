package com.relaydesk.support.message.service;

/**
 * Hands a customer-facing text to the channel client. Implementations decide how delivery happens.
 */
public interface CustomerMessageSender {

    SendResult send(SendRequest request, SendOptions options);
}
