package com.relaydesk.support.transfer.api;

/**
 * {@code transfer} is null when the queue had nothing to pick.
 */
public record PickTransferResponse(TransferItem transfer, String message) {
}
