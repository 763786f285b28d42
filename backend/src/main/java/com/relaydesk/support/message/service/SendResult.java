package com.relaydesk.support.message.service;

public record SendResult(String messageId, String status) {
}
