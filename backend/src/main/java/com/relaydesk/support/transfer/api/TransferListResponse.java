package com.relaydesk.support.transfer.api;

import java.util.List;
import java.util.Map;

public record TransferListResponse(
        List<TransferItem> transfers,
        int general_queue_count,
        Map<String, Integer> team_queue_counts
) {
}
