package com.relaydesk.support.sla.service;

import com.relaydesk.support.transfer.settings.TransferSettings;
import com.relaydesk.support.transfer.settings.TransferSettingsRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Short-lived cache of the tenants with SLA enabled, so each scheduler tick costs at most one settings query.
 */
@Component
public class SlaSettingsCache {

    private record CacheEntry(List<TransferSettings> settings, long expiresAtMs) {
    }

    private final TransferSettingsRepository settingsRepository;
    private final Clock clock;
    private final long ttlMs;

    private final AtomicReference<CacheEntry> cache = new AtomicReference<>();

    public SlaSettingsCache(
            TransferSettingsRepository settingsRepository,
            Clock clock,
            @Value("${app.sla.settings-cache-ttl-ms:30000}") long ttlMs
    ) {
        this.settingsRepository = settingsRepository;
        this.clock = clock;
        this.ttlMs = Math.max(0, ttlMs);
    }

    public List<TransferSettings> listSlaEnabled() {
        var now = clock.millis();
        var cached = cache.get();
        if (cached != null && cached.expiresAtMs() > now) {
            return cached.settings();
        }

        var loaded = List.copyOf(settingsRepository.listSlaEnabled());
        cache.set(new CacheEntry(loaded, now + ttlMs));
        return loaded;
    }

    public void invalidate() {
        cache.set(null);
    }
}
