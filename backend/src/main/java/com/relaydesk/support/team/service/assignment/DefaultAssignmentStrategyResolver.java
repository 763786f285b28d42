package com.relaydesk.support.team.service.assignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DefaultAssignmentStrategyResolver implements AssignmentStrategyResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultAssignmentStrategyResolver.class);

    static final String DEFAULT_KEY = "round_robin";

    private final Map<String, AssignmentStrategy> strategies;

    public DefaultAssignmentStrategyResolver(Map<String, AssignmentStrategy> strategies) {
        this.strategies = strategies;
    }

    @Override
    public AssignmentStrategy resolve(String strategyKey) {
        var key = normalizeStrategyKey(strategyKey);
        var picked = strategies == null ? null : strategies.get(key);
        if (picked != null) return picked;

        var fallback = strategies == null ? null : strategies.get(DEFAULT_KEY);
        if (fallback != null) {
            log.warn("unknown_assignment_strategy strategy={} fallback=round_robin", key);
            return fallback;
        }

        throw new IllegalStateException("assignment_strategy_not_found");
    }

    @Override
    public String normalizeStrategyKey(String raw) {
        var key = (raw == null ? "" : raw.trim().toLowerCase()).replace('-', '_');
        if (key.isBlank()) return DEFAULT_KEY;
        return switch (key) {
            case "roundrobin" -> "round_robin";
            case "loadbalanced", "least_open" -> "load_balanced";
            default -> key;
        };
    }
}
