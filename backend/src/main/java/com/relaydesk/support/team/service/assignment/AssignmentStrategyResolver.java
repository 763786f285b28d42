package com.relaydesk.support.team.service.assignment;

public interface AssignmentStrategyResolver {

    AssignmentStrategy resolve(String strategyKey);

    String normalizeStrategyKey(String raw);
}
