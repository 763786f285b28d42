package com.relaydesk.support.team.service.assignment;

import com.relaydesk.support.team.repo.TeamMemberRepository.AgentCandidateRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AssignmentStrategiesTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private static AssignmentContext ctx(List<AgentCandidateRow> candidates, Map<String, Integer> loads) {
        return new AssignmentContext("tn1", "team1", candidates, loads);
    }

    @Test
    void round_robin_prefers_never_assigned_member() {
        var strategy = new RoundRobinAssignmentStrategy();
        var picked = strategy.select(ctx(List.of(
                new AgentCandidateRow("a", T0),
                new AgentCandidateRow("b", null),
                new AgentCandidateRow("c", null)
        ), Map.of()));

        assertThat(picked.userId()).isEqualTo("b");
        assertThat(strategy.advancesCursor()).isTrue();
    }

    @Test
    void round_robin_picks_least_recently_assigned_and_keeps_order_on_ties() {
        var strategy = new RoundRobinAssignmentStrategy();
        var picked = strategy.select(ctx(List.of(
                new AgentCandidateRow("a", T0.plusSeconds(60)),
                new AgentCandidateRow("b", T0),
                new AgentCandidateRow("c", T0)
        ), Map.of()));

        assertThat(picked.userId()).isEqualTo("b");
    }

    @Test
    void round_robin_returns_null_without_candidates() {
        assertThat(new RoundRobinAssignmentStrategy().select(ctx(List.of(), Map.of()))).isNull();
    }

    @Test
    void load_balanced_picks_strict_minimum() {
        var strategy = new LoadBalancedAssignmentStrategy();
        var picked = strategy.select(ctx(List.of(
                new AgentCandidateRow("a", null),
                new AgentCandidateRow("b", null),
                new AgentCandidateRow("c", null)
        ), Map.of("a", 3, "b", 1, "c", 2)));

        assertThat(picked.userId()).isEqualTo("b");
        assertThat(strategy.needsActiveLoads()).isTrue();
    }

    @Test
    void load_balanced_tie_goes_to_first_enumerated_and_missing_load_counts_as_zero() {
        var strategy = new LoadBalancedAssignmentStrategy();

        var tie = strategy.select(ctx(List.of(
                new AgentCandidateRow("a", null),
                new AgentCandidateRow("b", null)
        ), Map.of("a", 2, "b", 2)));
        assertThat(tie.userId()).isEqualTo("a");

        var idle = strategy.select(ctx(List.of(
                new AgentCandidateRow("a", null),
                new AgentCandidateRow("b", null)
        ), Map.of("a", 1)));
        assertThat(idle.userId()).isEqualTo("b");
    }

    @Test
    void manual_never_selects() {
        var picked = new ManualAssignmentStrategy().select(ctx(List.of(new AgentCandidateRow("a", null)), Map.of()));
        assertThat(picked).isNull();
    }

    @Test
    void resolver_normalizes_keys_and_falls_back_to_round_robin() {
        var roundRobin = new RoundRobinAssignmentStrategy();
        var loadBalanced = new LoadBalancedAssignmentStrategy();
        var manual = new ManualAssignmentStrategy();
        var resolver = new DefaultAssignmentStrategyResolver(Map.of(
                "round_robin", roundRobin,
                "load_balanced", loadBalanced,
                "manual", manual
        ));

        assertThat(resolver.resolve(" Load-Balanced ")).isSameAs(loadBalanced);
        assertThat(resolver.resolve("loadbalanced")).isSameAs(loadBalanced);
        assertThat(resolver.resolve("RoundRobin")).isSameAs(roundRobin);
        assertThat(resolver.resolve("MANUAL")).isSameAs(manual);
        assertThat(resolver.resolve(null)).isSameAs(roundRobin);
        assertThat(resolver.resolve("")).isSameAs(roundRobin);
        assertThat(resolver.resolve("weighted_random")).isSameAs(roundRobin);
    }
}
