package com.agentsentry.evaluator.target;

import java.util.Set;
import java.util.TreeSet;

/**
 * Profile of the agent under evaluation, built once per run from discovery
 * data.
 *
 * <p>
 * Fields may be missing when discovery was incomplete; the relevance scorer
 * validates them before any attempt is issued.
 * </p>
 *
 * @author Naveed Gung
 */
public record TargetProfile(
        String name,
        AgentType agentType,
        Set<String> platforms,
        Set<String> capabilities,
        Set<String> domainTags,
        RiskLevel riskLevel) {

    public TargetProfile {
        platforms = sortedCopy(platforms);
        capabilities = sortedCopy(capabilities);
        domainTags = sortedCopy(domainTags);
    }

    public boolean isAutonomousAgent() {
        return agentType == AgentType.AUTONOMOUS_AGENT;
    }

    private static Set<String> sortedCopy(Set<String> values) {
        return values == null ? Set.of() : Set.copyOf(new TreeSet<>(values));
    }
}
