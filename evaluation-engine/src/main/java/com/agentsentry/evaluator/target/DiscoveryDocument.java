package com.agentsentry.evaluator.target;

import java.util.List;

/**
 * Profile document returned by the target's discovery endpoint.
 *
 * @param name              declared agent name
 * @param capabilities      declared capability strings
 * @param platforms         declared platform(s)
 * @param skillDescriptions free-text descriptions of the agent's skills
 *
 * @author Naveed Gung
 */
public record DiscoveryDocument(
        String name,
        List<String> capabilities,
        List<String> platforms,
        List<String> skillDescriptions) {

    public DiscoveryDocument {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        skillDescriptions = skillDescriptions == null ? List.of() : List.copyOf(skillDescriptions);
    }
}
