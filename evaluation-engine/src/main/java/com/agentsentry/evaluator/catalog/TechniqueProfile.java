package com.agentsentry.evaluator.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable catalogued attack technique.
 *
 * @param id          unique technique identifier (e.g. {@code T1059},
 *                    {@code AML.T0051})
 * @param name        display name
 * @param source      broad-IT or AI/agent-specific origin
 * @param tactics     ordered, de-duplicated tactic labels; the first one is
 *                    the technique's category
 * @param description free-text description
 *
 * @author Naveed Gung
 */
public record TechniqueProfile(
        String id,
        String name,
        SourceTag source,
        List<String> tactics,
        String description) {

    public TechniqueProfile {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Technique id must not be blank");
        }
        if (tactics == null || tactics.isEmpty()) {
            throw new IllegalArgumentException("Technique " + id + " declares no tactics");
        }
        tactics = tactics.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        name = name == null ? id : name;
        description = description == null ? "" : description;
    }

    /** Category label used for payloads and bandit arms. */
    public String category() {
        return tactics.get(0);
    }

    public boolean isAgentic() {
        return source == SourceTag.AGENTIC;
    }

    /** Lower-cased name, description and tactics, used for keyword matching. */
    public String searchableText() {
        return (name + " " + description + " " + String.join(" ", tactics)).toLowerCase(Locale.ROOT);
    }
}
