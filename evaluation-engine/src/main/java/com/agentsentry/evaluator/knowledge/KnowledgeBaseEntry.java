package com.agentsentry.evaluator.knowledge;

import java.time.Instant;
import java.util.Map;

/**
 * One shared finding. Entries are immutable once appended.
 *
 * @param sequence      1-based append position
 * @param contributorId id of the worker that produced the finding
 * @param round         round in which it was produced
 * @param type          kind of insight
 * @param subject       what the insight is about (technique id, payload id)
 * @param note          human-readable finding
 * @param attributes    structured details
 * @param createdAt     append time
 *
 * @author Naveed Gung
 */
public record KnowledgeBaseEntry(
        long sequence,
        String contributorId,
        int round,
        InsightType type,
        String subject,
        String note,
        Map<String, Object> attributes,
        Instant createdAt) {

    public KnowledgeBaseEntry {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
