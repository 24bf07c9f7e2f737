package com.agentsentry.evaluator.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only store of findings shared by the workers of one run.
 *
 * <p>
 * Appends are serialized so concurrent contributors never lose an update.
 * Entries are never reordered, rewritten or removed; readers get
 * immutable snapshots in append order.
 * </p>
 *
 * @author Naveed Gung
 */
public class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<KnowledgeBaseEntry> entries = new ArrayList<>();
    private final Clock clock;

    public KnowledgeBase() {
        this(Clock.systemUTC());
    }

    public KnowledgeBase(Clock clock) {
        this.clock = clock;
    }

    /**
     * Append a finding.
     *
     * @return the stored entry with its sequence number
     */
    public KnowledgeBaseEntry append(String contributorId, int round, InsightType type, String subject,
            String note, Map<String, Object> attributes) {
        lock.lock();
        try {
            KnowledgeBaseEntry entry = new KnowledgeBaseEntry(entries.size() + 1L, contributorId, round, type,
                    subject, note, attributes, clock.instant());
            entries.add(entry);
            log.debug("KB #{} [{}] {} by {}: {}", entry.sequence(), type, subject, contributorId, note);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public List<KnowledgeBaseEntry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public List<KnowledgeBaseEntry> byType(InsightType type) {
        return snapshot().stream().filter(e -> e.type() == type).toList();
    }

    /**
     * Subjects of technique recommendations, in the order first recommended.
     */
    public Set<String> recommendedTechniques() {
        Set<String> recommended = new LinkedHashSet<>();
        for (KnowledgeBaseEntry entry : byType(InsightType.TECHNIQUE_RECOMMENDATION)) {
            recommended.add(entry.subject());
        }
        return recommended;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
