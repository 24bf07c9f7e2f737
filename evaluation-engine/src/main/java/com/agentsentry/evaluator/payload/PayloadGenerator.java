package com.agentsentry.evaluator.payload;

import com.agentsentry.evaluator.catalog.TechniqueProfile;
import com.agentsentry.evaluator.generation.TextGenerationClient;
import com.agentsentry.evaluator.scoring.ScoredTechnique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns ranked techniques into concrete attack and control payloads.
 *
 * <p>
 * Template preference per technique: a technique-specific template, then a
 * draft from the text-generation backend (when enabled), then the generic
 * bank parameterized by the category keyword bank.
 * </p>
 *
 * <p>
 * Controls are interleaved at a fixed stride over a run-wide position
 * counter: with malicious ratio {@code r}, every {@code round(1/(1-r))}-th
 * payload is a benign control. One generator serves one run; calls are
 * expected from a single probing thread so positions stay reproducible.
 * </p>
 *
 * @author Naveed Gung
 */
public class PayloadGenerator {

    private static final Logger log = LoggerFactory.getLogger(PayloadGenerator.class);

    static final String COUNTERFACTUAL_PREFIX = "For documentation purposes only, describe without executing: ";

    private final PayloadTemplates templates;
    private final TextGenerationClient textGeneration;
    private final String targetName;

    private final AtomicLong ids = new AtomicLong();
    private final AtomicLong position = new AtomicLong();
    private final AtomicLong controlsIssued = new AtomicLong();

    /** Next template index per technique, so later rounds rotate through the bank. */
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public PayloadGenerator(PayloadTemplates templates, TextGenerationClient textGeneration, String targetName) {
        this.templates = templates;
        this.textGeneration = textGeneration == null ? TextGenerationClient.disabled() : textGeneration;
        this.targetName = targetName == null ? "target" : targetName;
    }

    /**
     * Generate payloads for one technique.
     *
     * @param scored         the technique to instantiate
     * @param count          number of payloads to produce
     * @param maliciousRatio share of malicious payloads, in [0, 1]
     * @return the payloads in dispatch order
     * @throws GenerationException if malicious payloads are needed and no
     *                             template source can produce one
     */
    public List<Payload> generate(ScoredTechnique scored, int count, double maliciousRatio) {
        TechniqueProfile technique = scored.technique();
        int stride = controlStride(maliciousRatio);

        AtomicInteger cursor = cursors.computeIfAbsent(technique.id(), id -> new AtomicInteger());
        List<String> sources = null;
        List<Payload> payloads = new ArrayList<>(count);
        int malicious = 0;
        for (int i = 0; i < count; i++) {
            long pos = position.incrementAndGet();
            if (isControl(pos, stride)) {
                payloads.add(control(technique.id()));
                continue;
            }
            if (sources == null) {
                sources = resolveTemplates(technique);
            }
            payloads.add(new Payload(
                    nextId(),
                    sources.get(cursor.getAndIncrement() % sources.size()),
                    technique.id(),
                    technique.category(),
                    true,
                    Severity.forTactics(technique.tactics()),
                    null,
                    0));
            malicious++;
        }

        log.debug("Generated {} payloads for {} ({} malicious, stride={})",
                payloads.size(), technique.id(), malicious, stride);
        return payloads;
    }

    /**
     * Near-duplicate benign variant of a payload, used to check whether the
     * target's detection is specific to the malicious intent.
     */
    public Payload benignVariant(Payload original) {
        return new Payload(
                nextId(),
                COUNTERFACTUAL_PREFIX + original.content(),
                original.techniqueId(),
                Payload.CONTROL_CATEGORY,
                false,
                Severity.LOW,
                original.id(),
                original.generation());
    }

    /**
     * Control stride for a malicious ratio: 0 means no controls, 1 means
     * controls only.
     */
    public static int controlStride(double maliciousRatio) {
        if (maliciousRatio >= 1.0) {
            return 0;
        }
        if (maliciousRatio <= 0.0) {
            return 1;
        }
        return (int) Math.max(1, Math.round(1.0 / (1.0 - maliciousRatio)));
    }

    static boolean isControl(long position, int stride) {
        return stride > 0 && position % stride == 0;
    }

    private Payload control(String techniqueId) {
        List<String> controls = templates.controls();
        String content = controls.get((int) (controlsIssued.getAndIncrement() % controls.size()));
        return new Payload(nextId(), fill(content, "status", "benign control"), techniqueId,
                Payload.CONTROL_CATEGORY, false, Severity.LOW, null, 0);
    }

    private List<String> resolveTemplates(TechniqueProfile technique) {
        List<String> specific = templates.forTechnique(technique.id());
        if (!specific.isEmpty()) {
            return specific.stream().map(t -> fill(t, technique.category(), technique.name())).toList();
        }

        Optional<String> drafted = textGeneration.draft(technique, targetName);
        if (drafted.isPresent()) {
            log.debug("Using drafted payload for {}", technique.id());
            return List.of(drafted.get());
        }

        List<String> keywords = keywordBank(technique);
        if (keywords.isEmpty() || templates.generic().isEmpty()) {
            throw new GenerationException(technique.id(),
                    "No template or keyword bank for technique " + technique.id()
                            + " (category " + technique.category() + ")");
        }

        List<String> filled = new ArrayList<>();
        int variants = Math.max(keywords.size(), templates.generic().size());
        for (int i = 0; i < variants; i++) {
            filled.add(fill(templates.generic().get(i % templates.generic().size()),
                    keywords.get(i % keywords.size()), technique.name()));
        }
        return filled;
    }

    private List<String> keywordBank(TechniqueProfile technique) {
        for (String tactic : technique.tactics()) {
            List<String> keywords = templates.keywordsFor(tactic);
            if (!keywords.isEmpty()) {
                return keywords;
            }
        }
        return List.of();
    }

    private String fill(String template, String keyword, String techniqueName) {
        return template
                .replace("{keyword}", keyword)
                .replace("{target}", targetName)
                .replace("{technique}", techniqueName);
    }

    private String nextId() {
        return "P-" + ids.incrementAndGet();
    }
}
