package com.agentsentry.evaluator.scoring;

import com.agentsentry.evaluator.catalog.TechniqueProfile;
import com.agentsentry.evaluator.config.ScoringWeights;
import com.agentsentry.evaluator.target.AgentType;
import com.agentsentry.evaluator.target.TargetProfile;
import com.agentsentry.evaluator.target.TargetVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks catalog techniques by relevance to a target profile.
 *
 * <p>
 * Score is a weighted sum of five features, each in [0.0, 1.0]:
 * </p>
 * <ul>
 * <li><b>platform</b>: 1.0 if the technique names a target platform, 0.5 if it
 * names no known platform at all, else 0</li>
 * <li><b>capability</b>: 1.0 if any target capability is named</li>
 * <li><b>domain</b>: fraction of target domain tags named</li>
 * <li><b>tactic affinity</b>: best affinity of the technique's tactics for the
 * target's agent type</li>
 * <li><b>source bonus</b>: 1.0 for agent-specific techniques against an
 * autonomous agent</li>
 * </ul>
 *
 * <p>
 * Pure and deterministic: ties are broken by ascending technique id.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class RelevanceScorer {

    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    /** Affinity for tactics missing from a table. */
    private static final double DEFAULT_AFFINITY = 0.3;

    private static final Map<AgentType, Map<String, Double>> TACTIC_AFFINITY = new EnumMap<>(AgentType.class);

    static {
        TACTIC_AFFINITY.put(AgentType.AUTONOMOUS_AGENT, Map.ofEntries(
                Map.entry("execution", 1.0),
                Map.entry("privilege-escalation", 0.9),
                Map.entry("exfiltration", 0.9),
                Map.entry("persistence", 0.8),
                Map.entry("defense-evasion", 0.8),
                Map.entry("credential-access", 0.8),
                Map.entry("impact", 0.8),
                Map.entry("initial-access", 0.7),
                Map.entry("ml-attack-staging", 0.7),
                Map.entry("ml-model-access", 0.7),
                Map.entry("discovery", 0.6),
                Map.entry("collection", 0.6),
                Map.entry("lateral-movement", 0.5),
                Map.entry("command-and-control", 0.5),
                Map.entry("reconnaissance", 0.4),
                Map.entry("resource-development", 0.2)));
        TACTIC_AFFINITY.put(AgentType.TOOL_SERVICE, Map.ofEntries(
                Map.entry("initial-access", 0.9),
                Map.entry("execution", 0.8),
                Map.entry("credential-access", 0.8),
                Map.entry("exfiltration", 0.7),
                Map.entry("collection", 0.7),
                Map.entry("impact", 0.6),
                Map.entry("discovery", 0.6),
                Map.entry("privilege-escalation", 0.6),
                Map.entry("defense-evasion", 0.5),
                Map.entry("persistence", 0.4),
                Map.entry("ml-model-access", 0.4),
                Map.entry("reconnaissance", 0.3)));
        TACTIC_AFFINITY.put(AgentType.CONVERSATIONAL, Map.ofEntries(
                Map.entry("ml-attack-staging", 0.9),
                Map.entry("ml-model-access", 0.9),
                Map.entry("initial-access", 0.8),
                Map.entry("exfiltration", 0.7),
                Map.entry("defense-evasion", 0.7),
                Map.entry("collection", 0.6),
                Map.entry("reconnaissance", 0.5),
                Map.entry("impact", 0.4),
                Map.entry("execution", 0.2)));
    }

    private final ScoringWeights weights;

    public RelevanceScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    /**
     * Score and rank every technique.
     *
     * @param target  the target profile; must be complete
     * @param catalog the techniques to rank
     * @return techniques in descending score order, ranks starting at 1
     * @throws ScoringException if the profile is missing required fields
     */
    public List<ScoredTechnique> score(TargetProfile target, List<TechniqueProfile> catalog) {
        validate(target);

        List<TechniqueProfile> ordered = new ArrayList<>(catalog);
        Map<String, Double> scores = new HashMap<>();
        for (TechniqueProfile technique : ordered) {
            scores.put(technique.id(), relevance(target, technique));
        }

        ordered.sort(Comparator
                .comparingDouble((TechniqueProfile t) -> scores.get(t.id())).reversed()
                .thenComparing(TechniqueProfile::id));

        List<ScoredTechnique> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            TechniqueProfile technique = ordered.get(i);
            ranked.add(new ScoredTechnique(technique, scores.get(technique.id()), i + 1));
        }

        log.info("Scored {} techniques for target {} (top={})", ranked.size(), target.name(),
                ranked.isEmpty() ? "none" : ranked.get(0).id());
        return ranked;
    }

    /**
     * Score, rank and keep the first {@code k} techniques.
     */
    public List<ScoredTechnique> topK(TargetProfile target, List<TechniqueProfile> catalog, int k) {
        List<ScoredTechnique> ranked = score(target, catalog);
        return List.copyOf(ranked.subList(0, Math.min(k, ranked.size())));
    }

    double relevance(TargetProfile target, TechniqueProfile technique) {
        String text = technique.searchableText();

        return weights.getPlatform() * platformMatch(target, text)
                + weights.getCapability() * capabilityOverlap(target, text)
                + weights.getDomain() * domainOverlap(target, text)
                + weights.getTacticAffinity() * tacticAffinity(target.agentType(), technique)
                + weights.getSourceBonus() * (technique.isAgentic() && target.isAutonomousAgent() ? 1.0 : 0.0);
    }

    private static double platformMatch(TargetProfile target, String text) {
        for (String platform : target.platforms()) {
            if (TargetVocabulary.mentions(TargetVocabulary.PLATFORM_KEYWORDS, platform, text)) {
                return 1.0;
            }
        }
        return TargetVocabulary.labelsIn(TargetVocabulary.PLATFORM_KEYWORDS, text).isEmpty() ? 0.5 : 0.0;
    }

    private static double capabilityOverlap(TargetProfile target, String text) {
        for (String capability : target.capabilities()) {
            if (TargetVocabulary.mentions(TargetVocabulary.CAPABILITY_KEYWORDS, capability, text)) {
                return 1.0;
            }
        }
        return 0.0;
    }

    private static double domainOverlap(TargetProfile target, String text) {
        if (target.domainTags().isEmpty()) {
            return 0.0;
        }
        long matched = target.domainTags().stream()
                .filter(tag -> TargetVocabulary.mentions(TargetVocabulary.DOMAIN_KEYWORDS, tag, text))
                .count();
        return (double) matched / target.domainTags().size();
    }

    private static double tacticAffinity(AgentType agentType, TechniqueProfile technique) {
        Map<String, Double> table = TACTIC_AFFINITY.getOrDefault(agentType, Map.of());
        return technique.tactics().stream()
                .mapToDouble(tactic -> table.getOrDefault(tactic, DEFAULT_AFFINITY))
                .max()
                .orElse(DEFAULT_AFFINITY);
    }

    private static void validate(TargetProfile target) {
        if (target == null) {
            throw new ScoringException("Target profile is missing");
        }
        List<String> missing = new ArrayList<>();
        if (target.name() == null || target.name().isBlank()) {
            missing.add("name");
        }
        if (target.agentType() == null) {
            missing.add("agentType");
        }
        if (target.platforms().isEmpty()) {
            missing.add("platforms");
        }
        if (target.riskLevel() == null) {
            missing.add("riskLevel");
        }
        if (!missing.isEmpty()) {
            throw new ScoringException("Target profile is missing required fields: " + missing);
        }
    }
}
