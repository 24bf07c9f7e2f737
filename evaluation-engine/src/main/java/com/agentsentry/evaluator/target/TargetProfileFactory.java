package com.agentsentry.evaluator.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a {@link TargetProfile} from the target's discovery document.
 *
 * <p>
 * Capability flags come from the declared capabilities and skill
 * descriptions; the agent type follows from whether any tool capability is
 * present; domain tags come from skill descriptions; the risk level counts
 * high-impact capabilities. Missing fields are left empty so the scorer can
 * reject the profile.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class TargetProfileFactory {

    private static final Logger log = LoggerFactory.getLogger(TargetProfileFactory.class);

    public TargetProfile fromDiscovery(DiscoveryDocument document) {
        String declared = String.join(" ", document.capabilities()).toLowerCase(Locale.ROOT);
        String skills = String.join(" ", document.skillDescriptions()).toLowerCase(Locale.ROOT);

        Set<String> capabilities = new TreeSet<>(
                TargetVocabulary.labelsIn(TargetVocabulary.CAPABILITY_KEYWORDS, declared + " " + skills));
        Set<String> domainTags = TargetVocabulary.labelsIn(TargetVocabulary.DOMAIN_KEYWORDS, skills);

        Set<String> platforms = new TreeSet<>();
        for (String platform : document.platforms()) {
            Set<String> known = TargetVocabulary.labelsIn(TargetVocabulary.PLATFORM_KEYWORDS, platform);
            if (known.isEmpty() && !platform.isBlank()) {
                platforms.add(platform.trim().toLowerCase(Locale.ROOT));
            } else {
                platforms.addAll(known);
            }
        }

        AgentType agentType;
        if (capabilities.stream().anyMatch(TargetVocabulary.TOOL_CAPABILITIES::contains)) {
            agentType = AgentType.AUTONOMOUS_AGENT;
        } else if (!capabilities.isEmpty()) {
            agentType = AgentType.TOOL_SERVICE;
        } else {
            agentType = AgentType.CONVERSATIONAL;
        }

        int highImpact = (int) capabilities.stream()
                .filter(TargetVocabulary.HIGH_IMPACT_CAPABILITIES::contains)
                .count();

        TargetProfile profile = new TargetProfile(
                document.name(), agentType, platforms, capabilities, domainTags,
                RiskLevel.forHighImpactCount(highImpact));
        log.info("Target profile built: name={} type={} platforms={} capabilities={} domains={} risk={}",
                profile.name(), profile.agentType(), profile.platforms(), profile.capabilities(),
                profile.domainTags(), profile.riskLevel());
        return profile;
    }
}
