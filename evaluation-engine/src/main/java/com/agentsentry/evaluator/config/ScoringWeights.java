package com.agentsentry.evaluator.config;

import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Weighting table of the relevance score. Defaults sum to 1.0.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentry.scoring")
public class ScoringWeights {

    @DecimalMin("0.0")
    private double platform = 0.30;
    @DecimalMin("0.0")
    private double capability = 0.25;
    @DecimalMin("0.0")
    private double domain = 0.15;
    @DecimalMin("0.0")
    private double tacticAffinity = 0.20;
    @DecimalMin("0.0")
    private double sourceBonus = 0.10;

    public double getPlatform() {
        return platform;
    }

    public void setPlatform(double platform) {
        this.platform = platform;
    }

    public double getCapability() {
        return capability;
    }

    public void setCapability(double capability) {
        this.capability = capability;
    }

    public double getDomain() {
        return domain;
    }

    public void setDomain(double domain) {
        this.domain = domain;
    }

    public double getTacticAffinity() {
        return tacticAffinity;
    }

    public void setTacticAffinity(double tacticAffinity) {
        this.tacticAffinity = tacticAffinity;
    }

    public double getSourceBonus() {
        return sourceBonus;
    }

    public void setSourceBonus(double sourceBonus) {
        this.sourceBonus = sourceBonus;
    }
}
