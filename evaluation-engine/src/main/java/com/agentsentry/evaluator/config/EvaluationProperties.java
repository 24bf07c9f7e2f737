package com.agentsentry.evaluator.config;

import com.agentsentry.evaluator.bandit.ArmGranularity;
import com.agentsentry.evaluator.bandit.PolicyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Evaluation run configuration: budget, round structure, worker counts and
 * the search parameters of the bandit and mutation engine.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentry.evaluation")
public class EvaluationProperties {

    @Min(1)
    private int maxRounds = 5;
    @NotNull
    private Duration deadline = Duration.ofMinutes(10);
    @NotNull
    private Duration gracePeriod = Duration.ofSeconds(5);
    @Min(1)
    private int topK = 25;
    @Min(1)
    private int payloadsPerTechnique = 4;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maliciousRatio = 0.8;
    @Min(1)
    private int attemptsPerRound = 40;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mutationMix = 0.5;
    @NotNull
    private ArmGranularity armGranularity = ArmGranularity.CATEGORY;
    @NotNull
    private PolicyType allocationPolicy = PolicyType.THOMPSON;
    private long seed = 42L;
    @Min(1)
    private int exploiters = 3;
    @Min(0)
    private int validators = 1;
    @Min(0)
    private int counterfactualAnalysts = 1;
    @Min(0)
    private int validationSample = 8;
    @Min(0)
    private int counterfactualSample = 4;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.5;
    @NotNull
    private Duration slowResponse = Duration.ofSeconds(5);
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double weakCategoryThreshold = 0.4;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double strongCategoryThreshold = 0.6;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double stabilityThreshold = 0.05;
    private boolean runOnStartup = false;
    @Valid
    private Mutation mutation = new Mutation();

    public int getMaxRounds() {
        return maxRounds;
    }

    public void setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    public Duration getDeadline() {
        return deadline;
    }

    public void setDeadline(Duration deadline) {
        this.deadline = deadline;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getPayloadsPerTechnique() {
        return payloadsPerTechnique;
    }

    public void setPayloadsPerTechnique(int payloadsPerTechnique) {
        this.payloadsPerTechnique = payloadsPerTechnique;
    }

    public double getMaliciousRatio() {
        return maliciousRatio;
    }

    public void setMaliciousRatio(double maliciousRatio) {
        this.maliciousRatio = maliciousRatio;
    }

    public int getAttemptsPerRound() {
        return attemptsPerRound;
    }

    public void setAttemptsPerRound(int attemptsPerRound) {
        this.attemptsPerRound = attemptsPerRound;
    }

    public double getMutationMix() {
        return mutationMix;
    }

    public void setMutationMix(double mutationMix) {
        this.mutationMix = mutationMix;
    }

    public ArmGranularity getArmGranularity() {
        return armGranularity;
    }

    public void setArmGranularity(ArmGranularity armGranularity) {
        this.armGranularity = armGranularity;
    }

    public PolicyType getAllocationPolicy() {
        return allocationPolicy;
    }

    public void setAllocationPolicy(PolicyType allocationPolicy) {
        this.allocationPolicy = allocationPolicy;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getExploiters() {
        return exploiters;
    }

    public void setExploiters(int exploiters) {
        this.exploiters = exploiters;
    }

    public int getValidators() {
        return validators;
    }

    public void setValidators(int validators) {
        this.validators = validators;
    }

    public int getCounterfactualAnalysts() {
        return counterfactualAnalysts;
    }

    public void setCounterfactualAnalysts(int counterfactualAnalysts) {
        this.counterfactualAnalysts = counterfactualAnalysts;
    }

    public int getValidationSample() {
        return validationSample;
    }

    public void setValidationSample(int validationSample) {
        this.validationSample = validationSample;
    }

    public int getCounterfactualSample() {
        return counterfactualSample;
    }

    public void setCounterfactualSample(int counterfactualSample) {
        this.counterfactualSample = counterfactualSample;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public Duration getSlowResponse() {
        return slowResponse;
    }

    public void setSlowResponse(Duration slowResponse) {
        this.slowResponse = slowResponse;
    }

    public double getWeakCategoryThreshold() {
        return weakCategoryThreshold;
    }

    public void setWeakCategoryThreshold(double weakCategoryThreshold) {
        this.weakCategoryThreshold = weakCategoryThreshold;
    }

    public double getStrongCategoryThreshold() {
        return strongCategoryThreshold;
    }

    public void setStrongCategoryThreshold(double strongCategoryThreshold) {
        this.strongCategoryThreshold = strongCategoryThreshold;
    }

    public double getStabilityThreshold() {
        return stabilityThreshold;
    }

    public void setStabilityThreshold(double stabilityThreshold) {
        this.stabilityThreshold = stabilityThreshold;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public Mutation getMutation() {
        return mutation;
    }

    public void setMutation(Mutation mutation) {
        this.mutation = mutation;
    }

    /** Novelty archive and mutation operator settings. */
    public static class Mutation {
        @Min(1)
        private int archiveCapacity = 64;
        @DecimalMin("0.0")
        private double evasionBonus = 1.5;
        @DecimalMin("0.0")
        private double substitutionWeight = 0.35;
        @DecimalMin("0.0")
        private double wrappingWeight = 0.25;
        @DecimalMin("0.0")
        private double reorderingWeight = 0.20;
        @DecimalMin("0.0")
        private double crossoverWeight = 0.20;

        public int getArchiveCapacity() {
            return archiveCapacity;
        }

        public void setArchiveCapacity(int archiveCapacity) {
            this.archiveCapacity = archiveCapacity;
        }

        public double getEvasionBonus() {
            return evasionBonus;
        }

        public void setEvasionBonus(double evasionBonus) {
            this.evasionBonus = evasionBonus;
        }

        public double getSubstitutionWeight() {
            return substitutionWeight;
        }

        public void setSubstitutionWeight(double substitutionWeight) {
            this.substitutionWeight = substitutionWeight;
        }

        public double getWrappingWeight() {
            return wrappingWeight;
        }

        public void setWrappingWeight(double wrappingWeight) {
            this.wrappingWeight = wrappingWeight;
        }

        public double getReorderingWeight() {
            return reorderingWeight;
        }

        public void setReorderingWeight(double reorderingWeight) {
            this.reorderingWeight = reorderingWeight;
        }

        public double getCrossoverWeight() {
            return crossoverWeight;
        }

        public void setCrossoverWeight(double crossoverWeight) {
            this.crossoverWeight = crossoverWeight;
        }
    }
}
