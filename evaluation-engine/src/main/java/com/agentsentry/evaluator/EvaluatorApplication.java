package com.agentsentry.evaluator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Agent Sentry Evaluation Engine.
 *
 * <p>
 * Spring Boot application that probes an autonomous agent with adversarial
 * and benign commands, ranks attack techniques against the target's profile,
 * allocates the attempt budget with a Thompson-Sampling bandit, evolves
 * payloads through novelty search, and reports a confusion-matrix summary of
 * how many malicious commands the agent executed versus rejected.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EvaluatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvaluatorApplication.class, args);
    }
}
