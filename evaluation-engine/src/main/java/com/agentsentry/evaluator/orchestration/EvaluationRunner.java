package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.config.EvaluationProperties;
import com.agentsentry.evaluator.scoring.ScoringException;
import com.agentsentry.evaluator.summary.RunSummary;
import com.agentsentry.evaluator.summary.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one evaluation against the configured target at startup and
 * publishes its summary.
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentry.evaluation", name = "run-on-startup", havingValue = "true")
public class EvaluationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(EvaluationRunner.class);

    private final EvaluationOrchestrator orchestrator;
    private final SummaryWriter summaryWriter;
    private final EvaluationProperties properties;

    public EvaluationRunner(EvaluationOrchestrator orchestrator, SummaryWriter summaryWriter,
            EvaluationProperties properties) {
        this.orchestrator = orchestrator;
        this.summaryWriter = summaryWriter;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        RunControl control = RunControl.withDeadline(properties.getDeadline());
        try {
            RunSummary summary = orchestrator.evaluate(control);
            summaryWriter.publish(summary);
        } catch (ScoringException e) {
            log.error("Evaluation aborted: {}", e.getMessage(), e);
        }
    }
}
