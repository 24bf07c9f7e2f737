package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.config.SummaryProperties;
import com.agentsentry.evaluator.knowledge.KnowledgeBaseEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Publishes run summaries for external reporting.
 *
 * <p>
 * Directory structure:
 * </p>
 *
 * <pre>
 * {output-path}/
 *   {date}/
 *     {run-id}/
 *       summary.json    - Run summary (snake_case)
 *       timeline.log    - Knowledge-base entries in append order
 * </pre>
 *
 * <p>
 * Publication failures are logged and never fail the run.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class SummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(SummaryWriter.class);

    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final SummaryProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private Counter summariesPublished;

    public SummaryWriter(SummaryProperties properties, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        summariesPublished = Counter.builder("sentry.summary.published")
                .description("Run summaries written to disk")
                .register(meterRegistry);
        log.info("Run summaries will be written to {}", properties.getOutputPath());
    }

    /**
     * Write the summary and its knowledge-base timeline.
     *
     * @return the run directory, or empty if publication failed
     */
    public Optional<Path> publish(RunSummary summary) {
        try {
            Instant finished = summary.finishedAt() == null ? Instant.now() : summary.finishedAt();
            String date = DATE_FMT.format(finished.atZone(ZoneOffset.UTC));
            Path runDir = Path.of(properties.getOutputPath(), date, summary.runId());
            Files.createDirectories(runDir);

            Files.writeString(runDir.resolve("summary.json"), toJson(summary),
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            writeTimeline(runDir, summary);

            if (summariesPublished != null) {
                summariesPublished.increment();
            }
            log.info("Summary for run {} written to {}", summary.runId(), runDir);
            return Optional.of(runDir);
        } catch (IOException e) {
            log.error("Summary publication failed for run {}: {}", summary.runId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    public String toJson(RunSummary summary) throws IOException {
        return objectMapper.writeValueAsString(summary);
    }

    private void writeTimeline(Path dir, RunSummary summary) throws IOException {
        StringBuilder timeline = new StringBuilder();
        for (KnowledgeBaseEntry entry : summary.knowledgeBaseEntries()) {
            timeline.append(String.format("[%s] #%d round=%d %s by=%s subject=%s %s%n",
                    TIME_FMT.format(entry.createdAt().atZone(ZoneOffset.UTC)),
                    entry.sequence(), entry.round(), entry.type(), entry.contributorId(),
                    entry.subject(), entry.note()));
        }
        Files.writeString(dir.resolve("timeline.log"), timeline.toString(),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
