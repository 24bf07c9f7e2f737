package com.agentsentry.evaluator.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where published run summaries are written.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentry.summary")
public class SummaryProperties {

    @NotBlank
    private String outputPath = "./evaluations";

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }
}
