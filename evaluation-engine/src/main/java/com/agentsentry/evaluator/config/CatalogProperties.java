package com.agentsentry.evaluator.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the technique catalog and payload template bank.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentry.catalog")
public class CatalogProperties {

    @NotBlank
    private String techniques = "classpath:catalog/techniques.json";
    @NotBlank
    private String templates = "classpath:catalog/templates.json";

    public String getTechniques() {
        return techniques;
    }

    public void setTechniques(String techniques) {
        this.techniques = techniques;
    }

    public String getTemplates() {
        return templates;
    }

    public void setTemplates(String templates) {
        this.templates = templates;
    }
}
