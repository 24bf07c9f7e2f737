package com.agentsentry.evaluator.config;

import com.agentsentry.evaluator.catalog.TechniqueCatalog;
import com.agentsentry.evaluator.generation.HttpTextGenerationClient;
import com.agentsentry.evaluator.generation.TextGenerationClient;
import com.agentsentry.evaluator.payload.PayloadTemplates;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Catalog, template bank and text-generation backend wiring.
 *
 * <p>
 * The catalog and templates load once at startup; a missing or malformed
 * resource fails the context. The text-generation backend stays disabled
 * unless enabled and given an API key.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
public class EvaluationBeans {

    private static final Logger log = LoggerFactory.getLogger(EvaluationBeans.class);

    @Bean
    public TechniqueCatalog techniqueCatalog(CatalogProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) throws IOException {
        Resource resource = resourceLoader.getResource(properties.getTechniques());
        try (InputStream in = resource.getInputStream()) {
            return TechniqueCatalog.load(in, objectMapper);
        }
    }

    @Bean
    public PayloadTemplates payloadTemplates(CatalogProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) throws IOException {
        Resource resource = resourceLoader.getResource(properties.getTemplates());
        try (InputStream in = resource.getInputStream()) {
            return PayloadTemplates.load(in, objectMapper);
        }
    }

    @Bean
    public TextGenerationClient textGenerationClient(GenerationProperties properties, ObjectMapper objectMapper) {
        if (!properties.isEnabled()) {
            log.info("Text generation disabled, payloads come from the template bank only");
            return TextGenerationClient.disabled();
        }
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            log.warn("Text generation enabled but no API key configured, falling back to templates");
            return TextGenerationClient.disabled();
        }
        log.info("Text generation enabled: model={} rate-limit={}/min", properties.getModel(),
                properties.getRateLimitPerMinute());
        return new HttpTextGenerationClient(properties, objectMapper);
    }
}
