package com.agentsentry.evaluator;

import com.agentsentry.evaluator.catalog.TechniqueCatalog;
import com.agentsentry.evaluator.orchestration.EvaluationRunner;
import com.agentsentry.evaluator.payload.PayloadTemplates;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "sentry.evaluation.run-on-startup=true",
                "sentry.target.base-url=http://127.0.0.1:1",
                "sentry.target.max-retries=0",
                "sentry.target.timeout-ms=2000"
        })
class EvaluatorApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void shouldLoadCatalogAndTemplates() {
        assertTrue(context.getBean(TechniqueCatalog.class).size() > 0);
        assertFalse(context.getBean(PayloadTemplates.class).controls().isEmpty());
    }

    @Test
    void shouldSurviveStartupRunAgainstUnreachableTarget() {
        assertNotNull(context.getBean(EvaluationRunner.class));
        assertEquals(1.0, meterRegistry.get("sentry.errors").tag("kind", "SCORING").counter().count(), 1e-9);
    }
}
