package com.agentsentry.evaluator.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Template banks used to instantiate payloads.
 *
 * <p>
 * Document shape:
 * </p>
 *
 * <pre>
 * {
 *   "techniques": { "T1059": ["template", ...] },
 *   "categories": { "execution": ["keyword", ...] },
 *   "generic":    ["template with {keyword}", ...],
 *   "controls":   ["benign command", ...]
 * }
 * </pre>
 *
 * <p>
 * Templates may reference {@code {keyword}}, {@code {target}} and
 * {@code {technique}}.
 * </p>
 *
 * @author Naveed Gung
 */
public class PayloadTemplates {

    private static final Logger log = LoggerFactory.getLogger(PayloadTemplates.class);

    private final Map<String, List<String>> byTechnique;
    private final Map<String, List<String>> keywordsByCategory;
    private final List<String> generic;
    private final List<String> controls;

    public PayloadTemplates(
            Map<String, List<String>> byTechnique,
            Map<String, List<String>> keywordsByCategory,
            List<String> generic,
            List<String> controls) {
        if (controls == null || controls.isEmpty()) {
            throw new IllegalArgumentException("At least one control template is required");
        }
        this.byTechnique = copy(byTechnique);
        this.keywordsByCategory = copy(keywordsByCategory);
        this.generic = generic == null ? List.of() : List.copyOf(generic);
        this.controls = List.copyOf(controls);
    }

    public static PayloadTemplates load(InputStream in, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        PayloadTemplates templates = new PayloadTemplates(
                readBank(root.path("techniques")),
                readBank(root.path("categories")),
                readList(root.path("generic")),
                readList(root.path("controls")));
        log.info("Payload templates loaded: {} technique banks, {} category keyword banks, {} generic, {} controls",
                templates.byTechnique.size(), templates.keywordsByCategory.size(),
                templates.generic.size(), templates.controls.size());
        return templates;
    }

    public List<String> forTechnique(String techniqueId) {
        return byTechnique.getOrDefault(techniqueId, List.of());
    }

    public List<String> keywordsFor(String category) {
        return category == null ? List.of()
                : keywordsByCategory.getOrDefault(category.toLowerCase(Locale.ROOT), List.of());
    }

    public List<String> generic() {
        return generic;
    }

    public List<String> controls() {
        return controls;
    }

    private static Map<String, List<String>> readBank(JsonNode node) {
        Map<String, List<String>> bank = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            bank.put(field.getKey(), readList(field.getValue()));
        }
        return bank;
    }

    private static List<String> readList(JsonNode node) {
        List<String> values = new ArrayList<>();
        node.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new HashMap<>();
        if (source != null) {
            source.forEach((k, v) -> {
                if (v != null && !v.isEmpty()) {
                    copy.put(k, List.copyOf(v));
                }
            });
        }
        return Map.copyOf(copy);
    }
}
