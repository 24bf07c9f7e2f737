package com.agentsentry.evaluator.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static registry of attack techniques, built once per application.
 *
 * <p>
 * The catalog source is a JSON array of
 * {@code {id, name, source_tag, tactics: [string], description}} entries.
 * Duplicate identifiers are rejected.
 * </p>
 *
 * @author Naveed Gung
 */
public class TechniqueCatalog {

    private static final Logger log = LoggerFactory.getLogger(TechniqueCatalog.class);

    private final Map<String, TechniqueProfile> techniques;

    public TechniqueCatalog(List<TechniqueProfile> profiles) {
        Map<String, TechniqueProfile> byId = new LinkedHashMap<>();
        for (TechniqueProfile profile : profiles) {
            if (byId.putIfAbsent(profile.id(), profile) != null) {
                throw new IllegalArgumentException("Duplicate technique id in catalog: " + profile.id());
            }
        }
        this.techniques = Collections.unmodifiableMap(byId);
    }

    /**
     * Parse a catalog document.
     *
     * @param in           the JSON stream
     * @param objectMapper mapper used to read the tree
     * @return the loaded catalog
     * @throws IOException if the stream is not valid JSON
     */
    public static TechniqueCatalog load(InputStream in, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (!root.isArray()) {
            throw new IllegalArgumentException("Technique catalog must be a JSON array");
        }

        List<TechniqueProfile> profiles = new ArrayList<>();
        for (JsonNode node : root) {
            List<String> tactics = new ArrayList<>();
            node.path("tactics").forEach(t -> tactics.add(t.asText()));
            profiles.add(new TechniqueProfile(
                    node.path("id").asText(""),
                    node.path("name").asText(null),
                    SourceTag.fromWireValue(node.path("source_tag").asText("")),
                    tactics,
                    node.path("description").asText("")));
        }

        TechniqueCatalog catalog = new TechniqueCatalog(profiles);
        log.info("Technique catalog loaded: {} techniques ({} agentic) across {} tactics",
                catalog.size(), catalog.all().stream().filter(TechniqueProfile::isAgentic).count(),
                catalog.tactics().size());
        return catalog;
    }

    public List<TechniqueProfile> all() {
        return List.copyOf(techniques.values());
    }

    public Optional<TechniqueProfile> find(String id) {
        return Optional.ofNullable(techniques.get(id));
    }

    public int size() {
        return techniques.size();
    }

    /** Every tactic label used by at least one technique, sorted. */
    public Set<String> tactics() {
        Set<String> tactics = new TreeSet<>();
        techniques.values().forEach(t -> tactics.addAll(t.tactics()));
        return tactics;
    }
}
