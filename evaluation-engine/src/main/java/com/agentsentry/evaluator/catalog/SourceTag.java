package com.agentsentry.evaluator.catalog;

/**
 * Origin classification of a catalogued technique.
 *
 * <p>
 * Wire values are the {@code source_tag} strings of the technique catalog
 * document.
 * </p>
 *
 * @author Naveed Gung
 */
public enum SourceTag {

    ENTERPRISE("enterprise", "Broad IT technique"),
    AGENTIC("agentic", "AI or agent-specific technique");

    private final String wireValue;
    private final String description;

    SourceTag(String wireValue, String description) {
        this.wireValue = wireValue;
        this.description = description;
    }

    public String getWireValue() {
        return wireValue;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Decode from the catalog representation.
     *
     * @param value source tag string from the catalog
     * @return the corresponding SourceTag
     * @throws IllegalArgumentException if the value is unknown
     */
    public static SourceTag fromWireValue(String value) {
        for (SourceTag tag : values()) {
            if (tag.wireValue.equalsIgnoreCase(value)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown technique source tag: " + value);
    }
}
