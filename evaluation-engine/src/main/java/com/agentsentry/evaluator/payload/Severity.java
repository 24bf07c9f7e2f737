package com.agentsentry.evaluator.payload;

import java.util.Collection;
import java.util.Locale;

/**
 * Payload severity derived from tactic criticality.
 *
 * @author Naveed Gung
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /** Severity of a single tactic label. */
    public static Severity forTactic(String tactic) {
        if (tactic == null) {
            return LOW;
        }
        return switch (tactic.toLowerCase(Locale.ROOT)) {
            case "exfiltration", "privilege-escalation" -> CRITICAL;
            case "persistence", "credential-access" -> HIGH;
            case "defense-evasion", "discovery" -> MEDIUM;
            default -> LOW;
        };
    }

    /** Highest severity among the given tactics; LOW when there are none. */
    public static Severity forTactics(Collection<String> tactics) {
        Severity worst = LOW;
        for (String tactic : tactics) {
            Severity s = forTactic(tactic);
            if (s.ordinal() < worst.ordinal()) {
                worst = s;
            }
        }
        return worst;
    }
}
