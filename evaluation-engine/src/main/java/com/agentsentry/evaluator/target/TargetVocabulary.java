package com.agentsentry.evaluator.target;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword tables shared by target discovery and relevance scoring.
 *
 * <p>
 * Each table maps a normalized label (capability flag, domain tag, platform)
 * to the keywords that indicate it in free text.
 * </p>
 *
 * @author Naveed Gung
 */
public final class TargetVocabulary {

    public static final Map<String, List<String>> CAPABILITY_KEYWORDS = ordered(
            "command_execution", List.of("shell", "command", "exec", "terminal", "bash", "powershell"),
            "code_execution", List.of("python", "code", "script", "interpreter"),
            "file_system", List.of("file", "filesystem", "directory", "folder", "disk"),
            "network", List.of("http", "network", "browse", "fetch", "url", "download"),
            "credentials", List.of("credential", "password", "secret", "token", "api key", "vault"),
            "messaging", List.of("email", "message", "slack", "sms", "chat"),
            "payments", List.of("payment", "transfer", "wallet", "invoice", "purchase"),
            "memory", List.of("memory", "remember", "knowledge base", "context", "rag"),
            "device_control", List.of("device", "iot", "thermostat", "lock", "smart home", "camera"));

    public static final Map<String, List<String>> DOMAIN_KEYWORDS = ordered(
            "finance", List.of("bank", "finance", "financial", "payment", "trading", "invoice"),
            "healthcare", List.of("patient", "medical", "health", "clinical"),
            "devops", List.of("deploy", "kubernetes", "pipeline", "server", "infrastructure", "cloud"),
            "home-automation", List.of("home", "thermostat", "light", "door", "smart"),
            "customer-support", List.of("ticket", "support", "customer", "helpdesk"),
            "software-development", List.of("repository", "git", "pull request", "source code", "build"),
            "data-analytics", List.of("database", "sql", "analytics", "report", "dataset"));

    public static final Map<String, List<String>> PLATFORM_KEYWORDS = ordered(
            "linux", List.of("linux", "unix", "bash", "cron", "systemd"),
            "windows", List.of("windows", "powershell", "registry", "wmi"),
            "macos", List.of("macos", "osx", "launchd", "apple"),
            "cloud", List.of("cloud", "aws", "azure", "gcp", "iaas", "saas"),
            "containers", List.of("container", "docker", "kubernetes", "pod"),
            "web", List.of("web", "browser", "http", "url"),
            "llm", List.of("llm", "language model", "prompt", "model", "agent"));

    /** Capabilities whose abuse has direct, hard-to-reverse impact. */
    public static final Set<String> HIGH_IMPACT_CAPABILITIES = Set.of(
            "command_execution", "code_execution", "credentials", "payments", "device_control");

    /** Capabilities that let a target act on its own environment. */
    public static final Set<String> TOOL_CAPABILITIES = Set.of(
            "command_execution", "code_execution", "file_system", "payments", "device_control");

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private TargetVocabulary() {
    }

    /** True when any keyword of {@code label} in {@code table} occurs in {@code text}. */
    public static boolean mentions(Map<String, List<String>> table, String label, String text) {
        List<String> keywords = table.get(label);
        if (keywords == null) {
            return matches(label.toLowerCase(Locale.ROOT).replace('_', ' '), text);
        }
        for (String keyword : keywords) {
            if (matches(keyword, text)) {
                return true;
            }
        }
        return false;
    }

    /** Keyword match anchored at a word start, so "lock" does not match "block". */
    public static boolean matches(String keyword, String text) {
        return PATTERNS.computeIfAbsent(keyword, k -> Pattern.compile("\\b" + Pattern.quote(k)))
                .matcher(text)
                .find();
    }

    /** Labels of {@code table} whose keywords occur in {@code text}. */
    public static Set<String> labelsIn(Map<String, List<String>> table, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> labels = new TreeSet<>();
        table.keySet().forEach(label -> {
            if (mentions(table, label, lower)) {
                labels.add(label);
            }
        });
        return labels;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<String>> ordered(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (List<String>) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
