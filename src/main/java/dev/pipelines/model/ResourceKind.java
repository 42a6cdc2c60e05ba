package dev.pipelines.model;

import java.util.Locale;

/**
 * The kind of unit a resource name refers to. {@link #UNKNOWN} is only valid
 * between parsing and resource resolution.
 */
public enum ResourceKind {
    AGENT("agent"),
    WORKFLOW("workflow"),
    FUNCTION("function"),
    UNKNOWN("unknown");

    private final String label;

    ResourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Label with the first letter capitalised, e.g. {@code Agent}. */
    public String displayName() {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    /**
     * Parse a kind from its label, ignoring case. Accepts the plural form used
     * by grouped resource tables ({@code agents}, {@code workflows}, ...).
     */
    public static ResourceKind fromLabel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.label.equals(normalized) || (kind.label + "s").equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resource kind: " + value);
    }
}
