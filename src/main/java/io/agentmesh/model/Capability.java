package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of capability tags an agent can advertise.
 *
 * <p>Each tag belongs to a family. Selection first looks for the exact tag and widens to
 * the tag's family when no exact idle agent is available.
 */
public enum Capability {
    ECHO("echo", "echo"),
    ANALYSIS("analysis", "reasoning"),
    PLANNING("planning", "reasoning"),
    CODE_GENERATION("code_generation", "code"),
    TESTING("testing", "code"),
    SEARCH("search", "research"),
    SUMMARIZATION("summarization", "research"),
    SYSTEM_OPERATIONS("system_operations", "system"),
    FILE_MANAGEMENT("file_management", "system"),
    MEMORY("memory", "memory"),
    GENERAL_PROCESSING("general_processing", "general"),
    DIAGNOSTICS("diagnostics", "diagnostics");

    private final String tag;
    private final String family;

    Capability(String tag, String family) {
        this.tag = tag;
        this.family = family;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String family() {
        return family;
    }

    public boolean sameFamily(Capability other) {
        return other != null && family.equals(other.family);
    }

    @JsonCreator
    public static Capability fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Capability tag cannot be empty");
        }
        String normalized = raw.trim();
        for (Capability value : values()) {
            if (value.tag.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown capability: " + raw);
    }
}
