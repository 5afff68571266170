package com.relayclaw.shared.model;

import java.util.Locale;

/**
 * Upstream wire-protocol families the proxy understands. Every provider, selection
 * and routing decision is scoped to exactly one of them.
 */
public enum AppFamily {
    CLAUDE("/claude"),
    CODEX("/codex"),
    GEMINI("/gemini");

    private final String pathPrefix;

    AppFamily(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    public String pathPrefix() {
        return pathPrefix;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AppFamily parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Application family is required");
        }
        var v = value.trim().toLowerCase(Locale.ROOT);
        for (var f : values()) {
            if (f.id().equals(v)) return f;
        }
        // 兼容别名
        return switch (v) {
            case "a", "anthropic" -> CLAUDE;
            case "b", "openai" -> CODEX;
            case "c", "google" -> GEMINI;
            default -> throw new IllegalArgumentException("Unknown application family: " + value);
        };
    }
}
