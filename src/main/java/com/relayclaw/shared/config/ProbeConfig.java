package com.relayclaw.shared.config;

import com.relayclaw.shared.model.AppFamily;

import java.util.EnumMap;
import java.util.Map;

public record ProbeConfig(
    boolean enabled,
    long cacheTtlSeconds,
    long timeoutSeconds,
    Map<AppFamily, String> models
) {
    public ProbeConfig {
        var merged = new EnumMap<AppFamily, String>(defaultModels());
        if (models != null) merged.putAll(models);
        models = Map.copyOf(merged);
    }

    public String modelFor(AppFamily family) {
        return models.get(family);
    }

    public static ProbeConfig defaults() {
        return new ProbeConfig(true, 60, 15, Map.of());
    }

    private static Map<AppFamily, String> defaultModels() {
        var m = new EnumMap<AppFamily, String>(AppFamily.class);
        m.put(AppFamily.CLAUDE, "claude-3-5-haiku-latest");
        m.put(AppFamily.CODEX, "gpt-4o-mini");
        m.put(AppFamily.GEMINI, "gemini-2.0-flash");
        return m;
    }
}
