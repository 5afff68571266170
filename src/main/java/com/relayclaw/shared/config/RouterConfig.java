package com.relayclaw.shared.config;

import java.util.Map;

/**
 * Outbound rewrite options: headers injected into every upstream request and the
 * optional system prompt replacement.
 */
public record RouterConfig(
    Map<String, String> customHeaders,
    String systemPromptReplacement,
    String systemPromptKeyword,
    boolean insertIfMissing
) {
    public RouterConfig {
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
        if (systemPromptKeyword == null || systemPromptKeyword.isBlank()) {
            systemPromptKeyword = "Claude Code";
        }
    }

    public boolean replacesSystemPrompt() {
        return systemPromptReplacement != null && !systemPromptReplacement.isEmpty();
    }

    public static RouterConfig defaults() {
        return new RouterConfig(Map.of(), null, "Claude Code", false);
    }
}
