package com.relayclaw.shared.config;

import java.util.Map;

/**
 * Per-provider model rewrite for Claude traffic. Each field names the upstream model that
 * replaces a requested model of that tier; {@code defaultModel} covers anything not matched
 * by a tier, {@code reasoning} wins whenever extended thinking is enabled.
 */
public record ModelMapping(
    String haiku,
    String sonnet,
    String opus,
    String defaultModel,
    String reasoning
) {
    private static final ModelMapping NONE = new ModelMapping(null, null, null, null, null);

    public ModelMapping {
        haiku = blankToNull(haiku);
        sonnet = blankToNull(sonnet);
        opus = blankToNull(opus);
        defaultModel = blankToNull(defaultModel);
        reasoning = blankToNull(reasoning);
    }

    public static ModelMapping none() {
        return NONE;
    }

    /**
     * Reads either the short keys ({@code haiku}, {@code default}, ...) or the
     * {@code ANTHROPIC_*} environment names used by Claude clients.
     */
    public static ModelMapping fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) return NONE;
        return new ModelMapping(
            pick(raw, "haiku", "ANTHROPIC_DEFAULT_HAIKU_MODEL"),
            pick(raw, "sonnet", "ANTHROPIC_DEFAULT_SONNET_MODEL"),
            pick(raw, "opus", "ANTHROPIC_DEFAULT_OPUS_MODEL"),
            pick(raw, "default", "ANTHROPIC_MODEL"),
            pick(raw, "reasoning", "ANTHROPIC_REASONING_MODEL")
        );
    }

    public boolean isEmpty() {
        return haiku == null && sonnet == null && opus == null && defaultModel == null && reasoning == null;
    }

    private static String pick(Map<String, Object> raw, String shortKey, String envKey) {
        var v = raw.containsKey(shortKey) ? raw.get(shortKey) : raw.get(envKey);
        return v == null ? null : String.valueOf(v);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
