package com.relayclaw.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayclaw.shared.config.ModelMapping;

import java.util.Arrays;
import java.util.Locale;

/**
 * Rewrites the {@code model} field of a request body: per-provider mapping for Claude
 * requests, date-suffix stripping for {@code gpt-*} names on OpenAI-style requests.
 */
final class ModelRewriter {

    enum ModelFamily { CLAUDE, OPENAI, GEMINI, LLAMA, QWEN, MISTRAL, DEEPSEEK, OTHER }

    private ModelRewriter() {}

    /** Applies the provider's mapping in place. Returns true when the model changed. */
    static boolean applyMapping(ObjectNode body, ModelMapping mapping) {
        if (mapping == null || mapping.isEmpty()) return false;
        var model = body.get("model");
        if (model == null || !model.isTextual()) return false;
        var original = model.asText();
        var mapped = map(original, thinkingEnabled(body), mapping);
        if (mapped.equals(original)) return false;
        body.put("model", mapped);
        return true;
    }

    /** Strips a release date from a {@code gpt-*} model field in place. */
    static boolean sanitizeModel(ObjectNode body) {
        var model = body.get("model");
        if (model == null || !model.isTextual()) return false;
        var original = model.asText();
        var sanitized = sanitizeGpt(original);
        if (sanitized.equals(original)) return false;
        body.put("model", sanitized);
        return true;
    }

    /**
     * Picks the mapped model: reasoning first when thinking is enabled, then the tier
     * (haiku, opus, sonnet), then the default. A target is skipped when it leaves the
     * requested model's family or switches Claude tier.
     */
    static String map(String original, boolean thinking, ModelMapping mapping) {
        var lower = original.toLowerCase(Locale.ROOT);
        if (thinking && acceptable(original, mapping.reasoning())) return mapping.reasoning();
        if (lower.contains("haiku") && acceptable(original, mapping.haiku())) return mapping.haiku();
        if (lower.contains("opus") && acceptable(original, mapping.opus())) return mapping.opus();
        if (lower.contains("sonnet") && acceptable(original, mapping.sonnet())) return mapping.sonnet();
        if (acceptable(original, mapping.defaultModel())) return mapping.defaultModel();
        return original;
    }

    static boolean acceptable(String original, String mapped) {
        if (mapped == null) return false;
        var from = familyOf(original);
        if (from != ModelFamily.OTHER && from != familyOf(mapped)) return false;
        if (from == ModelFamily.CLAUDE) {
            var tier = claudeTier(original.toLowerCase(Locale.ROOT));
            var mappedLower = mapped.toLowerCase(Locale.ROOT);
            if (tier != null) return claudeTier(mappedLower) == null || mappedLower.contains(tier);
        }
        return true;
    }

    static ModelFamily familyOf(String model) {
        var lower = model.trim().toLowerCase(Locale.ROOT);
        var name = lower.substring(lower.lastIndexOf('/') + 1);
        if (name.contains("claude")) return ModelFamily.CLAUDE;
        if (name.startsWith("gpt-") || name.equals("chatgpt") || name.startsWith("o1")
                || name.startsWith("o3") || name.startsWith("o4") || name.startsWith("o5")) {
            return ModelFamily.OPENAI;
        }
        if (name.contains("gemini")) return ModelFamily.GEMINI;
        if (name.contains("llama")) return ModelFamily.LLAMA;
        if (name.contains("qwen")) return ModelFamily.QWEN;
        if (name.contains("mistral") || name.contains("mixtral")) return ModelFamily.MISTRAL;
        if (name.contains("deepseek")) return ModelFamily.DEEPSEEK;
        return ModelFamily.OTHER;
    }

    /**
     * {@code gpt-5.2-2025-12-11} and {@code gpt-5.2-20251211} become {@code gpt-5.2};
     * legacy {@code gpt-4-0613} becomes {@code gpt-4}. Other names pass through.
     */
    static String sanitizeGpt(String model) {
        var trimmed = model.trim();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith("gpt-")) return trimmed;
        var parts = trimmed.split("-");
        for (int i = 0; i < parts.length; i++) {
            if (isCompactDate(parts[i]) || isYear(parts[i]) || isMonthDay(parts[i])) {
                return String.join("-", Arrays.copyOfRange(parts, 0, i));
            }
        }
        var cut = trimmed.toLowerCase(Locale.ROOT).indexOf("-202");
        return cut > 0 ? trimmed.substring(0, cut) : trimmed;
    }

    private static boolean thinkingEnabled(ObjectNode body) {
        JsonNode thinking = body.get("thinking");
        return thinking != null && "enabled".equals(thinking.path("type").asText(null));
    }

    private static String claudeTier(String lower) {
        if (lower.contains("haiku")) return "haiku";
        if (lower.contains("sonnet")) return "sonnet";
        if (lower.contains("opus")) return "opus";
        return null;
    }

    private static boolean isDigits(String s, int len) {
        return s.length() == len && s.chars().allMatch(Character::isDigit);
    }

    private static boolean isCompactDate(String s) {
        return isDigits(s, 8) && s.startsWith("20");
    }

    private static boolean isYear(String s) {
        if (!isDigits(s, 4)) return false;
        int y = Integer.parseInt(s);
        return y >= 2000 && y <= 2099;
    }

    // gpt-4-0613 / gpt-4-1106
    private static boolean isMonthDay(String s) {
        if (!isDigits(s, 4)) return false;
        int mm = Integer.parseInt(s.substring(0, 2));
        int dd = Integer.parseInt(s.substring(2));
        return mm >= 1 && mm <= 12 && dd >= 1 && dd <= 31;
    }
}
