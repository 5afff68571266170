package com.relayclaw.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayclaw.shared.config.RouterConfig;
import com.relayclaw.shared.model.AppFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Moves caller-supplied system instructions into the field each family's upstream expects:
 * <ul>
 *   <li>CLAUDE: top-level {@code system}, a string or an array of text blocks</li>
 *   <li>CODEX: a {@code role: system} message at the head of {@code messages}
 *       (the Responses API keeps its {@code instructions} field)</li>
 *   <li>GEMINI: top-level {@code systemInstruction} of shape {@code {parts:[{text}]}}</li>
 * </ul>
 * All methods mutate the given body in place and return whether anything changed.
 */
final class SystemInstructions {

    private static final Logger log = LoggerFactory.getLogger(SystemInstructions.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SystemInstructions() {}

    static boolean relocate(ObjectNode body, AppFamily family) {
        return switch (family) {
            case CLAUDE -> toClaude(body);
            case CODEX -> toCodex(body);
            case GEMINI -> toGemini(body);
        };
    }

    /**
     * Rewrites the first text block of the CLAUDE {@code system} array. With insert-if-missing
     * the block is only replaced when it mentions the keyword; otherwise a new cacheable block
     * is inserted in front.
     */
    static boolean applyReplacement(ObjectNode body, RouterConfig config) {
        if (!config.replacesSystemPrompt()) return false;
        var system = body.get("system");
        if (!(system instanceof ArrayNode array) || array.isEmpty()) return false;
        if (!(array.get(0) instanceof ObjectNode first) || !first.has("text")) return false;

        var original = first.get("text").asText();
        var replacement = config.systemPromptReplacement();
        if (config.insertIfMissing()
                && !original.toLowerCase(Locale.ROOT).contains(config.systemPromptKeyword().toLowerCase(Locale.ROOT))) {
            var block = NODES.objectNode();
            block.put("type", "text");
            block.put("text", replacement);
            block.putObject("cache_control").put("type", "ephemeral");
            array.insert(0, block);
            log.debug("System prompt keyword not found, inserted replacement block");
        } else {
            first.put("text", replacement);
            log.debug("System prompt block replaced");
        }
        return true;
    }

    private static boolean toClaude(ObjectNode body) {
        var hoisted = new ArrayList<String>();
        hoisted.addAll(takeSystemMessages(body));
        hoisted.addAll(takeGeminiInstruction(body));
        if (hoisted.isEmpty()) return false;

        var blocks = NODES.arrayNode();
        var existing = body.get("system");
        if (existing != null && existing.isTextual()) {
            blocks.add(textBlock(existing.asText()));
        } else if (existing instanceof ArrayNode array) {
            blocks.addAll(array);
        }
        hoisted.forEach(t -> blocks.add(textBlock(t)));
        body.set("system", blocks);
        return true;
    }

    private static boolean toCodex(ObjectNode body) {
        var texts = new ArrayList<String>();
        var system = body.remove("system");
        if (system != null) texts.addAll(texts(system));
        texts.addAll(takeGeminiInstruction(body));
        if (texts.isEmpty()) return system != null;

        var joined = String.join("\n\n", texts);
        if (!body.has("messages") && (body.has("input") || body.has("instructions"))) {
            // Responses API
            var current = body.path("instructions").asText("");
            body.put("instructions", current.isEmpty() ? joined : joined + "\n\n" + current);
            return true;
        }
        var messages = body.has("messages") && body.get("messages").isArray()
                ? (ArrayNode) body.get("messages") : body.putArray("messages");
        var message = NODES.objectNode();
        message.put("role", "system");
        message.put("content", joined);
        messages.insert(0, message);
        return true;
    }

    private static boolean toGemini(ObjectNode body) {
        boolean changed = false;
        var texts = new ArrayList<String>();
        var snake = body.remove("system_instruction");
        if (snake != null) {
            changed = true;
            if (!body.has("systemInstruction")) {
                body.set("systemInstruction", snake);
            } else {
                texts.addAll(texts(snake.path("parts")));
            }
        }
        var system = body.remove("system");
        if (system != null) {
            changed = true;
            texts.addAll(texts(system));
        }
        if (texts.isEmpty()) return changed;

        var instruction = body.has("systemInstruction") && body.get("systemInstruction").isObject()
                ? (ObjectNode) body.get("systemInstruction") : body.putObject("systemInstruction");
        var parts = instruction.has("parts") && instruction.get("parts").isArray()
                ? (ArrayNode) instruction.get("parts") : instruction.putArray("parts");
        texts.forEach(t -> parts.addObject().put("text", t));
        return true;
    }

    private static List<String> takeSystemMessages(ObjectNode body) {
        var out = new ArrayList<String>();
        if (!(body.get("messages") instanceof ArrayNode messages)) return out;
        for (int i = messages.size() - 1; i >= 0; i--) {
            var m = messages.get(i);
            if ("system".equals(m.path("role").asText())) {
                out.add(0, String.join("\n\n", texts(m.path("content"))));
                messages.remove(i);
            }
        }
        return out;
    }

    private static List<String> takeGeminiInstruction(ObjectNode body) {
        var out = new ArrayList<String>();
        for (var field : List.of("systemInstruction", "system_instruction")) {
            var node = body.remove(field);
            if (node != null) out.addAll(texts(node.path("parts")));
        }
        return out;
    }

    /** Text of a string, an array of strings or text blocks, or a parts array. */
    static List<String> texts(JsonNode node) {
        var out = new ArrayList<String>();
        if (node == null || node.isMissingNode() || node.isNull()) return out;
        if (node.isTextual()) {
            if (!node.asText().isEmpty()) out.add(node.asText());
            return out;
        }
        if (node.isArray()) {
            for (var item : node) {
                if (item.isTextual()) out.add(item.asText());
                else if (item.has("text")) out.add(item.get("text").asText());
            }
        } else if (node.has("text")) {
            out.add(node.get("text").asText());
        }
        return out;
    }

    private static ObjectNode textBlock(String text) {
        var block = NODES.objectNode();
        block.put("type", "text");
        block.put("text", text);
        return block;
    }
}
