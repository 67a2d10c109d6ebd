package ai.svcs.llm;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.SemanticEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns a provider reply into interpretive events. The JSON array may be fenced or bare; items with a type outside
 * the interpretable subset or below the confidence floor are dropped.
 */
public final class ResponseParser {
    private static final Logger logger = LogManager.getLogger(ResponseParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(\\[.*?])\\s*```", Pattern.DOTALL);

    private final double minConfidence;

    public ResponseParser(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    /**
     * Parses {@code reply}; empty when no JSON array can be read from it.
     *
     * @param path file path, used for the location and as fallback node id {@code module:<path>}
     */
    public Optional<List<SemanticEvent>> parse(String reply, String path) {
        var json = locateArray(reply);
        if (json == null) {
            logger.debug("No JSON array in provider reply for {}", path);
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable provider reply for {}: {}", path, e.getOriginalMessage());
            return Optional.empty();
        }
        if (!root.isArray()) {
            return Optional.empty();
        }

        var events = new ArrayList<SemanticEvent>();
        for (var item : root) {
            if (!item.isObject()) {
                continue;
            }
            var typeName = text(item, "event_type", text(item, "change_type", ""));
            var type = EventType.fromWireName(typeName).filter(EventType::isInterpretable);
            if (type.isEmpty()) {
                logger.debug("Dropping reply item with type '{}'", typeName);
                continue;
            }
            double confidence = SemanticEvent.clamp(confidence(item.get("confidence")));
            if (confidence < minConfidence) {
                continue;
            }
            var nodeId = text(item, "node_id", "");
            if (nodeId.isBlank()) {
                nodeId = "module:" + path;
            }
            events.add(new SemanticEvent(
                    type.get(),
                    nodeId,
                    path,
                    Layer.INTERPRETIVE,
                    confidence,
                    text(item, "description", type.get().wireName()),
                    nullableText(item, "reasoning"),
                    nullableText(item, "impact")));
        }
        return Optional.of(events);
    }

    static @Nullable String locateArray(String reply) {
        var fenced = FENCE.matcher(reply);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = reply.indexOf('[');
        int end = reply.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return null;
        }
        return reply.substring(start, end + 1);
    }

    private static double confidence(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String text(JsonNode item, String field, String fallback) {
        var value = item.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static @Nullable String nullableText(JsonNode item, String field) {
        var value = item.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }
}
