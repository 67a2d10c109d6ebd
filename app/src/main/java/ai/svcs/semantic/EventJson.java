package ai.svcs.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;

/**
 * JSON form of the output contract:
 * {@code {event_type, node_id, location, layer, confidence, details, reasoning, impact}}.
 */
public final class EventJson {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final ObjectMapper prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private EventJson() {}

    public static String toJson(List<SemanticEvent> events, boolean pretty) {
        try {
            return (pretty ? prettyMapper : objectMapper).writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize events", e);
        }
    }

    public static String toJson(SemanticEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    /** Reads a list written by {@link #toJson(List, boolean)}. */
    public static List<SemanticEvent> fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, new TypeReference<List<SemanticEvent>>() {});
    }
}
